package com.enterprise.azure.support;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/**
 * Blocking access to the non-blocking operations.
 *
 * The async methods are the primary contract; the blocking overloads on the
 * services wait here and rethrow the failure the async path would have
 * completed with, not the {@link CompletionException} around it.
 */
public final class Futures {

    private Futures() {
    }

    public static <T> T await(CompletionStage<T> stage) {
        try {
            return stage.toCompletableFuture().join();
        } catch (CompletionException e) {
            throw asUnchecked(unwrap(e));
        }
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException asUnchecked(Throwable error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        if (error instanceof Error fatal) {
            throw fatal;
        }
        return new CompletionException(error);
    }
}

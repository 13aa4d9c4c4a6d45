package com.enterprise.azure.cosmos;

import com.azure.cosmos.CosmosException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies Cosmos failures.
 *
 * The {@link CosmosException} is not always the failure handed back: futures
 * wrap it in CompletionException/ExecutionException and Reactor may wrap it or
 * fold several errors into a composite. The whole cause chain, including the
 * members of composites, is searched.
 */
public final class CosmosThrottling {

    public static final int TOO_MANY_REQUESTS = 429;
    public static final int NOT_FOUND = 404;
    public static final int CONFLICT = 409;

    private CosmosThrottling() {
    }

    public static Optional<CosmosException> findCosmosException(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Throwable> pending = new ArrayDeque<>();
        if (error != null) {
            pending.add(error);
        }

        while (!pending.isEmpty()) {
            Throwable current = pending.poll();
            if (!seen.add(current)) {
                continue;
            }
            if (current instanceof CosmosException cosmosException) {
                return Optional.of(cosmosException);
            }
            if (Exceptions.isMultiple(current)) {
                pending.addAll(Exceptions.unwrapMultiple(current));
            }
            if (current.getCause() != null) {
                pending.add(current.getCause());
            }
        }
        return Optional.empty();
    }

    public static boolean isThrottled(Throwable error) {
        return findCosmosException(error)
            .map(e -> e.getStatusCode() == TOO_MANY_REQUESTS)
            .orElse(false);
    }

    public static boolean isNotFound(Throwable error) {
        return findCosmosException(error)
            .map(e -> e.getStatusCode() == NOT_FOUND)
            .orElse(false);
    }

    public static boolean isConflict(Throwable error) {
        return findCosmosException(error)
            .map(e -> e.getStatusCode() == CONFLICT)
            .orElse(false);
    }

    /**
     * Server-advised wait before the next attempt, zero when none was sent.
     */
    public static Duration retryAfter(Throwable error) {
        return findCosmosException(error)
            .map(CosmosException::getRetryAfterDuration)
            .orElse(Duration.ZERO);
    }

    /**
     * Status code for logging, "unknown" when the failure did not come from Cosmos.
     */
    public static String describeStatus(Throwable error) {
        return findCosmosException(error)
            .map(e -> String.valueOf(e.getStatusCode()))
            .orElse("unknown");
    }
}

package com.enterprise.azure.cosmos;

import com.azure.cosmos.CosmosAsyncContainer;
import com.azure.cosmos.models.CosmosItemRequestOptions;
import com.azure.cosmos.models.PartitionKey;
import com.enterprise.azure.config.CosmosProperties;
import com.enterprise.azure.support.Futures;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Throttled Insert Executor
 *
 * 5W1H Analysis:
 * WHO: View-model repositories inserting documents
 * WHAT: Runs one insert with a bounded retry budget (default 3 attempts)
 * WHEN: Every insert; replace and delete are not routed through here
 * WHERE: Cosmos DB containers under request-unit rate limiting
 * WHY: 429 is the one failure the backend marks as "try again later"
 * HOW: Resilience4j Retry, waiting the server's retry-after on a scheduler
 *
 * Outcomes:
 * - Success: returned at once, no further attempts
 * - 429: warning logged, retried after the advised interval
 * - Any other failure: error logged, original exception propagated, no retry
 * - Budget spent on 429s: {@link RetryBudgetExhaustedException} with the last 429 as cause
 *
 * The budget is per call. The backoff never blocks a thread; the next attempt
 * is scheduled on the insert-retry scheduler.
 */
@Component
@ConditionalOnProperty(prefix = "azure.cosmos", name = "endpoint")
@Slf4j
public class ThrottledInsertExecutor {

    public static final String RETRY_NAME = "cosmosInsert";

    private final Retry retry;
    private final ScheduledExecutorService scheduler;
    private final int maxAttempts;

    public ThrottledInsertExecutor(RetryRegistry retryRegistry,
                                   ScheduledExecutorService insertRetryScheduler,
                                   CosmosProperties properties) {
        this.maxAttempts = properties.getInsertRetry().getMaxAttempts();
        this.scheduler = insertRetryScheduler;

        // The registry would hand back an existing instance and ignore the config below
        if (retryRegistry.find(RETRY_NAME).isPresent()) {
            throw new IllegalStateException("Retry instance '" + RETRY_NAME + "' is already registered; "
                + "insert retries are configured through azure.cosmos.insert-retry only");
        }

        RetryConfig config = RetryConfig.<Object>custom()
            .maxAttempts(maxAttempts)
            .retryOnException(CosmosThrottling::isThrottled)
            .intervalBiFunction((attempt, outcome) -> backoffMillis(outcome))
            .build();
        this.retry = retryRegistry.retry(RETRY_NAME, config);
    }

    public <T extends ViewModel> CompletableFuture<Void> insertAsync(CosmosAsyncContainer container, T item) {
        return execute(item.getId(), () -> container
            .createItem(item, new PartitionKey(item.partitionKey()), new CosmosItemRequestOptions())
            .then()
            .toFuture());
    }

    public <T extends ViewModel> void insert(CosmosAsyncContainer container, T item) {
        Futures.await(insertAsync(container, item));
    }

    /**
     * Runs {@code write} under the retry budget.
     *
     * @param itemId used for logging only
     * @param write  starts one attempt each time it is called
     */
    public <T> CompletableFuture<T> execute(String itemId, Supplier<CompletionStage<T>> write) {
        CompletableFuture<T> result = new CompletableFuture<>();

        Retry.decorateCompletionStage(retry, scheduler, () -> attempt(itemId, write))
            .get()
            .whenComplete((value, error) -> {
                if (error == null) {
                    result.complete(value);
                    return;
                }
                Throwable cause = Futures.unwrap(error);
                if (CosmosThrottling.isThrottled(cause)) {
                    log.error("Maximum retries exceeded inserting {}: attempts={}", itemId, maxAttempts);
                    result.completeExceptionally(new RetryBudgetExhaustedException(itemId, maxAttempts, cause));
                } else {
                    result.completeExceptionally(cause);
                }
            });

        return result;
    }

    private <T> CompletionStage<T> attempt(String itemId, Supplier<CompletionStage<T>> write) {
        CompletableFuture<T> outcome = new CompletableFuture<>();

        CompletionStage<T> stage;
        try {
            stage = write.get();
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, error) -> {
            if (error == null) {
                outcome.complete(value);
                return;
            }
            Throwable cause = Futures.unwrap(error);
            if (CosmosThrottling.isThrottled(cause)) {
                log.warn("429 http code inserting {}: retryAfterMs={}",
                    itemId, CosmosThrottling.retryAfter(cause).toMillis());
            } else {
                log.error("{} http code inserting {}: {}",
                    CosmosThrottling.describeStatus(cause), itemId, cause.toString());
            }
            outcome.completeExceptionally(cause);
        });

        return outcome;
    }

    // Resilience4j ends the retry on an interval below 1 ms, so a zero hint still waits 1 ms
    private static long backoffMillis(Either<Throwable, Object> outcome) {
        if (!outcome.isLeft()) {
            return 1L;
        }
        Duration retryAfter = CosmosThrottling.retryAfter(outcome.getLeft());
        return Math.max(1L, retryAfter.toMillis());
    }

    /**
     * Every attempt was throttled. Distinct from the 429 itself so callers can
     * tell that retries were made and spent.
     */
    public static class RetryBudgetExhaustedException extends RuntimeException {

        private final int attempts;

        public RetryBudgetExhaustedException(String itemId, int attempts, Throwable lastError) {
            super("Maximum retries exceeded inserting " + itemId + " after " + attempts + " attempts", lastError);
            this.attempts = attempts;
        }

        public int getAttempts() {
            return attempts;
        }
    }
}

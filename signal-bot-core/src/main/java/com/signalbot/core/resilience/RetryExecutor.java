package com.signalbot.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Runs an async operation with exponential backoff.
 *
 * <p>Attempts run 0..maxRetries. A non-retryable failure is surfaced immediately;
 * after the last attempt the last error is surfaced unwrapped.
 */
public final class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final DelayScheduler delayScheduler;

    public RetryExecutor(DelayScheduler delayScheduler) {
        this.delayScheduler = Objects.requireNonNull(delayScheduler, "delayScheduler");
    }

    public static RetryExecutor withSystemDelays() {
        return new RetryExecutor(DelayScheduler.systemDefault());
    }

    public <T> CompletableFuture<T> execute(String operationName,
                                            Supplier<CompletableFuture<T>> operation,
                                            RetryPolicy policy) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operationName, operation, policy, 0, result);
        return result;
    }

    private <T> void attempt(String operationName,
                             Supplier<CompletableFuture<T>> operation,
                             RetryPolicy policy,
                             int attempt,
                             CompletableFuture<T> result) {
        CompletableFuture<T> call;
        try {
            call = operation.get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        int maxAttempts = policy.maxRetries() + 1;
        call.whenComplete((value, failure) -> {
            if (failure == null) {
                if (attempt > 0) {
                    logger.info("✅ {} succeeded on attempt {}/{}", operationName, attempt + 1, maxAttempts);
                }
                result.complete(value);
                return;
            }

            Throwable cause = RetryPolicy.unwrap(failure);
            if (!policy.isRetryable(cause)) {
                logger.debug("{} failed with non-retryable error: {}", operationName, cause.toString());
                result.completeExceptionally(cause);
                return;
            }
            if (attempt >= policy.maxRetries()) {
                logger.error("❌ {} failed after {} attempts: {}", operationName, maxAttempts, cause.getMessage());
                result.completeExceptionally(cause);
                return;
            }

            Duration delay = policy.delayAfterAttempt(attempt);
            logger.warn("⚠️ {} failed (attempt {}/{}): {} - Retrying in {}ms",
                operationName, attempt + 1, maxAttempts, cause.getMessage(), delay.toMillis());
            delayScheduler.delay(delay).whenComplete((ignored, delayFailure) -> {
                if (delayFailure != null) {
                    cause.addSuppressed(delayFailure);
                    result.completeExceptionally(cause);
                } else {
                    attempt(operationName, operation, policy, attempt + 1, result);
                }
            });
        });
    }
}

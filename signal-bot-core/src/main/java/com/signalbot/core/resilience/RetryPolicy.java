package com.signalbot.core.resilience;

import com.signalbot.core.exception.InsufficientHistoryException;
import com.signalbot.core.exception.ProviderConfigurationException;
import com.signalbot.core.exception.ProviderException;
import com.signalbot.core.exception.ResponseValidationException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Exponential backoff parameters and error classification.
 *
 * @param maxRetries          retries after the first attempt, so at most maxRetries + 1 calls
 * @param retryableMessages   lower-case substrings that mark an otherwise unknown error as transient
 */
public record RetryPolicy(
    int maxRetries,
    Duration initialDelay,
    Duration maxDelay,
    double backoffFactor,
    List<String> retryableMessages
) {
    public static final List<String> DEFAULT_RETRYABLE_MESSAGES = List.of(
        "timeout", "timed out", "network", "connection", "rate limit", "too many requests",
        "econnreset", "etimedout");

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1: " + backoffFactor);
        }
        retryableMessages = retryableMessages.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
    }

    /** 3 retries, 1s initial delay doubling up to 30s. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, DEFAULT_RETRYABLE_MESSAGES);
    }

    public RetryPolicy withMaxDelay(Duration newMaxDelay) {
        return new RetryPolicy(maxRetries, initialDelay, newMaxDelay, backoffFactor, retryableMessages);
    }

    public RetryPolicy withMaxRetries(int newMaxRetries) {
        return new RetryPolicy(newMaxRetries, initialDelay, maxDelay, backoffFactor, retryableMessages);
    }

    public RetryPolicy withAdditionalRetryableMessages(String... messages) {
        List<String> merged = new ArrayList<>(retryableMessages);
        merged.addAll(Arrays.asList(messages));
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, backoffFactor, merged);
    }

    /** Delay to wait after the given zero-based attempt failed. */
    public Duration delayAfterAttempt(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(backoffFactor, attempt);
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    /**
     * Transient errors are retried: timeouts, I/O failures, provider errors flagged
     * retryable, and messages matching the configured substrings. Malformed responses
     * and configuration problems are never retried.
     */
    public boolean isRetryable(Throwable throwable) {
        Throwable error = unwrap(throwable);
        if (error instanceof ResponseValidationException
                || error instanceof ProviderConfigurationException
                || error instanceof InsufficientHistoryException) {
            return false;
        }
        if (error instanceof ProviderException providerError) {
            return providerError.isRetryable();
        }
        if (error instanceof TimeoutException || error instanceof IOException) {
            return true;
        }
        String message = error.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return retryableMessages.stream().anyMatch(lower::contains);
    }

    /** Strip the wrappers added by CompletableFuture composition. */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

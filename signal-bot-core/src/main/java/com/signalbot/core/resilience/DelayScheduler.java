package com.signalbot.core.resilience;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Source of non-blocking delays. Swappable so backoff timing can be observed in tests.
 */
@FunctionalInterface
public interface DelayScheduler {

    CompletableFuture<Void> delay(Duration duration);

    static DelayScheduler systemDefault() {
        return duration -> CompletableFuture.runAsync(() -> { },
            CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS));
    }
}

package com.signalbot.core.model;

/**
 * Point-in-time health of one AI provider.
 */
public record ProviderHealth(
    String serviceId,
    boolean ready,
    long requestCount,
    long errorCount,
    String lastError,
    double costAccrued
) {
    public double successRate() {
        if (requestCount == 0) {
            return 0.0;
        }
        return (double) (requestCount - errorCount) / requestCount * 100.0;
    }
}

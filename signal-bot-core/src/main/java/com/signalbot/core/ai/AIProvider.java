package com.signalbot.core.ai;

import com.signalbot.core.model.AIDecision;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter for one external AI service.
 *
 * <p>Implementations turn a {@link PredictionRequest} into a vendor call and parse the
 * reply with {@link AIResponseParser}, so every successful future carries a fully
 * validated decision. Health, rate limiting, retries and failover are handled by
 * {@link AIProviderManager}.
 */
public interface AIProvider extends AutoCloseable {

    /** Stable identifier, e.g. {@code GEMINI}. */
    String serviceId();

    /**
     * Validate settings and build clients.
     *
     * @throws com.signalbot.core.exception.ProviderConfigurationException on missing key or invalid model
     */
    void initialize();

    CompletableFuture<AIDecision> predict(PredictionRequest request);

    /** Cheap connection check; completes with false (or exceptionally) when the service is not usable. */
    CompletableFuture<Boolean> testConnection();

    /** Estimated cost in USD of one call. */
    double costPerCall();

    @Override
    default void close() {
    }
}

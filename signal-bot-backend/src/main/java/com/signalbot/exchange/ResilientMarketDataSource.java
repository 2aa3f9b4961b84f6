package com.signalbot.exchange;

import com.signalbot.core.market.MarketDataSource;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.Timeframe;
import com.signalbot.core.resilience.RateLimitStatus;
import com.signalbot.core.resilience.RateLimiter;
import com.signalbot.core.resilience.RetryExecutor;
import com.signalbot.core.resilience.RetryPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Wraps a {@link MarketDataSource} with resilience patterns.
 *
 * Chain per call: retry -> rate limiter -> circuit breaker -> exchange, with a latency
 * timer and success/failure counters around the whole thing.
 */
public final class ResilientMarketDataSource implements MarketDataSource {
    private static final Logger logger = LoggerFactory.getLogger(ResilientMarketDataSource.class);

    private final MarketDataSource delegate;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;

    public ResilientMarketDataSource(MarketDataSource delegate, RateLimiter rateLimiter,
                                     RetryExecutor retryExecutor, RetryPolicy retryPolicy,
                                     MeterRegistry meterRegistry) {
        this(delegate, rateLimiter, retryExecutor, retryPolicy, meterRegistry, defaultCircuitBreaker());
    }

    ResilientMarketDataSource(MarketDataSource delegate, RateLimiter rateLimiter,
                              RetryExecutor retryExecutor, RetryPolicy retryPolicy,
                              MeterRegistry meterRegistry, CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.meterRegistry = meterRegistry;
        this.circuitBreaker = circuitBreaker;

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.warn("Circuit breaker state changed: {}", event.getStateTransition()));
        rateLimiter.onLowQuota(status ->
            logger.warn("⚠️ Exchange quota low: {}/{} requests left, resets at {}",
                status.remaining(), status.capacity(), status.resetAt()));

        logger.info("ResilientMarketDataSource initialized with circuit breaker, rate limiter, and retry");
    }

    // Open after 50% failures in 10 calls, retry after 30 seconds
    static CircuitBreaker defaultCircuitBreaker() {
        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
        return CircuitBreaker.of("exchange-api", cbConfig);
    }

    @Override
    public CompletableFuture<List<Candle>> fetchCandles(String instrument, Timeframe timeframe,
                                                        Instant since, int limit) {
        return executeResilient("fetchOHLCV", () -> delegate.fetchCandles(instrument, timeframe, since, limit));
    }

    @Override
    public CompletableFuture<Double> fetchPrice(String instrument) {
        return executeResilient("fetchTicker", () -> delegate.fetchPrice(instrument));
    }

    private <T> CompletableFuture<T> executeResilient(String operation, Supplier<CompletableFuture<T>> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Supplier<CompletableFuture<T>> attempt = () -> rateLimiter.acquire()
            .thenCompose(ignored -> CircuitBreaker.<T>decorateCompletionStage(circuitBreaker, call::get).get());

        return retryExecutor.execute(operation, attempt, retryPolicy)
            .whenComplete((result, error) -> {
                sample.stop(Timer.builder("exchange.api.call")
                    .tag("operation", operation)
                    .register(meterRegistry));
                if (error == null) {
                    meterRegistry.counter("exchange.api.success", "operation", operation).increment();
                } else {
                    Throwable cause = RetryPolicy.unwrap(error);
                    meterRegistry.counter("exchange.api.failure",
                        "operation", operation,
                        "error", cause.getClass().getSimpleName()).increment();
                    logger.error("Exchange call failed after retries: {} - {}", operation, cause.getMessage());
                }
            });
    }

    public void resetCircuitBreaker() {
        logger.info("🔄 Manual circuit breaker reset requested");
        circuitBreaker.reset();
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    public RateLimitStatus getRateLimitStatus() {
        return rateLimiter.status();
    }

    public CircuitBreakerMetrics getMetrics() {
        var metrics = circuitBreaker.getMetrics();
        return new CircuitBreakerMetrics(
            metrics.getNumberOfSuccessfulCalls(),
            metrics.getNumberOfFailedCalls(),
            metrics.getFailureRate(),
            circuitBreaker.getState().name()
        );
    }

    public record CircuitBreakerMetrics(
        long successfulCalls,
        long failedCalls,
        float failureRate,
        String state
    ) {}
}

package com.signalbot.exchange;

import com.signalbot.core.exception.ProviderException;
import com.signalbot.core.market.MarketDataSource;
import com.signalbot.core.resilience.RateLimiter;
import com.signalbot.core.resilience.RetryExecutor;
import com.signalbot.core.resilience.RetryPolicy;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Resilient market data source")
class ResilientMarketDataSourceTest {

    @Mock
    private MarketDataSource delegate;

    private ScheduledExecutorService poller;
    private RateLimiter rateLimiter;
    private SimpleMeterRegistry registry;
    private final RetryExecutor immediateRetries =
        new RetryExecutor(delay -> CompletableFuture.completedFuture(null));
    private final RetryPolicy policy = RetryPolicy.defaults();

    @BeforeEach
    void setUp() {
        poller = Executors.newSingleThreadScheduledExecutor();
        rateLimiter = new RateLimiter("exchange-test", 60, Duration.ofMinutes(1), poller, Clock.systemUTC());
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        rateLimiter.close();
        poller.shutdownNow();
    }

    private ResilientMarketDataSource source(CircuitBreaker circuitBreaker) {
        return new ResilientMarketDataSource(delegate, rateLimiter, immediateRetries, policy, registry, circuitBreaker);
    }

    @Test
    @DisplayName("Transient failures are retried and each attempt consumes a token")
    void retriesTransientFailure() {
        when(delegate.fetchPrice("BTC/USDT")).thenReturn(
            CompletableFuture.failedFuture(new ProviderException("EXCHANGE", "EXCHANGE returned HTTP 503: busy", true)),
            CompletableFuture.completedFuture(42000.0));
        var source = source(ResilientMarketDataSource.defaultCircuitBreaker());

        assertThat(source.fetchPrice("BTC/USDT").join()).isEqualTo(42000.0);

        verify(delegate, times(2)).fetchPrice("BTC/USDT");
        assertThat(source.getRateLimitStatus().remaining()).isEqualTo(58);
        assertThat(registry.counter("exchange.api.success", "operation", "fetchTicker").count()).isEqualTo(1.0);
        assertThat(registry.timer("exchange.api.call", "operation", "fetchTicker").count()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Non-retryable failures fail fast and are counted")
    void nonRetryableFailsFast() {
        when(delegate.fetchPrice("BTC/USDT")).thenReturn(
            CompletableFuture.failedFuture(new ProviderException("EXCHANGE", "EXCHANGE returned HTTP 400: bad symbol", false)));
        var source = source(ResilientMarketDataSource.defaultCircuitBreaker());

        assertThatThrownBy(() -> source.fetchPrice("BTC/USDT").join())
            .hasCauseInstanceOf(ProviderException.class);

        verify(delegate, times(1)).fetchPrice("BTC/USDT");
        assertThat(registry.counter("exchange.api.failure",
            "operation", "fetchTicker", "error", "ProviderException").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Open circuit rejects calls without reaching the exchange")
    void openCircuitRejects() {
        CircuitBreaker breaker = CircuitBreaker.of("exchange-test", CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .slidingWindowSize(2)
            .minimumNumberOfCalls(2)
            .waitDurationInOpenState(Duration.ofMinutes(5))
            .build());
        when(delegate.fetchPrice("BTC/USDT")).thenReturn(
            CompletableFuture.failedFuture(new ProviderException("EXCHANGE", "bad request", false)));
        var source = source(breaker);

        for (int i = 0; i < 2; i++) {
            assertThat(source.fetchPrice("BTC/USDT")).isCompletedExceptionally();
        }
        assertThat(source.getCircuitBreakerState()).isEqualTo("OPEN");

        assertThatThrownBy(() -> source.fetchPrice("BTC/USDT").join())
            .hasCauseInstanceOf(CallNotPermittedException.class);
        verify(delegate, times(2)).fetchPrice("BTC/USDT");

        ResilientMarketDataSource.CircuitBreakerMetrics metrics = source.getMetrics();
        assertThat(metrics.failedCalls()).isEqualTo(2);
        assertThat(metrics.state()).isEqualTo("OPEN");

        source.resetCircuitBreaker();
        assertThat(source.getCircuitBreakerState()).isEqualTo("CLOSED");
    }
}

package com.signalbot.core.resilience;

import com.signalbot.core.exception.ProviderConfigurationException;
import com.signalbot.core.exception.ProviderException;
import com.signalbot.core.exception.ResponseValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Retry executor")
class RetryExecutorTest {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        delays.clear();
        executor = new RetryExecutor(duration -> {
            delays.add(duration);
            return CompletableFuture.completedFuture(null);
        });
    }

    @Nested
    @DisplayName("Backoff")
    class Backoff {

        @Test
        @DisplayName("Always-transient failure makes 4 attempts with delays 1s, 2s, 4s")
        void exhaustsWithExponentialDelays() {
            AtomicInteger attempts = new AtomicInteger();
            ProviderException transientError = new ProviderException("EXCHANGE", "timeout", true);

            CompletableFuture<String> result = executor.execute("fetch", () -> {
                attempts.incrementAndGet();
                return CompletableFuture.failedFuture(transientError);
            }, RetryPolicy.defaults());

            assertThatThrownBy(result::join)
                .isInstanceOf(CompletionException.class)
                .hasCause(transientError);
            assertThat(attempts).hasValue(4);
            assertThat(delays).containsExactly(
                Duration.ofMillis(1000), Duration.ofMillis(2000), Duration.ofMillis(4000));
        }

        @Test
        @DisplayName("Succeeds on a later attempt and stops retrying")
        void recoversAfterTransientFailures() {
            AtomicInteger attempts = new AtomicInteger();

            CompletableFuture<String> result = executor.execute("fetch", () -> {
                if (attempts.incrementAndGet() < 3) {
                    return CompletableFuture.failedFuture(new ConnectException("Connection refused"));
                }
                return CompletableFuture.completedFuture("ok");
            }, RetryPolicy.defaults());

            assertThat(result.join()).isEqualTo("ok");
            assertThat(attempts).hasValue(3);
            assertThat(delays).containsExactly(Duration.ofMillis(1000), Duration.ofMillis(2000));
        }

        @Test
        @DisplayName("Delays are capped at the maximum delay")
        void capsDelay() {
            RetryPolicy policy = RetryPolicy.defaults().withMaxRetries(4).withMaxDelay(Duration.ofSeconds(3));

            executor.execute("fetch",
                () -> CompletableFuture.failedFuture(new TimeoutException()), policy);

            assertThat(delays).containsExactly(
                Duration.ofMillis(1000), Duration.ofMillis(2000), Duration.ofMillis(3000), Duration.ofMillis(3000));
        }

        @Test
        @DisplayName("Synchronous exception from the supplier counts as a failed attempt")
        void supplierThrows() {
            AtomicInteger attempts = new AtomicInteger();

            CompletableFuture<String> result = executor.execute("fetch", () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("network unreachable");
            }, RetryPolicy.defaults());

            assertThatThrownBy(result::join).hasCauseInstanceOf(IllegalStateException.class);
            assertThat(attempts).hasValue(4);
        }
    }

    @Nested
    @DisplayName("Non-retryable errors")
    class NonRetryable {

        @Test
        @DisplayName("Malformed response fails immediately without delay")
        void validationErrorNotRetried() {
            AtomicInteger attempts = new AtomicInteger();

            CompletableFuture<String> result = executor.execute("predict", () -> {
                attempts.incrementAndGet();
                return CompletableFuture.failedFuture(new ResponseValidationException("missing action"));
            }, RetryPolicy.defaults());

            assertThatThrownBy(result::join).hasCauseInstanceOf(ResponseValidationException.class);
            assertThat(attempts).hasValue(1);
            assertThat(delays).isEmpty();
        }

        @Test
        @DisplayName("HTTP 400 from a provider is not retried")
        void clientErrorNotRetried() {
            AtomicInteger attempts = new AtomicInteger();

            executor.execute("predict", () -> {
                attempts.incrementAndGet();
                return CompletableFuture.failedFuture(ProviderException.forHttpStatus("GEMINI", 400, "bad request"));
            }, RetryPolicy.defaults());

            assertThat(attempts).hasValue(1);
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        private final RetryPolicy policy = RetryPolicy.defaults();

        @Test
        void transientErrorsAreRetryable() {
            assertThat(policy.isRetryable(new TimeoutException())).isTrue();
            assertThat(policy.isRetryable(new IOException("reset"))).isTrue();
            assertThat(policy.isRetryable(new RuntimeException("Too Many Requests"))).isTrue();
            assertThat(policy.isRetryable(new CompletionException(new TimeoutException()))).isTrue();
            assertThat(policy.isRetryable(ProviderException.forHttpStatus("CLAUDE", 429, ""))).isTrue();
            assertThat(policy.isRetryable(ProviderException.forHttpStatus("CLAUDE", 503, ""))).isTrue();
        }

        @Test
        void permanentErrorsAreNotRetryable() {
            assertThat(policy.isRetryable(new IllegalArgumentException("bad symbol"))).isFalse();
            assertThat(policy.isRetryable(new NullPointerException())).isFalse();
            assertThat(policy.isRetryable(new ProviderConfigurationException("no key"))).isFalse();
            assertThat(policy.isRetryable(ProviderException.forHttpStatus("CLAUDE", 401, ""))).isFalse();
        }

        @Test
        void additionalMessagesExtendClassification() {
            RetryPolicy exchangePolicy = policy.withAdditionalRetryableMessages("fetchOHLCV");

            assertThat(exchangePolicy.isRetryable(new RuntimeException("fetchOHLCV failed"))).isTrue();
            assertThat(policy.isRetryable(new RuntimeException("fetchOHLCV failed"))).isFalse();
        }
    }
}

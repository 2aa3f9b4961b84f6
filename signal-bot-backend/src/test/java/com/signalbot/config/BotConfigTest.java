package com.signalbot.config;

import com.signalbot.ai.AIServiceType;
import com.signalbot.core.exception.ProviderConfigurationException;
import com.signalbot.core.model.Timeframe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Bot configuration")
class BotConfigTest {

    @AfterEach
    void tearDown() {
        BotConfig.reset();
    }

    private static Properties props(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return props;
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Empty properties fall back to documented defaults")
        void defaultsApply() {
            BotConfig config = BotConfig.forTest(new Properties());

            assertThat(config.getInstruments()).containsExactly("BTC/USDT", "ETH/USDT");
            assertThat(config.getTimeframes()).containsExactly(Timeframe.H1, Timeframe.H4);
            assertThat(config.getExchangeBaseUrl()).isEqualTo("https://api.binance.com");
            assertThat(config.getExitThresholds().takeProfitPercent()).isEqualTo(6.0);
            assertThat(config.getExitThresholds().stopLossPercent()).isEqualTo(3.0);
            assertThat(config.getDecisionPolicy().minConfidence()).isEqualTo(80.0);
            assertThat(config.getDecisionPolicy().sellActionable()).isFalse();
            assertThat(config.getRetryPolicy().maxRetries()).isEqualTo(3);
            assertThat(config.getIndicatorSettings().requiredHistory()).isEqualTo(36);
            assertThat(config.getPositionMonitorInterval()).isEqualTo(Duration.ofMinutes(1));
            assertThat(config.getAiHealthCheckInterval()).isEqualTo(Duration.ofMinutes(5));
            assertThat(config.getPrimaryAiService()).isEqualTo(AIServiceType.GEMINI);
            assertThat(config.getFallbackAiServices()).containsExactly(AIServiceType.CLAUDE, AIServiceType.OPENAI);
        }

        @Test
        @DisplayName("Signal cycle follows the timeframe unless overridden")
        void signalCycleInterval() {
            assertThat(BotConfig.forTest(new Properties()).getSignalCycleInterval(Timeframe.H4))
                .isEqualTo(Duration.ofHours(4));
            assertThat(BotConfig.forTest(props("SIGNAL_CYCLE_INTERVAL_MS", "30000"))
                .getSignalCycleInterval(Timeframe.H4))
                .isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        @DisplayName("Exchange retry policy caps backoff at 10 seconds")
        void exchangeRetryPolicy() {
            var policy = BotConfig.forTest(new Properties()).getExchangeRetryPolicy();

            assertThat(policy.maxDelay()).isEqualTo(Duration.ofSeconds(10));
            assertThat(policy.retryableMessages()).contains("fetchOHLCV");
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("Properties override defaults")
        void propertiesOverride() {
            BotConfig config = BotConfig.forTest(props(
                "INSTRUMENTS", "SOL/USDT",
                "TIMEFRAMES", "15m, 1d",
                "TAKE_PROFIT_PERCENT", "8",
                "SELL_SIGNALS_ACTIONABLE", "true"));

            assertThat(config.getInstruments()).containsExactly("SOL/USDT");
            assertThat(config.getTimeframes()).containsExactly(Timeframe.M15, Timeframe.D1);
            assertThat(config.getExitThresholds().takeProfitPercent()).isEqualTo(8.0);
            assertThat(config.getDecisionPolicy().sellActionable()).isTrue();
        }

        @Test
        @DisplayName("Environment wins over properties")
        void environmentWins() {
            Map<String, String> env = Map.of("AI_MIN_CONFIDENCE", "90", "CANDLE_SYNC_LIMIT", "250");
            BotConfig config = BotConfig.forTest(props("AI_MIN_CONFIDENCE", "70"), env::get);

            assertThat(config.getDecisionPolicy().minConfidence()).isEqualTo(90.0);
            assertThat(config.getCandleSyncLimit()).isEqualTo(250);
        }

        @Test
        @DisplayName("Unparseable numbers keep the default")
        void invalidNumberKeepsDefault() {
            BotConfig config = BotConfig.forTest(props("STOP_LOSS_PERCENT", "three"));

            assertThat(config.getExitThresholds().stopLossPercent()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Primary service is removed from the fallback list")
        void primaryNotInFallbacks() {
            BotConfig config = BotConfig.forTest(props(
                "AI_PRIMARY_SERVICE", "claude",
                "AI_FALLBACK_SERVICES", "CLAUDE,GEMINI"));

            assertThat(config.getPrimaryAiService()).isEqualTo(AIServiceType.CLAUDE);
            assertThat(config.getFallbackAiServices()).containsExactly(AIServiceType.GEMINI);
        }

        @Test
        @DisplayName("Malformed instruments are rejected")
        void invalidInstrument() {
            assertThatThrownBy(() -> BotConfig.forTest(props("INSTRUMENTS", "BTCUSDT")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BTCUSDT");
        }
    }

    @Nested
    @DisplayName("Provider settings")
    class Providers {

        @Test
        @DisplayName("Valid settings are built from per-service keys")
        void validSettings() {
            BotConfig config = BotConfig.forTest(props(
                "OPENAI_API_KEY", "sk-test",
                "OPENAI_MODEL", "gpt-4o",
                "OPENAI_COST_PER_CALL", "0.01",
                "OPENAI_RATE_LIMIT_PER_MINUTE", "12"));

            ProviderSettings settings = config.providerSettings(AIServiceType.OPENAI);

            assertThat(settings.model()).isEqualTo("gpt-4o");
            assertThat(settings.baseUrl()).isEqualTo(AIServiceType.OPENAI.defaultBaseUrl());
            assertThat(settings.costPerCall()).isEqualTo(0.01);
            assertThat(settings.requestsPerMinute()).isEqualTo(12);
            assertThat(settings.toString()).doesNotContain("sk-test");
        }

        @Test
        @DisplayName("Missing API key is a configuration error")
        void missingKey() {
            BotConfig config = BotConfig.forTest(new Properties());

            assertThatThrownBy(() -> config.providerSettings(AIServiceType.GEMINI))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("GEMINI")
                .hasMessageContaining("API key is required");
        }

        @Test
        @DisplayName("Invalid model name and temperature are reported together")
        void invalidModelAndTemperature() {
            BotConfig config = BotConfig.forTest(props(
                "CLAUDE_API_KEY", "key",
                "CLAUDE_MODEL", "bad model!",
                "AI_TEMPERATURE", "3.5"));

            assertThatThrownBy(() -> config.providerSettings(AIServiceType.CLAUDE))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("Model name contains invalid characters")
                .hasMessageContaining("Temperature cannot exceed 2.0");
        }
    }
}

package com.signalbot.config;

import com.signalbot.ai.AIServiceType;
import com.signalbot.core.analysis.HardFilterCriteria;
import com.signalbot.core.analysis.IndicatorSettings;
import com.signalbot.core.decision.DecisionPolicy;
import com.signalbot.core.model.Timeframe;
import com.signalbot.core.position.ExitThresholds;
import com.signalbot.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Bot configuration loaded from {@code config.properties}.
 *
 * <p>Lookup order for every key: environment variable of the same name, then the
 * properties file (working directory first, classpath second), then the built-in default.
 */
public final class BotConfig {
    private static final Logger logger = LoggerFactory.getLogger(BotConfig.class);

    private static final String CONFIG_FILE = "config.properties";
    private static final Pattern INSTRUMENT_FORMAT = Pattern.compile("^[A-Z0-9]+/[A-Z0-9]+$");

    private static final AtomicReference<BotConfig> instanceRef = new AtomicReference<>();

    private final Properties properties;
    private final UnaryOperator<String> environment;

    private final List<String> instruments;
    private final List<Timeframe> timeframes;
    private final String exchangeBaseUrl;
    private final int exchangeRequestsPerMinute;
    private final Duration outboundTimeout;
    private final RetryPolicy retryPolicy;
    private final Duration exchangeMaxRetryDelay;
    private final HardFilterCriteria hardFilterCriteria;
    private final IndicatorSettings indicatorSettings;
    private final ExitThresholds exitThresholds;
    private final DecisionPolicy decisionPolicy;
    private final double positionSize;
    private final int candleSyncLimit;
    private final Duration signalCycleInterval;
    private final Duration positionMonitorInterval;
    private final Duration aiHealthCheckInterval;
    private final AIServiceType primaryAiService;
    private final List<AIServiceType> fallbackAiServices;
    private final double aiTemperature;
    private final int aiMaxOutputTokens;
    private final double aiDailyCostBudget;
    private final String databasePath;

    private BotConfig(Properties props, UnaryOperator<String> environment) {
        this.properties = props;
        this.environment = environment;

        this.instruments = parseInstruments(getString("INSTRUMENTS", "BTC/USDT,ETH/USDT"));
        this.timeframes = parseList(getString("TIMEFRAMES", "1h,4h")).stream().map(Timeframe::fromCode).toList();
        this.exchangeBaseUrl = getString("EXCHANGE_BASE_URL", "https://api.binance.com");
        this.exchangeRequestsPerMinute = (int) parseLong("EXCHANGE_RATE_LIMIT_PER_MINUTE", 60);
        this.outboundTimeout = Duration.ofMillis(parseLong("OUTBOUND_TIMEOUT_MS", 10_000));

        this.retryPolicy = new RetryPolicy(
            (int) parseLong("RETRY_MAX_RETRIES", 3),
            Duration.ofMillis(parseLong("RETRY_INITIAL_DELAY_MS", 1000)),
            Duration.ofMillis(parseLong("RETRY_MAX_DELAY_MS", 30_000)),
            parseDouble("RETRY_BACKOFF_FACTOR", 2.0),
            RetryPolicy.DEFAULT_RETRYABLE_MESSAGES);
        this.exchangeMaxRetryDelay = Duration.ofMillis(parseLong("EXCHANGE_RETRY_MAX_DELAY_MS", 10_000));

        this.hardFilterCriteria = new HardFilterCriteria(
            parseDouble("HARD_FILTER_OVERSOLD_RSI", 30.0),
            parseDouble("HARD_FILTER_OVERBOUGHT_RSI", 70.0),
            parseDouble("HARD_FILTER_MIN_VOLUME_RATIO", 1.2),
            parseDouble("HARD_FILTER_MIN_BODY_PERCENT", 0.5));
        this.indicatorSettings = new IndicatorSettings(
            (int) parseLong("RSI_PERIOD", 14),
            (int) parseLong("MACD_FAST_PERIOD", 12),
            (int) parseLong("MACD_SLOW_PERIOD", 26),
            (int) parseLong("MACD_SIGNAL_PERIOD", 9),
            (int) parseLong("VOLUME_MA_PERIOD", 20),
            (int) parseLong("INDICATOR_WARMUP_BUFFER", 10));

        this.exitThresholds = new ExitThresholds(
            parseDouble("TAKE_PROFIT_PERCENT", 6.0),
            parseDouble("STOP_LOSS_PERCENT", 3.0));
        this.decisionPolicy = new DecisionPolicy(
            parseDouble("AI_MIN_CONFIDENCE", 80.0),
            parseBoolean("SELL_SIGNALS_ACTIONABLE", false));
        this.positionSize = parseDouble("POSITION_SIZE", 1.0);

        this.candleSyncLimit = (int) parseLong("CANDLE_SYNC_LIMIT", 100);
        this.signalCycleInterval = Duration.ofMillis(parseLong("SIGNAL_CYCLE_INTERVAL_MS", 0));
        this.positionMonitorInterval = Duration.ofMillis(parseLong("POSITION_MONITOR_INTERVAL_MS", 60_000));
        this.aiHealthCheckInterval = Duration.ofMillis(parseLong("AI_HEALTH_CHECK_INTERVAL_MS", 300_000));

        this.primaryAiService = AIServiceType.parse(getString("AI_PRIMARY_SERVICE", "GEMINI"));
        this.fallbackAiServices = parseList(getString("AI_FALLBACK_SERVICES", "CLAUDE,OPENAI")).stream()
            .map(AIServiceType::parse)
            .filter(service -> service != primaryAiService)
            .distinct()
            .toList();
        this.aiTemperature = parseDouble("AI_TEMPERATURE", 0.3);
        this.aiMaxOutputTokens = (int) parseLong("AI_MAX_OUTPUT_TOKENS", 500);
        this.aiDailyCostBudget = parseDouble("AI_DAILY_COST_BUDGET", 0.0);
        this.databasePath = getString("DATABASE_PATH", "signalbot.db");

        logger.info("📊 Bot Configuration Loaded:");
        logger.info("   Instruments: {}", instruments);
        logger.info("   Timeframes: {}", timeframes);
        logger.info("   AI: primary={}, fallbacks={}, min confidence={}",
            primaryAiService, fallbackAiServices, decisionPolicy.minConfidence());
        logger.info("   Take-Profit: {}%, Stop-Loss: {}%",
            String.format("%.2f", exitThresholds.takeProfitPercent()),
            String.format("%.2f", exitThresholds.stopLossPercent()));
    }

    /**
     * Get the singleton instance, loading from the default locations on first use.
     */
    public static BotConfig getInstance() {
        return instanceRef.updateAndGet(existing -> existing != null ? existing : load());
    }

    /**
     * Load configuration from config.properties with environment overrides.
     */
    public static BotConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new BotConfig(props, System::getenv);
            } catch (IOException e) {
                logger.warn("Failed to load config.properties from filesystem: {}", e.getMessage());
            }
        }

        try (InputStream is = BotConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new BotConfig(props, System::getenv);
            }
        } catch (IOException e) {
            logger.warn("Failed to load config.properties from classpath: {}", e.getMessage());
        }

        logger.warn("No config.properties found, using defaults");
        return new BotConfig(props, System::getenv);
    }

    /**
     * Create an instance from the given properties only, ignoring the environment.
     */
    public static BotConfig forTest(Properties testProps) {
        return new BotConfig(testProps, key -> null);
    }

    /**
     * Create an instance with an explicit environment lookup.
     */
    public static BotConfig forTest(Properties testProps, UnaryOperator<String> environment) {
        return new BotConfig(testProps, environment);
    }

    public static void reset() {
        instanceRef.set(null);
    }

    /**
     * Build and validate settings for one AI service.
     *
     * @throws com.signalbot.core.exception.ProviderConfigurationException if the settings are invalid
     */
    public ProviderSettings providerSettings(AIServiceType service) {
        String prefix = service.name() + "_";
        ProviderSettings settings = new ProviderSettings(
            service,
            getString(prefix + "API_KEY", ""),
            getString(prefix + "MODEL", service.defaultModel()),
            getString(prefix + "BASE_URL", service.defaultBaseUrl()),
            aiTemperature,
            aiMaxOutputTokens,
            parseDouble(prefix + "COST_PER_CALL", service.defaultCostPerCall()),
            getAiRequestsPerMinute(service),
            outboundTimeout);
        settings.validate();
        return settings;
    }

    private String getString(String key, String defaultValue) {
        String fromEnv = environment.apply(key);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private double parseDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    private static List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static List<String> parseInstruments(String value) {
        List<String> parsed = parseList(value);
        for (String instrument : parsed) {
            if (!INSTRUMENT_FORMAT.matcher(instrument).matches()) {
                throw new IllegalStateException("Invalid instrument '" + instrument + "', expected BASE/QUOTE");
            }
        }
        if (parsed.isEmpty()) {
            throw new IllegalStateException("At least one instrument must be configured");
        }
        return parsed;
    }

    // ========== Getters ==========

    /** Instruments in BASE/QUOTE form. */
    public List<String> getInstruments() {
        return instruments;
    }

    public List<Timeframe> getTimeframes() {
        return timeframes;
    }

    public String getExchangeBaseUrl() {
        return exchangeBaseUrl;
    }

    public int getExchangeRequestsPerMinute() {
        return exchangeRequestsPerMinute;
    }

    /** Bound on every outbound HTTP call. */
    public Duration getOutboundTimeout() {
        return outboundTimeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /** Exchange calls back off faster and also retry on OHLCV fetch errors. */
    public RetryPolicy getExchangeRetryPolicy() {
        return retryPolicy.withMaxDelay(exchangeMaxRetryDelay).withAdditionalRetryableMessages("fetchOHLCV");
    }

    public HardFilterCriteria getHardFilterCriteria() {
        return hardFilterCriteria;
    }

    public IndicatorSettings getIndicatorSettings() {
        return indicatorSettings;
    }

    public ExitThresholds getExitThresholds() {
        return exitThresholds;
    }

    public DecisionPolicy getDecisionPolicy() {
        return decisionPolicy;
    }

    /** Units bought per BUY signal. */
    public double getPositionSize() {
        return positionSize;
    }

    public int getCandleSyncLimit() {
        return candleSyncLimit;
    }

    /** Signal cycle interval for a timeframe: the override if set, else the timeframe length. */
    public Duration getSignalCycleInterval(Timeframe timeframe) {
        return signalCycleInterval.isZero() ? timeframe.duration() : signalCycleInterval;
    }

    public Duration getPositionMonitorInterval() {
        return positionMonitorInterval;
    }

    public Duration getAiHealthCheckInterval() {
        return aiHealthCheckInterval;
    }

    public AIServiceType getPrimaryAiService() {
        return primaryAiService;
    }

    /** Fallback order, never containing the primary. */
    public List<AIServiceType> getFallbackAiServices() {
        return fallbackAiServices;
    }

    /** Daily AI spend limit in USD, 0 disables it. */
    public double getAiDailyCostBudget() {
        return aiDailyCostBudget;
    }

    /** Rate limit for one AI service, {@code <SERVICE>_RATE_LIMIT_PER_MINUTE}. */
    public int getAiRequestsPerMinute(AIServiceType service) {
        return (int) parseLong(service.name() + "_RATE_LIMIT_PER_MINUTE", service.defaultRequestsPerMinute());
    }

    public String getDatabasePath() {
        return databasePath;
    }
}

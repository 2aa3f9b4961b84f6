package com.signalbot.bot;

import com.signalbot.config.BotConfig;
import com.signalbot.core.ai.AIProviderManager;
import com.signalbot.core.decision.SignalPipeline;
import com.signalbot.core.model.Candle;
import com.signalbot.core.model.Position;
import com.signalbot.core.model.RiskLevel;
import com.signalbot.core.model.SignalAction;
import com.signalbot.core.model.Timeframe;
import com.signalbot.core.model.TradingSignal;
import com.signalbot.core.position.PositionLifecycleManager;
import com.signalbot.core.position.PositionLifecycleManager.MonitorReport;
import com.signalbot.core.resilience.RetryPolicy;
import com.signalbot.market.CandleSyncService;
import com.signalbot.metrics.MetricsService;
import com.signalbot.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Drives the signal pipeline on a schedule.
 *
 * Jobs: one signal cycle per timeframe, the position monitor and the AI health check.
 * A signal cycle syncs candles, evaluates each instrument concurrently and acts on
 * the result: BUY opens a position, SELL closes one.
 */
public final class BotOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(BotOrchestrator.class);

    static final String POSITION_MONITOR_JOB = "position-monitor";
    static final String HEALTH_CHECK_JOB = "ai-health-check";
    static final int MAX_RECENT_SIGNALS = 100;

    public record Settings(
        List<String> instruments,
        List<Timeframe> timeframes,
        int candleSyncLimit,
        double positionSize,
        Function<Timeframe, Duration> signalCycleInterval,
        Duration positionMonitorInterval,
        Duration healthCheckInterval
    ) {
        public Settings {
            instruments = List.copyOf(instruments);
            timeframes = List.copyOf(timeframes);
        }

        public static Settings from(BotConfig config) {
            return new Settings(
                config.getInstruments(),
                config.getTimeframes(),
                config.getCandleSyncLimit(),
                config.getPositionSize(),
                config::getSignalCycleInterval,
                config.getPositionMonitorInterval(),
                config.getAiHealthCheckInterval());
        }
    }

    public record BotStatus(
        boolean running,
        List<String> instruments,
        List<String> timeframes,
        String activeAiService,
        boolean aiAvailable,
        int openPositions,
        List<TradingSignal> recentSignals,
        Map<String, Instant> lastCycles
    ) {}

    private final Settings settings;
    private final CandleSyncService candleSync;
    private final SignalPipeline pipeline;
    private final PositionLifecycleManager positions;
    private final AIProviderManager aiManager;
    private final TaskScheduler scheduler;
    private final MetricsService metrics;
    private final Clock clock;

    private final Deque<TradingSignal> recentSignals = new ConcurrentLinkedDeque<>();
    private final Map<String, Instant> lastCycles = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BotOrchestrator(Settings settings, CandleSyncService candleSync, SignalPipeline pipeline,
                           PositionLifecycleManager positions, AIProviderManager aiManager,
                           TaskScheduler scheduler, MetricsService metrics, Clock clock) {
        this.settings = settings;
        this.candleSync = candleSync;
        this.pipeline = pipeline;
        this.positions = positions;
        this.aiManager = aiManager;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Initialize the AI layer, backfill candles and register the periodic jobs.
     */
    public CompletableFuture<Void> start() {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Bot orchestrator already running");
            return CompletableFuture.completedFuture(null);
        }
        logger.info("🚀 Starting signal bot: instruments={}, timeframes={}",
            settings.instruments(), settings.timeframes());

        return aiManager.initialize()
            .thenCompose(ignored -> manualSync())
            .thenRun(this::registerJobs)
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    running.set(false);
                    logger.error("❌ Signal bot failed to start", error);
                } else {
                    logger.info("✅ Signal bot running");
                }
            });
    }

    private void registerJobs() {
        for (Timeframe timeframe : settings.timeframes()) {
            Duration interval = settings.signalCycleInterval().apply(timeframe);
            scheduler.schedule(signalJobKey(timeframe), interval, interval, () -> runSignalCycle(timeframe));
        }
        scheduler.schedule(POSITION_MONITOR_JOB, settings.positionMonitorInterval(),
            settings.positionMonitorInterval(), this::runMonitorCycle);
        scheduler.schedule(HEALTH_CHECK_JOB, settings.healthCheckInterval(),
            settings.healthCheckInterval(), this::runHealthCheck);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("🛑 Stopping signal bot");
        scheduler.close();
        aiManager.close();
    }

    static String signalJobKey(Timeframe timeframe) {
        return "signal-cycle:" + timeframe.code();
    }

    /**
     * Evaluate every instrument for one timeframe. Instruments run concurrently and a
     * failure on one does not affect the others.
     *
     * <p>A failed candle sync still evaluates whatever candles are stored. Any other
     * failure yields a WAIT signal carrying the error as its reason.
     *
     * @return one signal per instrument, in instrument order
     */
    public CompletableFuture<List<TradingSignal>> runSignalCycle(Timeframe timeframe) {
        logger.info("🔁 Signal cycle {} for {} instrument(s)", timeframe, settings.instruments().size());
        List<CompletableFuture<TradingSignal>> runs = settings.instruments().stream()
            .map(instrument -> processInstrument(instrument, timeframe)
                .exceptionally(error -> {
                    String message = RetryPolicy.unwrap(error).getMessage();
                    logger.error("❌ Signal cycle failed for {} {}: {}", instrument, timeframe, message);
                    metrics.recordCycleFailure(signalJobKey(timeframe));
                    TradingSignal failed = new TradingSignal(instrument, timeframe, SignalAction.WAIT, 0.0,
                        "Signal cycle failed: " + message, RiskLevel.HIGH, null, null, clock.instant());
                    remember(failed);
                    return failed;
                }))
            .toList();

        return CompletableFuture.allOf(runs.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                lastCycles.put(signalJobKey(timeframe), clock.instant());
                return runs.stream().map(CompletableFuture::join).toList();
            });
    }

    private CompletableFuture<TradingSignal> processInstrument(String instrument, Timeframe timeframe) {
        int historyNeeded = Math.max(pipeline.requiredHistory(), SignalPipeline.AI_CONTEXT_CANDLES);
        return candleSync.sync(instrument, timeframe, settings.candleSyncLimit())
            .exceptionally(error -> {
                logger.warn("⚠️ Candle sync failed for {} {}, evaluating stored candles: {}",
                    instrument, timeframe, RetryPolicy.unwrap(error).getMessage());
                metrics.recordCycleFailure(signalJobKey(timeframe));
                return -1;
            })
            .thenCompose(synced -> {
                List<Candle> candles = candleSync.recentCandles(instrument, timeframe, historyNeeded);
                return pipeline.evaluate(instrument, timeframe, candles);
            })
            .thenCompose(signal -> {
                remember(signal);
                return act(signal).handle((ignored, error) -> {
                    if (error != null) {
                        logger.error("❌ Failed to act on {} {} for {}: {}", signal.action(), timeframe,
                            instrument, RetryPolicy.unwrap(error).getMessage());
                        metrics.recordCycleFailure(signalJobKey(timeframe));
                    }
                    return signal;
                });
            });
    }

    private CompletableFuture<Void> act(TradingSignal signal) {
        if (signal.action() == SignalAction.BUY) {
            return positions.open(signal.instrument(), null, settings.positionSize())
                .thenAccept(result -> {
                    if (result.status() == PositionLifecycleManager.OpenStatus.OPENED) {
                        metrics.recordPositionOpened(signal.instrument());
                    }
                });
        }
        if (signal.action() == SignalAction.SELL) {
            return positions.closeOnSignal(signal.instrument())
                .thenAccept(closed -> closed.ifPresent(this::recordClose));
        }
        return CompletableFuture.completedFuture(null);
    }

    private void remember(TradingSignal signal) {
        metrics.recordSignal(signal);
        recentSignals.addFirst(signal);
        while (recentSignals.size() > MAX_RECENT_SIGNALS) {
            recentSignals.pollLast();
        }
    }

    public CompletableFuture<MonitorReport> runMonitorCycle() {
        return positions.monitor()
            .thenApply(report -> {
                report.closed().forEach(this::recordClose);
                lastCycles.put(POSITION_MONITOR_JOB, clock.instant());
                if (report.checked() > 0) {
                    logger.info("👀 Position monitor: checked={}, closed={}, skipped={}",
                        report.checked(), report.closed().size(), report.skipped().size());
                }
                return report;
            });
    }

    private void recordClose(Position closed) {
        metrics.recordPositionClosed(closed.closeReason(), closed.pnl());
    }

    public CompletableFuture<AIProviderManager.Stats> runHealthCheck() {
        return aiManager.runHealthCheck()
            .thenApply(ignored -> {
                var stats = aiManager.stats();
                lastCycles.put(HEALTH_CHECK_JOB, clock.instant());
                logger.info("🩺 AI health: active={}, requests={}, errors={}, cost=${}, success={}%",
                    stats.activeService(), stats.totalRequests(), stats.totalErrors(),
                    String.format("%.4f", stats.totalCost()), String.format("%.1f", stats.successRate()));
                if (!aiManager.isAvailable()) {
                    logger.error("🚨 No AI provider is healthy, signals will WAIT");
                }
                return stats;
            });
    }

    /** Sync all instruments and timeframes now. */
    public CompletableFuture<Map<String, Integer>> manualSync() {
        return candleSync.syncAll(settings.instruments(), settings.timeframes(), settings.candleSyncLimit());
    }

    public List<TradingSignal> getRecentSignals(int limit) {
        return recentSignals.stream().limit(limit).toList();
    }

    public BotStatus getStatus() {
        return new BotStatus(
            running.get(),
            settings.instruments(),
            settings.timeframes().stream().map(Timeframe::code).toList(),
            aiManager.getActiveServiceId(),
            aiManager.isAvailable(),
            positions.openPositions().size(),
            getRecentSignals(10),
            Map.copyOf(lastCycles));
    }
}

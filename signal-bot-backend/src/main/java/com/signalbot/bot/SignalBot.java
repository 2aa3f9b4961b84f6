package com.signalbot.bot;

import com.signalbot.ai.AIProviderFactory;
import com.signalbot.ai.OkHttpJsonTransport;
import com.signalbot.config.BotConfig;
import com.signalbot.core.ai.AIProviderManager;
import com.signalbot.core.analysis.HardFilterEvaluator;
import com.signalbot.core.analysis.MarketContextAnalyzer;
import com.signalbot.core.analysis.TechnicalIndicatorEngine;
import com.signalbot.core.decision.SignalDecisionEngine;
import com.signalbot.core.decision.SignalPipeline;
import com.signalbot.core.position.PositionLifecycleManager;
import com.signalbot.core.resilience.RateLimiter;
import com.signalbot.core.resilience.RetryExecutor;
import com.signalbot.exchange.BinanceMarketDataClient;
import com.signalbot.exchange.ResilientMarketDataSource;
import com.signalbot.market.CandleSyncService;
import com.signalbot.metrics.MetricsService;
import com.signalbot.persistence.CandleDatabase;
import com.signalbot.persistence.PositionDatabase;
import com.signalbot.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process entry point: wires configuration, exchange, AI providers, storage and the orchestrator.
 */
public final class SignalBot {
    private static final Logger logger = LoggerFactory.getLogger(SignalBot.class);

    private SignalBot() {
    }

    public static void main(String[] args) throws InterruptedException {
        BotConfig config = BotConfig.getInstance();
        Clock clock = Clock.systemUTC();
        MetricsService metrics = MetricsService.getInstance();
        RetryExecutor retryExecutor = RetryExecutor.withSystemDelays();

        ScheduledExecutorService poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limit-poller");
            thread.setDaemon(true);
            return thread;
        });

        var exchangeClient = new BinanceMarketDataClient(config.getExchangeBaseUrl(), config.getOutboundTimeout());
        var exchangeLimiter = new RateLimiter("exchange", config.getExchangeRequestsPerMinute(),
            Duration.ofMinutes(1), poller, clock);
        var marketData = new ResilientMarketDataSource(exchangeClient, exchangeLimiter, retryExecutor,
            config.getExchangeRetryPolicy(), metrics.getRegistry());
        logger.info("🛡️ Exchange client initialized with circuit breaker, rate limiter, and retry");

        var httpClient = OkHttpJsonTransport.defaultClient();
        // Health checks are driven by the orchestrator's scheduler
        var aiSettings = new AIProviderManager.Settings(config.getRetryPolicy(), config.getOutboundTimeout(),
            Duration.ZERO, config.getAiDailyCostBudget());
        var aiManager = new AIProviderManager(AIProviderFactory.registrations(config, httpClient, poller),
            retryExecutor, aiSettings, poller, clock);
        metrics.bindAiProviders(aiManager);

        var candleDatabase = new CandleDatabase(config.getDatabasePath());
        var positionDatabase = new PositionDatabase(config.getDatabasePath());

        var pipeline = new SignalPipeline(
            new TechnicalIndicatorEngine(config.getIndicatorSettings()),
            new HardFilterEvaluator(config.getHardFilterCriteria()),
            new MarketContextAnalyzer(),
            aiManager,
            new SignalDecisionEngine(config.getDecisionPolicy(), clock));
        var positions = new PositionLifecycleManager(positionDatabase, marketData, config.getExitThresholds(), clock);

        var orchestrator = new BotOrchestrator(
            BotOrchestrator.Settings.from(config),
            new CandleSyncService(marketData, candleDatabase),
            pipeline,
            positions,
            aiManager,
            new TaskScheduler(),
            metrics,
            clock);

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping signal bot...");
            orchestrator.stop();
            exchangeLimiter.close();
            candleDatabase.close();
            positionDatabase.close();
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
            poller.shutdownNow();
            shutdown.countDown();
            logger.info("Signal bot shutdown complete");
        }, "shutdown-hook"));

        try {
            orchestrator.start().get(2, TimeUnit.MINUTES);
        } catch (Exception e) {
            logger.error("🚨 Startup failed, exiting", e);
            System.exit(1);
        }

        shutdown.await();
    }
}

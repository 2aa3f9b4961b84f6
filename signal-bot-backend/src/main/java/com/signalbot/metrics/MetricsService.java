package com.signalbot.metrics;

import com.signalbot.core.ai.AIProviderManager;
import com.signalbot.core.model.CloseReason;
import com.signalbot.core.model.ProviderHealth;
import com.signalbot.core.model.TradingSignal;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized metrics for the signal bot.
 *
 * Usage:
 *   var metrics = MetricsService.getInstance();
 *   metrics.recordSignal(signal);
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final MeterRegistry registry;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    private MetricsService() {
        this(new SimpleMeterRegistry());
        logger.info("MetricsService initialized with simple registry");
    }

    /**
     * Initialization-on-Demand Holder pattern.
     */
    private static class Holder {
        private static final MetricsService INSTANCE = new MetricsService();
    }

    public static MetricsService getInstance() {
        return Holder.INSTANCE;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordSignal(TradingSignal signal) {
        registry.counter("signalbot.signals",
            "action", signal.action().name(),
            "timeframe", signal.timeframe().code()).increment();
        if (signal.hardFilterPassed()) {
            registry.counter("signalbot.hardfilter.passed",
                "candidate", signal.hardFilter().candidate().name()).increment();
        }
    }

    public void recordPositionOpened(String instrument) {
        registry.counter("signalbot.positions.opened", "instrument", instrument).increment();
    }

    public void recordPositionClosed(CloseReason reason, double pnl) {
        registry.counter("signalbot.positions.closed", "reason", reason.name()).increment();
        registry.summary("signalbot.position.pnl").record(pnl);
    }

    public void recordCycleFailure(String job) {
        registry.counter("signalbot.cycle.failures", "job", job).increment();
    }

    /**
     * Expose per-provider request, error and cost figures read from the manager on scrape.
     */
    public void bindAiProviders(AIProviderManager aiManager) {
        for (ProviderHealth health : aiManager.stats().providers()) {
            String serviceId = health.serviceId();
            FunctionCounter.builder("signalbot.ai.requests", aiManager,
                    manager -> providerHealth(manager, serviceId).requestCount())
                .tag("provider", serviceId)
                .register(registry);
            FunctionCounter.builder("signalbot.ai.errors", aiManager,
                    manager -> providerHealth(manager, serviceId).errorCount())
                .tag("provider", serviceId)
                .register(registry);
            Gauge.builder("signalbot.ai.cost", aiManager,
                    manager -> providerHealth(manager, serviceId).costAccrued())
                .tag("provider", serviceId)
                .register(registry);
            Gauge.builder("signalbot.ai.ready", aiManager,
                    manager -> providerHealth(manager, serviceId).ready() ? 1.0 : 0.0)
                .tag("provider", serviceId)
                .register(registry);
        }
    }

    private static ProviderHealth providerHealth(AIProviderManager manager, String serviceId) {
        return manager.stats().providers().stream()
            .filter(health -> health.serviceId().equals(serviceId))
            .findFirst()
            .orElse(new ProviderHealth(serviceId, false, 0, 0, null, 0.0));
    }
}

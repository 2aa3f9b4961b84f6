package com.signalbot.core.ai;

import com.signalbot.core.exception.ProviderConfigurationException;
import com.signalbot.core.exception.ProviderUnavailableException;
import com.signalbot.core.exception.ResponseValidationException;
import com.signalbot.core.model.AIDecision;
import com.signalbot.core.model.ProviderHealth;
import com.signalbot.core.resilience.RateLimiter;
import com.signalbot.core.resilience.RetryExecutor;
import com.signalbot.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Routes predictions across an ordered list of AI providers with sticky failover.
 *
 * <p>Each call goes to the active provider first, then to the remaining ready
 * providers in configured order. When a fallback succeeds it becomes the active
 * provider for later calls. Every provider call passes through that provider's rate
 * limiter and the retry executor and is bounded by the call timeout.
 *
 * <p>Provider health (ready flag, request and error counts, last error, cost) is
 * refreshed by a periodic connection check.
 */
public final class AIProviderManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AIProviderManager.class);

    /** A provider together with its own rate-limit bucket. */
    public record Registration(AIProvider provider, RateLimiter rateLimiter) {
    }

    /**
     * @param dailyCostBudget USD per UTC day; zero or negative disables the budget
     */
    public record Settings(RetryPolicy retryPolicy, Duration callTimeout,
                           Duration healthCheckInterval, double dailyCostBudget) {

        public static Settings defaults() {
            return new Settings(RetryPolicy.defaults(), Duration.ofSeconds(10), Duration.ofMinutes(5), 0.0);
        }
    }

    public record Stats(String activeService, long totalRequests, long totalErrors,
                        double totalCost, double successRate, List<ProviderHealth> providers) {
    }

    private final List<ProviderSlot> slots;
    private final AtomicReference<ProviderSlot> active;
    private final RetryExecutor retryExecutor;
    private final Settings settings;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Object budgetLock = new Object();
    private LocalDate budgetDay;
    private double spentToday;

    private volatile ScheduledFuture<?> healthCheckTask;

    public AIProviderManager(List<Registration> registrations, RetryExecutor retryExecutor,
                             Settings settings, ScheduledExecutorService scheduler, Clock clock) {
        if (registrations == null || registrations.isEmpty()) {
            throw new IllegalArgumentException("At least one AI provider must be registered");
        }
        this.slots = registrations.stream().map(ProviderSlot::new).toList();
        this.active = new AtomicReference<>(slots.get(0));
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.scheduler = scheduler;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.budgetDay = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        logger.info("🤖 AIProviderManager created with {} provider(s). Primary: {}",
            slots.size(), slots.get(0).id());
    }

    /**
     * Initialize every adapter and check its connection. A provider that fails configuration stays
     * unready without affecting the others. Starts the periodic health check.
     */
    public CompletableFuture<Void> initialize() {
        List<CompletableFuture<Void>> checks = new ArrayList<>();
        for (ProviderSlot slot : slots) {
            try {
                slot.provider.initialize();
                slot.configured = true;
                checks.add(checkHealth(slot));
            } catch (ProviderConfigurationException e) {
                slot.ready = false;
                slot.lastError = e.getMessage();
                logger.error("❌ AI provider {} not configured: {}", slot.id(), e.getMessage());
            }
        }

        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]))
            .thenRun(() -> {
                firstReady().ifPresentOrElse(slot -> {
                    active.set(slot);
                    logger.info("✅ AI layer ready. Active provider: {}", slot.id());
                }, () -> logger.error("🚨 No AI provider is ready, signals will WAIT until one recovers"));
                startHealthChecks();
            });
    }

    /**
     * Ask the AI layer for a decision.
     *
     * @return future failing with {@link ProviderUnavailableException} when no provider answered
     */
    public CompletableFuture<AIDecision> predict(PredictionRequest request) {
        if (isBudgetExhausted()) {
            return CompletableFuture.failedFuture(
                new ProviderUnavailableException("Daily AI cost budget of $" + settings.dailyCostBudget() + " exhausted"));
        }

        List<ProviderSlot> order = callOrder();
        if (order.isEmpty()) {
            return CompletableFuture.failedFuture(new ProviderUnavailableException("No AI provider is ready"));
        }

        CompletableFuture<AIDecision> result = new CompletableFuture<>();
        tryProvider(order, 0, request, new ArrayList<>(), result);
        return result;
    }

    /**
     * Same as {@link #predict} but folds failures into an {@link AIOutcome} so callers
     * can branch without exception handling.
     */
    public CompletableFuture<AIOutcome> consult(PredictionRequest request) {
        return predict(request).handle((decision, failure) -> {
            if (failure == null) {
                return new AIOutcome.Decided(decision);
            }
            Throwable cause = RetryPolicy.unwrap(failure);
            Throwable[] causes = cause.getSuppressed();
            boolean allMalformed = causes.length > 0
                && Arrays.stream(causes).allMatch(ResponseValidationException.class::isInstance);
            if (allMalformed) {
                return new AIOutcome.Rejected(causes[causes.length - 1].getMessage());
            }
            return new AIOutcome.Unavailable(cause.getMessage());
        });
    }

    /**
     * Manually make a provider active.
     *
     * @return false if the provider is unknown or not ready
     */
    public synchronized boolean switchService(String serviceId) {
        Optional<ProviderSlot> target = slots.stream().filter(s -> s.id().equals(serviceId)).findFirst();
        if (target.isEmpty()) {
            logger.warn("Cannot switch to unknown AI provider {}", serviceId);
            return false;
        }
        if (!target.get().ready) {
            logger.warn("Cannot switch to AI provider {}: not ready", serviceId);
            return false;
        }
        ProviderSlot previous = active.getAndSet(target.get());
        logger.info("🔄 Manually switched AI provider from {} to {}", previous.id(), serviceId);
        return true;
    }

    /** Check every configured provider and refresh its ready flag. */
    public CompletableFuture<Void> runHealthCheck() {
        List<CompletableFuture<Void>> checks = slots.stream()
            .filter(slot -> slot.configured)
            .map(this::checkHealth)
            .toList();
        return CompletableFuture.allOf(checks.toArray(new CompletableFuture[0]));
    }

    public boolean isAvailable() {
        return slots.stream().anyMatch(slot -> slot.ready);
    }

    public String getActiveServiceId() {
        return active.get().id();
    }

    public Stats stats() {
        List<ProviderHealth> health = slots.stream().map(ProviderSlot::health).toList();
        long requests = health.stream().mapToLong(ProviderHealth::requestCount).sum();
        long errors = health.stream().mapToLong(ProviderHealth::errorCount).sum();
        double cost = health.stream().mapToDouble(ProviderHealth::costAccrued).sum();
        double successRate = requests == 0 ? 0.0 : (double) (requests - errors) / requests * 100.0;
        return new Stats(getActiveServiceId(), requests, errors, cost, successRate, health);
    }

    @Override
    public void close() {
        ScheduledFuture<?> task = healthCheckTask;
        if (task != null) {
            task.cancel(false);
        }
        for (ProviderSlot slot : slots) {
            try {
                slot.provider.close();
            } catch (Exception e) {
                logger.warn("Error closing AI provider {}: {}", slot.id(), e.getMessage());
            }
            slot.rateLimiter.close();
        }
        logger.info("AIProviderManager closed");
    }

    private void tryProvider(List<ProviderSlot> order, int index, PredictionRequest request,
                             List<Throwable> failures, CompletableFuture<AIDecision> result) {
        ProviderSlot slot = order.get(index);
        callWithRetry(slot, request).whenComplete((decision, failure) -> {
            if (failure == null) {
                promote(slot);
                result.complete(decision.withProvider(slot.id()));
                return;
            }
            Throwable cause = RetryPolicy.unwrap(failure);
            failures.add(cause);
            logger.warn("⚠️ AI provider {} failed for {}: {}", slot.id(), request.instrument(), cause.getMessage());

            if (index + 1 < order.size()) {
                tryProvider(order, index + 1, request, failures, result);
            } else {
                ProviderUnavailableException exhausted =
                    new ProviderUnavailableException("All AI providers failed for " + request.instrument());
                failures.forEach(exhausted::addSuppressed);
                result.completeExceptionally(exhausted);
            }
        });
    }

    private CompletableFuture<AIDecision> callWithRetry(ProviderSlot slot, PredictionRequest request) {
        return retryExecutor.execute(slot.id() + ".predict",
            () -> slot.rateLimiter.acquire().thenCompose(granted -> attempt(slot, request)),
            settings.retryPolicy());
    }

    private CompletableFuture<AIDecision> attempt(ProviderSlot slot, PredictionRequest request) {
        slot.requests.incrementAndGet();
        recordSpend(slot.provider.costPerCall());
        CompletableFuture<AIDecision> call;
        try {
            call = slot.provider.predict(request);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return withCallTimeout(call)
            .whenComplete((decision, failure) -> {
                if (failure != null) {
                    slot.errors.incrementAndGet();
                    slot.lastError = RetryPolicy.unwrap(failure).toString();
                }
            });
    }

    /**
     * Bound a provider call by the configured timeout. On expiry the provider's own future
     * is cancelled so the adapter can abort its HTTP request.
     */
    private <T> CompletableFuture<T> withCallTimeout(CompletableFuture<T> call) {
        CompletableFuture<T> bounded = call.copy()
            .orTimeout(settings.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        bounded.whenComplete((ignored, failure) -> {
            if (failure != null && RetryPolicy.unwrap(failure) instanceof TimeoutException) {
                call.cancel(true);
            }
        });
        return bounded;
    }

    /** Sticky failover: the provider that answered stays active. */
    private void promote(ProviderSlot slot) {
        ProviderSlot previous = active.getAndSet(slot);
        if (previous != slot) {
            logger.info("🔄 AI provider failover: {} -> {}", previous.id(), slot.id());
        }
    }

    private List<ProviderSlot> callOrder() {
        ProviderSlot current = active.get();
        List<ProviderSlot> order = new ArrayList<>();
        if (current.ready) {
            order.add(current);
        }
        for (ProviderSlot slot : slots) {
            if (slot != current && slot.ready) {
                order.add(slot);
            }
        }
        return order;
    }

    private Optional<ProviderSlot> firstReady() {
        return slots.stream().filter(slot -> slot.ready).findFirst();
    }

    private CompletableFuture<Void> checkHealth(ProviderSlot slot) {
        CompletableFuture<Boolean> check;
        try {
            check = slot.provider.testConnection();
        } catch (RuntimeException e) {
            check = CompletableFuture.failedFuture(e);
        }
        return withCallTimeout(check)
            .handle((ok, failure) -> {
                boolean healthy = failure == null && Boolean.TRUE.equals(ok);
                boolean wasReady = slot.ready;
                slot.ready = healthy;
                if (failure != null) {
                    slot.lastError = RetryPolicy.unwrap(failure).toString();
                }
                if (healthy && !wasReady) {
                    logger.info("✅ AI provider {} is ready", slot.id());
                } else if (!healthy && wasReady) {
                    logger.warn("⚠️ AI provider {} failed health check: {}", slot.id(), slot.lastError);
                }
                return null;
            });
    }

    private void startHealthChecks() {
        Duration interval = settings.healthCheckInterval();
        if (scheduler == null || interval.isZero() || interval.isNegative() || healthCheckTask != null) {
            return;
        }
        healthCheckTask = scheduler.scheduleWithFixedDelay(() -> {
            try {
                runHealthCheck().join();
            } catch (RuntimeException e) {
                logger.error("AI health check failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isBudgetExhausted() {
        if (settings.dailyCostBudget() <= 0) {
            return false;
        }
        synchronized (budgetLock) {
            rollBudgetDay();
            return spentToday >= settings.dailyCostBudget();
        }
    }

    private void recordSpend(double cost) {
        synchronized (budgetLock) {
            rollBudgetDay();
            spentToday += cost;
        }
    }

    private void rollBudgetDay() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(budgetDay)) {
            logger.info("Resetting daily AI cost (spent ${} on {})", String.format("%.4f", spentToday), budgetDay);
            budgetDay = today;
            spentToday = 0.0;
        }
    }

    private static final class ProviderSlot {
        private final AIProvider provider;
        private final RateLimiter rateLimiter;
        private final AtomicLong requests = new AtomicLong();
        private final AtomicLong errors = new AtomicLong();
        private volatile boolean configured;
        private volatile boolean ready;
        private volatile String lastError;

        private ProviderSlot(Registration registration) {
            this.provider = Objects.requireNonNull(registration.provider(), "provider");
            this.rateLimiter = Objects.requireNonNull(registration.rateLimiter(), "rateLimiter");
        }

        private String id() {
            return provider.serviceId();
        }

        private ProviderHealth health() {
            long requestCount = requests.get();
            return new ProviderHealth(id(), ready, requestCount, errors.get(), lastError,
                requestCount * provider.costPerCall());
        }
    }
}

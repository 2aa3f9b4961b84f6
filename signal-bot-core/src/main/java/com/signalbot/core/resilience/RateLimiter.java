package com.signalbot.core.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Token bucket rate limiter for outbound API calls.
 *
 * <p>The bucket starts full. Tokens are refilled in whole units proportional to the
 * elapsed fraction of the window and never exceed capacity. Callers that find the
 * bucket empty are queued FIFO and released by a poller that runs every
 * {@link #DEFAULT_POLL_INTERVAL} while the queue is non-empty. Waiting never blocks a
 * thread: {@link #acquire()} returns a future that completes when a token is granted.
 *
 * <p>One instance per external service. The poller executor is shared and not owned.
 */
public final class RateLimiter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
    public static final int EXCHANGE_REQUESTS_PER_MINUTE = 60;
    public static final int AI_REQUESTS_PER_MINUTE = 30;
    static final double LOW_QUOTA_FRACTION = 0.2;

    private final String name;
    private final int capacity;
    private final long windowMillis;
    private final Clock clock;
    private final ScheduledExecutorService poller;
    private final Duration pollInterval;

    // Guards tokens, lastRefillMillis, waiters and pollTask
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private final List<Consumer<RateLimitStatus>> lowQuotaListeners = new CopyOnWriteArrayList<>();

    private int tokens;
    private long lastRefillMillis;
    private ScheduledFuture<?> pollTask;
    private boolean closed;

    public RateLimiter(String name, int capacity, Duration window,
                       ScheduledExecutorService poller, Clock clock) {
        this(name, capacity, window, poller, clock, DEFAULT_POLL_INTERVAL);
    }

    public RateLimiter(String name, int capacity, Duration window,
                       ScheduledExecutorService poller, Clock clock, Duration pollInterval) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive: " + window);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.windowMillis = window.toMillis();
        this.poller = Objects.requireNonNull(poller, "poller");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
        logger.info("RateLimiter '{}' initialized: {} requests per {}s", name, capacity, window.toSeconds());
    }

    /** Exchange market-data limiter, 60 requests per minute. */
    public static RateLimiter forExchange(String name, ScheduledExecutorService poller) {
        return new RateLimiter(name, EXCHANGE_REQUESTS_PER_MINUTE, Duration.ofMinutes(1), poller, Clock.systemUTC());
    }

    /** AI provider limiter; each provider gets its own bucket. */
    public static RateLimiter forAiProvider(String name, int requestsPerMinute, ScheduledExecutorService poller) {
        return new RateLimiter(name, requestsPerMinute, Duration.ofMinutes(1), poller, Clock.systemUTC());
    }

    /**
     * Consume one token, waiting asynchronously if none is available.
     * Queued callers are served strictly in arrival order.
     */
    public CompletableFuture<Void> acquire() {
        RateLimitStatus lowQuota = null;
        CompletableFuture<Void> ticket;
        lock.lock();
        try {
            if (closed) {
                return CompletableFuture.failedFuture(new IllegalStateException("Rate limiter '" + name + "' is closed"));
            }
            refill();
            if (waiters.isEmpty() && tokens > 0) {
                tokens--;
                lowQuota = lowQuotaStatus();
                ticket = CompletableFuture.completedFuture(null);
            } else {
                ticket = new CompletableFuture<>();
                waiters.addLast(ticket);
                ensurePolling();
                logger.debug("RateLimiter '{}' exhausted, {} caller(s) queued", name, waiters.size());
            }
        } finally {
            lock.unlock();
        }
        fireLowQuota(lowQuota);
        return ticket;
    }

    /** Consume a token only if one is available right now and nobody is queued. */
    public boolean tryAcquire() {
        RateLimitStatus lowQuota;
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            refill();
            if (!waiters.isEmpty() || tokens == 0) {
                return false;
            }
            tokens--;
            lowQuota = lowQuotaStatus();
        } finally {
            lock.unlock();
        }
        fireLowQuota(lowQuota);
        return true;
    }

    public RateLimitStatus status() {
        lock.lock();
        try {
            refill();
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /** Register a listener notified whenever remaining tokens drop below 20% of capacity. */
    public void onLowQuota(Consumer<RateLimitStatus> listener) {
        lowQuotaListeners.add(listener);
    }

    public String getName() {
        return name;
    }

    /**
     * Refill and release as many queued callers as there are tokens.
     * Invoked by the poller; package-private so tests can drive it with a fixed clock.
     */
    void drainQueue() {
        List<CompletableFuture<Void>> granted = new ArrayList<>();
        RateLimitStatus lowQuota = null;
        lock.lock();
        try {
            refill();
            while (tokens > 0 && !waiters.isEmpty()) {
                CompletableFuture<Void> waiter = waiters.pollFirst();
                if (waiter.isDone()) {
                    // cancelled by the caller, no token spent
                    continue;
                }
                tokens--;
                granted.add(waiter);
            }
            if (!granted.isEmpty()) {
                lowQuota = lowQuotaStatus();
            }
            if (waiters.isEmpty() && pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }
        } finally {
            lock.unlock();
        }
        granted.forEach(waiter -> waiter.complete(null));
        fireLowQuota(lowQuota);
    }

    @Override
    public void close() {
        List<CompletableFuture<Void>> pending;
        lock.lock();
        try {
            closed = true;
            if (pollTask != null) {
                pollTask.cancel(false);
                pollTask = null;
            }
            pending = new ArrayList<>(waiters);
            waiters.clear();
        } finally {
            lock.unlock();
        }
        IllegalStateException closedError = new IllegalStateException("Rate limiter '" + name + "' closed");
        pending.forEach(waiter -> waiter.completeExceptionally(closedError));
    }

    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillMillis;
        if (elapsed <= 0) {
            return;
        }
        long tokensToAdd = elapsed * capacity / windowMillis;
        if (tokensToAdd > 0) {
            tokens = (int) Math.min(capacity, tokens + tokensToAdd);
            lastRefillMillis = now;
        }
    }

    private void ensurePolling() {
        if (pollTask == null) {
            long period = pollInterval.toMillis();
            pollTask = poller.scheduleWithFixedDelay(this::drainQueue, period, period, TimeUnit.MILLISECONDS);
        }
    }

    private RateLimitStatus lowQuotaStatus() {
        RateLimitStatus status = snapshot();
        return status.isLow() ? status : null;
    }

    private RateLimitStatus snapshot() {
        return new RateLimitStatus(name, tokens, capacity,
            Instant.ofEpochMilli(lastRefillMillis + windowMillis), waiters.size());
    }

    private void fireLowQuota(RateLimitStatus status) {
        if (status == null) {
            return;
        }
        logger.warn("⚠️ Rate limit quota low for '{}': {}/{} remaining, resets at {}",
            name, status.remaining(), status.capacity(), status.resetAt());
        for (Consumer<RateLimitStatus> listener : lowQuotaListeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                logger.error("Low quota listener failed for '{}'", name, e);
            }
        }
    }
}

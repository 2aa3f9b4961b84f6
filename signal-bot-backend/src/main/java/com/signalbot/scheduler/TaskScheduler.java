package com.signalbot.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Fixed-rate runner for asynchronous jobs.
 *
 * A tick is skipped when the previous run of the same job has not completed, and a failed
 * run is logged without cancelling the schedule.
 */
public final class TaskScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private record Job(String key, Supplier<CompletableFuture<?>> task, AtomicBoolean running) {}

    private final ScheduledExecutorService executor;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> handles = new ConcurrentHashMap<>();

    public TaskScheduler() {
        this(Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "signal-bot-scheduler");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public TaskScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Register a job and start ticking it every {@code interval}, first tick after {@code initialDelay}.
     */
    public void schedule(String key, Duration initialDelay, Duration interval, Supplier<CompletableFuture<?>> task) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive for " + key + ": " + interval);
        }
        Job job = new Job(key, task, new AtomicBoolean(false));
        if (jobs.putIfAbsent(key, job) != null) {
            throw new IllegalStateException("Job already scheduled: " + key);
        }
        handles.put(key, executor.scheduleAtFixedRate(() -> tick(job),
            initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS));
        logger.info("⏰ Scheduled {} every {}", key, interval);
    }

    /**
     * Run a registered job now, outside its schedule.
     *
     * @return false if the job is unknown or a run is already in flight
     */
    public boolean trigger(String key) {
        Job job = jobs.get(key);
        return job != null && tick(job);
    }

    public boolean isRunning(String key) {
        Job job = jobs.get(key);
        return job != null && job.running().get();
    }

    public Set<String> jobKeys() {
        return Set.copyOf(jobs.keySet());
    }

    private boolean tick(Job job) {
        if (!job.running().compareAndSet(false, true)) {
            logger.warn("⏭️ Skipping {}: previous run still in progress", job.key());
            return false;
        }

        CompletableFuture<?> run;
        try {
            run = job.task().get();
        } catch (Exception e) {
            logger.error("❌ Job {} failed to start", job.key(), e);
            job.running().set(false);
            return true;
        }
        if (run == null) {
            job.running().set(false);
            return true;
        }

        run.whenComplete((result, error) -> {
            if (error != null) {
                logger.error("❌ Job {} failed: {}", job.key(), error.getMessage(), error);
            }
            job.running().set(false);
        });
        return true;
    }

    public void cancel(String key) {
        ScheduledFuture<?> handle = handles.remove(key);
        jobs.remove(key);
        if (handle != null) {
            handle.cancel(false);
            logger.info("Cancelled {}", key);
        }
    }

    @Override
    public void close() {
        handles.values().forEach(handle -> handle.cancel(false));
        handles.clear();
        jobs.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Task scheduler stopped");
    }
}

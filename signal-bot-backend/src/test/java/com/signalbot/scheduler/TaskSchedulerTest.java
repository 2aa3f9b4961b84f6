package com.signalbot.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Task scheduler")
class TaskSchedulerTest {

    private static final Duration NEVER = Duration.ofHours(1);

    private final TaskScheduler scheduler = new TaskScheduler();

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    @DisplayName("A tick is skipped while the previous run is in flight")
    void skipsOverlappingRuns() {
        AtomicInteger starts = new AtomicInteger();
        CompletableFuture<Void> inFlight = new CompletableFuture<>();
        scheduler.schedule("cycle", NEVER, NEVER, () -> {
            starts.incrementAndGet();
            return inFlight;
        });

        assertThat(scheduler.trigger("cycle")).isTrue();
        assertThat(scheduler.isRunning("cycle")).isTrue();
        assertThat(scheduler.trigger("cycle")).isFalse();
        assertThat(starts).hasValue(1);

        inFlight.complete(null);

        assertThat(scheduler.isRunning("cycle")).isFalse();
        assertThat(scheduler.trigger("cycle")).isTrue();
        assertThat(starts).hasValue(2);
    }

    @Test
    @DisplayName("Failed runs do not block later runs")
    void failuresDoNotStopTheJob() {
        AtomicInteger starts = new AtomicInteger();
        scheduler.schedule("flaky", NEVER, NEVER, () -> {
            if (starts.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
            return CompletableFuture.failedFuture(new IllegalStateException("async boom"));
        });

        assertThat(scheduler.trigger("flaky")).isTrue();
        assertThat(scheduler.trigger("flaky")).isTrue();
        assertThat(scheduler.trigger("flaky")).isTrue();
        assertThat(starts).hasValue(3);
    }

    @Test
    @DisplayName("Jobs tick on their interval")
    void ticksOnSchedule() throws InterruptedException {
        CountDownLatch ticks = new CountDownLatch(3);
        scheduler.schedule("fast", Duration.ZERO, Duration.ofMillis(20), () -> {
            ticks.countDown();
            return CompletableFuture.completedFuture(null);
        });

        assertThat(ticks.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.jobKeys()).containsExactly("fast");
    }

    @Test
    @DisplayName("Duplicate keys and non-positive intervals are rejected")
    void rejectsInvalidJobs() {
        scheduler.schedule("job", NEVER, NEVER, () -> CompletableFuture.completedFuture(null));

        assertThatThrownBy(() -> scheduler.schedule("job", NEVER, NEVER, () -> null))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> scheduler.schedule("other", NEVER, Duration.ZERO, () -> null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(scheduler.trigger("unknown")).isFalse();
    }
}

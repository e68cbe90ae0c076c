package com.questrail.debuglink.internal.time;

import com.questrail.debuglink.time.DeterministicScheduler;
import com.questrail.debuglink.time.ManualMonotonicClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PeriodicTaskTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
    }

    @Test
    void firstRunIsOnePeriodAfterStart() {
        AtomicInteger runs = new AtomicInteger();
        PeriodicTask.start(scheduler, clock, Duration.ofMillis(1000), runs::incrementAndGet);

        scheduler.advanceMillis(999);
        assertEquals(0, runs.get());

        scheduler.advanceMillis(1);
        assertEquals(1, runs.get());
    }

    @Test
    void runsAtFixedRateFromPreviousDeadline() {
        List<Long> firedAt = new ArrayList<>();
        PeriodicTask.start(scheduler, clock, Duration.ofMillis(100), () -> firedAt.add(clock.nowNanos()));

        scheduler.advance(Duration.ofMillis(350));

        assertEquals(List.of(100_000_000L, 200_000_000L, 300_000_000L), firedAt);
        assertEquals(Duration.ofMillis(350), clock.elapsed());
    }

    @Test
    void lateSchedulerCatchesUpTickByTick() {
        AtomicInteger runs = new AtomicInteger();
        PeriodicTask.start(scheduler, clock, Duration.ofMillis(100), runs::incrementAndGet);

        // Jump the clock without running anything, then drain once.
        clock.advance(Duration.ofMillis(450));
        scheduler.runDueTasks();

        assertEquals(4, runs.get());
    }

    @Test
    void cancelStopsFurtherRuns() {
        AtomicInteger runs = new AtomicInteger();
        PeriodicTask task = PeriodicTask.start(scheduler, clock, Duration.ofMillis(100), runs::incrementAndGet);

        scheduler.advanceMillis(200);
        assertTrue(task.cancel());
        assertTrue(task.isCancelled());
        assertFalse(task.cancel(), "Second cancel reports nothing to cancel");

        scheduler.advanceMillis(1000);
        assertEquals(2, runs.get());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void bodyMayCancelItsOwnTask() {
        AtomicInteger runs = new AtomicInteger();
        AtomicReference<PeriodicTask> self = new AtomicReference<>();

        self.set(PeriodicTask.start(scheduler, clock, Duration.ofMillis(100), () -> {
            if (runs.incrementAndGet() == 2) {
                self.get().cancel();
            }
        }));

        scheduler.advanceMillis(1000);
        assertEquals(2, runs.get());
    }

    @Test
    void nonPositivePeriodIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> PeriodicTask.start(scheduler, clock, Duration.ZERO, () -> { }));
        assertThrows(IllegalArgumentException.class,
                () -> PeriodicTask.start(scheduler, clock, Duration.ofMillis(-5), () -> { }));
    }
}

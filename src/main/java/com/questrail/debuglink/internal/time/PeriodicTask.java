package com.questrail.debuglink.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * PeriodicTask
 * =============================================================================
 * Fixed-rate repeating timer built from one-shot {@link MonotonicScheduler} tasks.
 *
 * <p>The first run happens one period after {@link #start}. Each run re-arms the
 * next one before invoking the body, measured from the previous deadline rather
 * than from "now", so a scheduler that falls behind catches up tick by tick.
 * The body may cancel its own task.</p>
 */
public final class PeriodicTask implements Cancellable
{
    private final MonotonicScheduler scheduler;
    private final long periodNanos;
    private final Runnable body;

    private final Object lock = new Object();
    private long nextDeadlineNanos;
    private Cancellable pending;
    private boolean cancelled;

    private PeriodicTask(MonotonicScheduler scheduler, long firstDeadlineNanos, long periodNanos, Runnable body)
    {
        this.scheduler = scheduler;
        this.periodNanos = periodNanos;
        this.body = body;
        this.nextDeadlineNanos = firstDeadlineNanos;
    }

    /**
     * Start a repeating task.
     *
     * @param period strictly positive period
     */
    public static PeriodicTask start(MonotonicScheduler scheduler,
                                     MonotonicClock clock,
                                     Duration period,
                                     Runnable body)
    {
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(body, "body");

        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be > 0");
        }

        long periodNanos = period.toNanos();
        PeriodicTask task = new PeriodicTask(scheduler, clock.nowNanos() + periodNanos, periodNanos, body);
        task.arm();
        return task;
    }

    private void arm()
    {
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            pending = scheduler.scheduleAtNanos(nextDeadlineNanos, this::fire);
        }
    }

    private void fire()
    {
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            nextDeadlineNanos += periodNanos;
        }
        arm();
        body.run();
    }

    @Override
    public boolean cancel()
    {
        Cancellable toCancel;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toCancel = pending;
            pending = null;
        }
        if (toCancel != null) {
            toCancel.cancel();
        }
        return true;
    }

    public boolean isCancelled()
    {
        synchronized (lock) {
            return cancelled;
        }
    }
}

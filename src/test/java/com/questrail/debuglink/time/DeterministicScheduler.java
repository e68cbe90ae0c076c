package com.questrail.debuglink.time;

import com.questrail.debuglink.internal.time.Cancellable;
import com.questrail.debuglink.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()}, {@link #advance(Duration)} or
 * {@link #advanceMillis(long)} is called. Tasks with equal deadlines run in scheduling order.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private static final Duration ONE_TICK = Duration.ofMillis(1);

    private final ManualMonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        while (true) {
            Scheduled next;
            synchronized (this) {
                if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) {
                    return;
                }
                next = queue.poll();
            }
            if (next.fired.compareAndSet(false, true)) {
                next.task.run();
            }
        }
    }

    /**
     * Advance the clock one millisecond at a time, running due tasks at each step,
     * so that tasks observe the clock at their own deadlines.
     */
    public void advance(Duration delta) {
        long millis = delta.toMillis();
        for (long i = 0; i < millis; i++) {
            clock.advance(ONE_TICK);
            runDueTasks();
        }
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * Number of scheduled tasks that have neither run nor been cancelled.
     */
    public synchronized int pendingCount() {
        return (int) queue.stream().filter(s -> !s.fired.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return fired.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.sequence, o.sequence);
        }
    }
}

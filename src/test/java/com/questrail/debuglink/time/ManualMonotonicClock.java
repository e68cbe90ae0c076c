package com.questrail.debuglink.time;

import com.questrail.debuglink.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven monotonic clock for heartbeat and discovery expiry tests.
 *
 * Reads zero until moved with {@link #advance(Duration)}. Deadlines armed by
 * the transports and the discovery sweep are compared against this value, so
 * a test can place the clock exactly on or one tick past a timeout.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong elapsedNanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return elapsedNanos.get();
    }

    /**
     * Time elapsed since the clock was created.
     */
    public Duration elapsed() {
        return Duration.ofNanos(elapsedNanos.get());
    }

    public void advance(Duration delta) {
        if (delta.isNegative()) {
            throw new IllegalArgumentException("Monotonic clock cannot move backwards: " + delta);
        }
        elapsedNanos.addAndGet(delta.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}

package com.questrail.debuglink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for heartbeat deadlines and peer expiry.
 *
 * <h2>Binding invariant</h2>
 * Liveness decisions (pong timeouts, TTL expiry of discovered peers) MUST be
 * computed from a monotonic source. Wall-clock time is only used for the
 * {@code lastSeen} value shown to users and for event timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two values are meaningful.
     */
    long nowNanos();
}

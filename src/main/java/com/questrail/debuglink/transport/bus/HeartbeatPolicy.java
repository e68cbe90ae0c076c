package com.questrail.debuglink.transport.bus;

import java.time.Duration;
import java.util.Objects;

/**
 * HeartbeatPolicy
 * -----------------------------------------------------------------------------
 * Timing of the bus liveness protocol.
 *
 * <ul>
 *   <li><b>interval</b>: spacing of outbound {@code "ping"} messages.</li>
 *   <li><b>pongTimeout</b>: how long an unanswered ping may stay outstanding
 *       before the peer is considered lost.</li>
 * </ul>
 */
public record HeartbeatPolicy(Duration interval, Duration pongTimeout)
{
    public HeartbeatPolicy {
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(pongTimeout, "pongTimeout");

        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (pongTimeout.isNegative() || pongTimeout.isZero()) {
            throw new IllegalArgumentException("pongTimeout must be positive");
        }
    }

    /**
     * 1000 ms interval, 3000 ms pong timeout.
     */
    public static HeartbeatPolicy defaults() {
        return new HeartbeatPolicy(Duration.ofMillis(1000), Duration.ofMillis(3000));
    }
}

package com.questrail.debuglink.discovery;

import java.time.Duration;
import java.util.Objects;

/**
 * DiscoveryTimingPolicy
 * -----------------------------------------------------------------------------
 * <ul>
 *   <li><b>expiry</b>: a peer idle for longer than this is removed.</li>
 *   <li><b>sweepInterval</b>: spacing of expiry sweeps.</li>
 * </ul>
 */
public record DiscoveryTimingPolicy(Duration expiry, Duration sweepInterval)
{
    public DiscoveryTimingPolicy {
        Objects.requireNonNull(expiry, "expiry");
        Objects.requireNonNull(sweepInterval, "sweepInterval");

        if (expiry.isNegative()) {
            throw new IllegalArgumentException("expiry must be non-negative");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    /**
     * 4000 ms expiry, 1000 ms sweep.
     */
    public static DiscoveryTimingPolicy defaults() {
        return new DiscoveryTimingPolicy(Duration.ofMillis(4000), Duration.ofMillis(1000));
    }
}

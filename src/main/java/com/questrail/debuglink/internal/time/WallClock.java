package com.questrail.debuglink.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for {@code lastSeen} values and event timestamps.
 *
 * <p>
 * This clock may jump. It MUST NOT drive heartbeat timeouts or peer expiry.
 * </p>
 */
public interface WallClock
{
    Instant now();
}

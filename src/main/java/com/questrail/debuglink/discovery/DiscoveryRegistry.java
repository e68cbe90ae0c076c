package com.questrail.debuglink.discovery;

import java.time.Duration;

/**
 * Write surface of the registry, handed by {@link ConnectionDiscovery} to its
 * {@link DiscoveryStrategy}. The registry itself stays private to the service.
 */
public interface DiscoveryRegistry
{
    /**
     * Insert or refresh a peer with {@code lastSeen = now}. Subscribers are
     * notified only if the id was not present.
     */
    void record(String id, String name, ConnectionMode mode);

    /**
     * Remove every peer idle for longer than {@code expiry}. Subscribers are
     * notified once if anything was removed.
     *
     * @return number of peers removed
     */
    int expireIdle(Duration expiry);

    /**
     * Report an announcement that was dropped.
     *
     * @param raw   the message as received
     * @param cause parse failure, or {@code null} when fields were missing
     */
    void dropped(Object raw, String reason, Throwable cause);
}

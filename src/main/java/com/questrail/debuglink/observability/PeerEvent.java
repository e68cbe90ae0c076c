package com.questrail.debuglink.observability;

import com.questrail.debuglink.discovery.AvailableConnection;

import java.time.Instant;

/**
 * A peer entered or left the discovery registry.
 */
public record PeerEvent(
    Instant timestamp,
    Kind kind,
    AvailableConnection connection
) {
    public enum Kind {
        DISCOVERED,
        EXPIRED
    }
}

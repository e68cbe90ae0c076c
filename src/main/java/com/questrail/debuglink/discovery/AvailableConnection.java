package com.questrail.debuglink.discovery;

import java.time.Instant;
import java.util.Objects;

/**
 * A reachable emulator as seen by discovery.
 *
 * @param id       routing key: the WebSocket URL for {@link ConnectionMode#REMOTE},
 *                 the peer-generated token for {@link ConnectionMode#EMBEDDED}
 * @param name     display name
 * @param mode     which transport reaches it
 * @param lastSeen wall-clock time of the latest announcement
 */
public record AvailableConnection(String id, String name, ConnectionMode mode, Instant lastSeen)
{
    public AvailableConnection {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(lastSeen, "lastSeen");
    }
}

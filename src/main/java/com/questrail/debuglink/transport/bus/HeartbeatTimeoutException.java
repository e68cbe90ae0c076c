package com.questrail.debuglink.transport.bus;

import java.time.Duration;

/**
 * Cause attached to the {@code CLOSED} transition of a {@link BusTransport} whose
 * peer stopped answering pings.
 */
public final class HeartbeatTimeoutException extends RuntimeException
{
    public HeartbeatTimeoutException(Duration timeout)
    {
        super("No pong within " + timeout.toMillis() + " ms - connection lost");
    }
}

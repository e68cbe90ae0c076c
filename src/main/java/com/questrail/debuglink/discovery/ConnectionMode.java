package com.questrail.debuglink.discovery;

import com.questrail.debuglink.transport.TransportKind;

/**
 * How a discovered emulator is reached.
 */
public enum ConnectionMode
{
    /** Emulator sharing a same-host bus; reached with a bus transport. */
    EMBEDDED(TransportKind.BUS),

    /** Emulator serving WebSocket connections; reached with a WebSocket transport. */
    REMOTE(TransportKind.WEBSOCKET);

    private final TransportKind transportKind;

    ConnectionMode(TransportKind transportKind)
    {
        this.transportKind = transportKind;
    }

    public TransportKind transportKind()
    {
        return transportKind;
    }
}

package com.questrail.debuglink.transport;

/**
 * Substrate a {@link Transport} is built on.
 */
public enum TransportKind
{
    /** Point-to-point WebSocket connection to a remote emulator. */
    WEBSOCKET,

    /** Same-host named publish/subscribe bus shared with an embedded emulator. */
    BUS
}

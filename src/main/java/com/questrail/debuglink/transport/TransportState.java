package com.questrail.debuglink.transport;

/**
 * Lifecycle of a {@link Transport}.
 *
 * <pre>
 *   IDLE → CONNECTING → OPEN → CLOSED
 *             └──────────────→ CLOSED   (failed handshake)
 * </pre>
 *
 * <p>{@code CLOSED} may be entered from any state. A transport never moves from
 * {@code OPEN} back to {@code CONNECTING}; a new attempt after {@code CLOSED}
 * is announced as {@code CONNECTING} again.</p>
 */
public enum TransportState
{
    IDLE,
    CONNECTING,
    OPEN,
    CLOSED
}

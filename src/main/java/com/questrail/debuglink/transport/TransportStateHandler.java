package com.questrail.debuglink.transport;

/**
 * Receives {@link Transport} state transitions in the order they occur.
 */
@FunctionalInterface
public interface TransportStateHandler
{
    /**
     * @param state the new state
     * @param cause the failure behind a {@link TransportState#CLOSED} transition;
     *              {@code null} for orderly transitions
     */
    void onStateChange(TransportState state, Throwable cause);
}

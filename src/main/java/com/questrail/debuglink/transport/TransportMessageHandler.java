package com.questrail.debuglink.transport;

/**
 * Receives inbound payloads from an open {@link Transport}, in receipt order.
 */
@FunctionalInterface
public interface TransportMessageHandler
{
    void onMessage(String payload);
}

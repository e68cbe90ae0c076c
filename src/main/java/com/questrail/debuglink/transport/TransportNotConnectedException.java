package com.questrail.debuglink.transport;

/**
 * Thrown by {@link Transport#send(String)} when the transport is not
 * {@link TransportState#OPEN}. The payload was not written.
 */
public final class TransportNotConnectedException extends IllegalStateException
{
    public TransportNotConnectedException()
    {
        super("Not Connected");
    }
}

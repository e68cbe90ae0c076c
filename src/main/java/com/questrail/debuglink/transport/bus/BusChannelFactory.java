package com.questrail.debuglink.transport.bus;

/**
 * Opens handles on a same-host publish/subscribe bus.
 *
 * <p>Implemented by {@link LocalBus} (in-JVM) and by
 * {@code NettyMulticastBus} (processes on the same host).</p>
 */
public interface BusChannelFactory
{
    /**
     * Open a handle on the named channel. The listener receives messages posted
     * by other handles until the returned handle is closed.
     */
    BusChannel open(String name, BusChannelListener listener);
}

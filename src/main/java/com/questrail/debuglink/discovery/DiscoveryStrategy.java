package com.questrail.debuglink.discovery;

/**
 * Mode-specific way of finding peers, chosen once when a
 * {@link ConnectionDiscovery} is constructed.
 */
public interface DiscoveryStrategy
{
    ConnectionMode mode();

    /**
     * Begin producing peers into the registry.
     */
    void start(DiscoveryRegistry registry);

    /**
     * Release channels and timers. Must tolerate being called without a prior
     * {@link #start}.
     */
    void stop();
}

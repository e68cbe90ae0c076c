package com.questrail.debuglink.discovery;

import java.util.List;

/**
 * Receives the full set of available connections whenever it changes.
 */
@FunctionalInterface
public interface ConnectionsChangedHandler
{
    void onConnectionsChanged(List<AvailableConnection> connections);
}

/**
 * Connection Discovery
 * =============================================================================
 *
 * <p>Maintains the set of emulators a user could connect to. One
 * {@link com.questrail.debuglink.discovery.ConnectionDiscovery} per front-end,
 * constructed with the strategy for its
 * {@link com.questrail.debuglink.discovery.ConnectionMode}.</p>
 *
 * <pre>
 *   bus announcement / configured origin
 *        → DiscoveryStrategy
 *            → DiscoveryRegistry   (record, expireIdle, dropped)
 *                → ConnectionsChangedHandler (full snapshot)
 * </pre>
 *
 * <p>Peer expiry runs on the monotonic clock. {@code lastSeen} is wall-clock
 * time for display only.</p>
 */
package com.questrail.debuglink.discovery;

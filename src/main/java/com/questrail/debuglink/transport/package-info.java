/**
 * Debug Link Transports
 * =============================================================================
 *
 * The boundary between the debugger's RPC layer and the substrate that carries
 * its payloads to one emulator.
 *
 * <p>Everything above this package sees only:</p>
 * <ul>
 *   <li>opaque payloads as {@code String}</li>
 *   <li>a {@link com.questrail.debuglink.transport.TransportState} lifecycle</li>
 *   <li>{@link com.questrail.debuglink.transport.Subscription} handles</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Transport implementations MUST:
 * <ul>
 *   <li>Not interpret payloads beyond their own control messages</li>
 *   <li>Not retry or reconnect on their own</li>
 *   <li>Report every failure after {@code connect} as a {@code CLOSED} transition</li>
 * </ul>
 *
 * <p>Netty types stay inside {@code transport.websocket} and
 * {@code transport.bus.netty}.</p>
 */
package com.questrail.debuglink.transport;

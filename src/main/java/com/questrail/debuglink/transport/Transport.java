package com.questrail.debuglink.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Transport
 * =============================================================================
 * Moves opaque string payloads between the debugger front-end and one emulator.
 *
 * <p>The RPC layer sits strictly above this interface: it assigns request ids,
 * correlates responses and dispatches notifications using only {@link #send},
 * {@link #subscribe} and {@link #onStateChange}. Nothing here interprets
 * payloads.</p>
 *
 * <h2>Failure reporting</h2>
 * <ul>
 *   <li>Failures after {@link #connect} are reported only as a
 *       {@link TransportState#CLOSED} transition through {@link #onStateChange}.</li>
 *   <li>{@link #send} is the exception: it fails fast with
 *       {@link TransportNotConnectedException} because the caller must know the
 *       write did not happen.</li>
 *   <li>Nothing is retried. Reconnecting is the caller's decision.</li>
 * </ul>
 */
public interface Transport
{
    TransportKind kind();

    TransportState state();

    /**
     * Connect to the endpoint.
     *
     * <p>The returned future completes only once the substrate is ready and the
     * state is {@link TransportState#OPEN}. On failure the state becomes
     * {@link TransportState#CLOSED} and the future completes exceptionally with
     * the substrate's error.</p>
     *
     * <p>Calling this while {@code OPEN} is a no-op that returns a completed
     * future; calling it while {@code CONNECTING} returns the pending future.</p>
     *
     * @param endpoint WebSocket URL, or the peer id for the bus
     * @throws IllegalArgumentException if {@code endpoint} is empty
     */
    CompletableFuture<Void> connect(String endpoint, TransportOptions options);

    default CompletableFuture<Void> connect(String endpoint)
    {
        return connect(endpoint, TransportOptions.none());
    }

    /**
     * Close the transport and release the substrate handle. Idempotent and never
     * throws.
     *
     * @param code   close code where the substrate has one; may be {@code null}
     * @param reason close reason where the substrate has one; may be {@code null}
     */
    void disconnect(Integer code, String reason);

    default void disconnect()
    {
        disconnect(null, null);
    }

    /**
     * @throws TransportNotConnectedException if the state is not {@code OPEN}
     */
    void send(String payload);

    Subscription subscribe(TransportMessageHandler handler);

    Subscription onStateChange(TransportStateHandler handler);
}

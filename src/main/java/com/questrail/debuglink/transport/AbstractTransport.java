package com.questrail.debuglink.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * AbstractTransport
 * =============================================================================
 * Handler registries and state broadcasting shared by both transports.
 *
 * <h2>Dispatch</h2>
 * Handler sets are copy-on-write: each dispatch iterates the snapshot taken when
 * it began. A handler may unsubscribe itself or another handler, or call
 * {@link #disconnect()}, from inside a callback without corrupting the set or
 * skipping the remaining handlers of that dispatch.
 *
 * <p>An exception thrown by one handler is logged and does not stop delivery to
 * the others.</p>
 */
public abstract class AbstractTransport implements Transport
{
    private static final Logger log = LoggerFactory.getLogger(AbstractTransport.class);

    private final Set<TransportMessageHandler> messageHandlers = new CopyOnWriteArraySet<>();
    private final Set<TransportStateHandler> stateHandlers = new CopyOnWriteArraySet<>();

    private volatile TransportState state = TransportState.IDLE;

    @Override
    public TransportState state()
    {
        return state;
    }

    @Override
    public Subscription subscribe(TransportMessageHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        messageHandlers.add(handler);
        return () -> messageHandlers.remove(handler);
    }

    @Override
    public Subscription onStateChange(TransportStateHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        stateHandlers.add(handler);
        return () -> stateHandlers.remove(handler);
    }

    /**
     * Record the new state and notify state handlers.
     */
    protected void broadcastState(TransportState next, Throwable cause)
    {
        state = next;
        for (TransportStateHandler handler : stateHandlers) {
            try {
                handler.onStateChange(next, cause);
            } catch (RuntimeException e) {
                log.warn("{} state handler failed on {}", kind(), next, e);
            }
        }
    }

    protected void broadcastMessage(String payload)
    {
        for (TransportMessageHandler handler : messageHandlers) {
            try {
                handler.onMessage(payload);
            } catch (RuntimeException e) {
                log.warn("{} payload handler failed", kind(), e);
            }
        }
    }

    protected static String requireEndpoint(String endpoint)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        if (endpoint.isEmpty()) {
            throw new IllegalArgumentException("endpoint must not be empty");
        }
        return endpoint;
    }
}

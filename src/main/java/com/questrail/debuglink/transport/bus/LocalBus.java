package com.questrail.debuglink.transport.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;

/**
 * LocalBus
 * =============================================================================
 * In-JVM {@link BusChannelFactory}, used when the debugger and the emulator run
 * in the same process, and by tests.
 *
 * <p>Messages are passed by reference, so structured values reach listeners
 * unchanged. Delivery for each receiving handle runs on the configured
 * {@link Executor}; the default executor delivers synchronously on the posting
 * thread.</p>
 */
public final class LocalBus implements BusChannelFactory
{
    private static final Logger log = LoggerFactory.getLogger(LocalBus.class);

    private final Executor delivery;
    private final Map<String, Set<Handle>> channels = new ConcurrentHashMap<>();

    public LocalBus()
    {
        this(Runnable::run);
    }

    public LocalBus(Executor delivery)
    {
        this.delivery = Objects.requireNonNull(delivery, "delivery");
    }

    @Override
    public BusChannel open(String name, BusChannelListener listener)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(listener, "listener");

        Handle handle = new Handle(name, listener);
        channels.computeIfAbsent(name, n -> new CopyOnWriteArraySet<>()).add(handle);
        return handle;
    }

    /**
     * Number of open handles on a channel.
     */
    public int listenerCount(String name)
    {
        Set<Handle> handles = channels.get(name);
        return handles == null ? 0 : handles.size();
    }

    private void deliver(Handle from, Object message)
    {
        Set<Handle> handles = channels.get(from.name);
        if (handles == null) {
            return;
        }
        for (Handle to : handles) {
            if (to == from) {
                continue;
            }
            delivery.execute(() -> to.receive(message));
        }
    }

    private final class Handle implements BusChannel
    {
        private final String name;
        private final BusChannelListener listener;
        private volatile boolean closed;

        private Handle(String name, BusChannelListener listener)
        {
            this.name = name;
            this.listener = listener;
        }

        @Override
        public String name()
        {
            return name;
        }

        @Override
        public void post(Object message)
        {
            Objects.requireNonNull(message, "message");
            if (closed) {
                throw new IllegalStateException("Channel '" + name + "' is closed");
            }
            deliver(this, message);
        }

        @Override
        public void close()
        {
            if (closed) {
                return;
            }
            closed = true;
            channels.computeIfPresent(name, (n, handles) -> {
                handles.remove(this);
                return handles.isEmpty() ? null : handles;
            });
        }

        private void receive(Object message)
        {
            // A handle closed after the post started must not see the message.
            if (closed) {
                return;
            }
            try {
                listener.onMessage(message);
            } catch (RuntimeException e) {
                log.warn("Listener on bus channel '{}' failed", name, e);
            }
        }
    }
}

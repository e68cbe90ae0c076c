package com.questrail.debuglink.transport.bus;

import com.questrail.debuglink.internal.time.Cancellable;
import com.questrail.debuglink.internal.time.MonotonicClock;
import com.questrail.debuglink.internal.time.MonotonicScheduler;
import com.questrail.debuglink.internal.time.PeriodicTask;
import com.questrail.debuglink.transport.AbstractTransport;
import com.questrail.debuglink.transport.TransportKind;
import com.questrail.debuglink.transport.TransportNotConnectedException;
import com.questrail.debuglink.transport.TransportOptions;
import com.questrail.debuglink.transport.TransportState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * BusTransport
 * =============================================================================
 * {@link com.questrail.debuglink.transport.Transport} over a named same-host
 * publish/subscribe channel, with an application-level heartbeat.
 *
 * <h2>Why a heartbeat</h2>
 * A bus has no connection and therefore no disconnect signal: a crashed or
 * reloaded emulator simply stops posting. Without the heartbeat the transport
 * would stay {@code OPEN} forever and {@link #send} would succeed into the void.
 *
 * <h2>Protocol</h2>
 * <ul>
 *   <li>Every {@link HeartbeatPolicy#interval()} the transport arms a pong
 *       timeout (unless one is already pending) and posts {@value #PING}.</li>
 *   <li>A {@value #PONG} from the peer cancels the pending timeout.</li>
 *   <li>If the timeout fires, the peer is lost: the transport tears down and
 *       broadcasts {@code CLOSED} with a {@link HeartbeatTimeoutException}.</li>
 * </ul>
 * The timeout is armed before the ping is posted so that a bus delivering
 * synchronously cannot slip the pong in ahead of it.
 *
 * <h2>Teardown</h2>
 * Disconnect, heartbeat loss and channel errors all go through one teardown
 * routine that cancels the ping task and the pong timeout, closes the channel
 * and bumps the connection generation. Listener and timer callbacks carry the
 * generation (or arm sequence) they were created for and ignore themselves once
 * it is stale.
 */
public final class BusTransport extends AbstractTransport
{
    public static final String PING = "ping";
    public static final String PONG = "pong";

    private static final Logger log = LoggerFactory.getLogger(BusTransport.class);

    private final BusChannelFactory bus;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final HeartbeatPolicy heartbeat;

    private final Object lock = new Object();
    private BusChannel channel;
    private CompletableFuture<Void> pendingConnect;
    private long generation;
    private PeriodicTask pingTask;
    private Cancellable pongTimeout;
    private long lastArmedSequence;
    private long armedSequence;

    public BusTransport(BusChannelFactory bus,
                        MonotonicScheduler scheduler,
                        MonotonicClock clock,
                        HeartbeatPolicy heartbeat)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.heartbeat = Objects.requireNonNull(heartbeat, "heartbeat");
    }

    @Override
    public TransportKind kind()
    {
        return TransportKind.BUS;
    }

    /**
     * Open the peer's session channel.
     *
     * <p>The attempt is registered before {@code CONNECTING} is broadcast, so a
     * state handler may cancel it with {@link #disconnect()} or join it with a
     * second {@code connect}.</p>
     *
     * @param endpoint peer id; the channel is {@code nulldc-debugger-<endpoint>}
     *                 unless {@link TransportOptions#channelName()} overrides it
     */
    @Override
    public CompletableFuture<Void> connect(String endpoint, TransportOptions options)
    {
        requireEndpoint(endpoint);
        Objects.requireNonNull(options, "options");

        String channelName = options.channelName().orElseGet(() -> ChannelNames.session(endpoint));

        long gen;
        CompletableFuture<Void> ready;
        synchronized (lock) {
            if (channel != null) {
                return CompletableFuture.completedFuture(null);
            }
            if (pendingConnect != null) {
                return pendingConnect;
            }
            gen = ++generation;
            ready = new CompletableFuture<>();
            pendingConnect = ready;
        }

        broadcastState(TransportState.CONNECTING, null);
        if (!isAttemptCurrent(gen)) {
            return ready;
        }

        BusChannel opened;
        try {
            opened = bus.open(channelName, new Listener(gen));
        } catch (RuntimeException e) {
            synchronized (lock) {
                if (gen != generation) {
                    return ready;
                }
                pendingConnect = null;
                generation++;
            }
            log.warn("Failed to open bus channel '{}'", channelName, e);
            broadcastState(TransportState.CLOSED, e);
            ready.completeExceptionally(e);
            return ready;
        }

        synchronized (lock) {
            if (gen != generation) {
                // Cancelled while the channel was being opened.
                opened.close();
                return ready;
            }
            channel = opened;
            pendingConnect = null;
        }

        // No handshake on a bus: the channel is usable as soon as it exists.
        broadcastState(TransportState.OPEN, null);

        synchronized (lock) {
            // A state handler may have disconnected us already.
            if (channel == opened) {
                pingTask = PeriodicTask.start(scheduler, clock, heartbeat.interval(), () -> onHeartbeatTick(gen));
            }
        }

        log.debug("Bus transport open on '{}'", channelName);
        ready.complete(null);
        return ready;
    }

    @Override
    public void disconnect(Integer code, String reason)
    {
        CompletableFuture<Void> pending;
        synchronized (lock) {
            if (channel == null && pendingConnect == null) {
                return;
            }
            pending = pendingConnect;
            teardownLocked();
        }
        broadcastState(TransportState.CLOSED, null);
        if (pending != null) {
            pending.completeExceptionally(new IllegalStateException("Disconnected before the channel opened"));
        }
    }

    @Override
    public void send(String payload)
    {
        Objects.requireNonNull(payload, "payload");

        BusChannel target;
        synchronized (lock) {
            target = channel;
        }
        if (target == null || state() != TransportState.OPEN) {
            throw new TransportNotConnectedException();
        }

        try {
            target.post(payload);
        } catch (IllegalStateException e) {
            // Closed underneath us by a concurrent teardown.
            throw new TransportNotConnectedException();
        }
    }

    // -------------------------------------------------------------------------
    // Heartbeat
    // -------------------------------------------------------------------------

    private void onHeartbeatTick(long gen)
    {
        BusChannel target;
        synchronized (lock) {
            if (gen != generation || channel == null) {
                return;
            }
            target = channel;
            if (pongTimeout == null) {
                long seq = ++lastArmedSequence;
                armedSequence = seq;
                pongTimeout = scheduler.scheduleAfter(heartbeat.pongTimeout(), clock, () -> onPongTimeout(seq));
            }
        }

        try {
            target.post(PING);
        } catch (RuntimeException e) {
            fail(gen, e);
        }
    }

    private void onPong()
    {
        synchronized (lock) {
            if (pongTimeout != null) {
                pongTimeout.cancel();
                pongTimeout = null;
            }
            armedSequence = 0;
        }
    }

    private void onPongTimeout(long seq)
    {
        String channelName;
        synchronized (lock) {
            if (seq != armedSequence || channel == null) {
                return;
            }
            channelName = channel.name();
            teardownLocked();
        }
        log.warn("Pong timeout on '{}' - connection lost", channelName);
        broadcastState(TransportState.CLOSED, new HeartbeatTimeoutException(heartbeat.pongTimeout()));
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    private void fail(long gen, Throwable cause)
    {
        synchronized (lock) {
            if (gen != generation || channel == null) {
                return;
            }
            teardownLocked();
        }
        broadcastState(TransportState.CLOSED, cause);
    }

    private void teardownLocked()
    {
        if (pingTask != null) {
            pingTask.cancel();
            pingTask = null;
        }
        if (pongTimeout != null) {
            pongTimeout.cancel();
            pongTimeout = null;
        }
        armedSequence = 0;
        pendingConnect = null;

        BusChannel closing = channel;
        channel = null;
        generation++;
        if (closing != null) {
            closing.close();
        }
    }

    private boolean isAttemptCurrent(long gen)
    {
        synchronized (lock) {
            return gen == generation && pendingConnect != null;
        }
    }

    private boolean isCurrent(long gen)
    {
        synchronized (lock) {
            return gen == generation && channel != null;
        }
    }

    private final class Listener implements BusChannelListener
    {
        private final long gen;

        private Listener(long gen)
        {
            this.gen = gen;
        }

        @Override
        public void onMessage(Object message)
        {
            if (!(message instanceof String payload) || !isCurrent(gen)) {
                return;
            }
            if (PONG.equals(payload)) {
                onPong();
                return;
            }
            if (PING.equals(payload)) {
                // Another debugger probing the same peer.
                return;
            }
            broadcastMessage(payload);
        }

        @Override
        public void onMessageError(Throwable cause)
        {
            log.warn("Bus channel error", cause);
            fail(gen, cause);
        }
    }
}

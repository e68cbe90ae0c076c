package com.questrail.debuglink.peer;

import com.questrail.debuglink.discovery.Announcement;
import com.questrail.debuglink.discovery.AnnouncementParser;
import com.questrail.debuglink.internal.time.MonotonicClock;
import com.questrail.debuglink.internal.time.MonotonicScheduler;
import com.questrail.debuglink.internal.time.PeriodicTask;
import com.questrail.debuglink.internal.time.WallClock;
import com.questrail.debuglink.transport.TransportMessageHandler;
import com.questrail.debuglink.transport.TransportNotConnectedException;
import com.questrail.debuglink.transport.bus.BusChannel;
import com.questrail.debuglink.transport.bus.BusChannelFactory;
import com.questrail.debuglink.transport.bus.BusChannelListener;
import com.questrail.debuglink.transport.bus.BusTransport;
import com.questrail.debuglink.transport.bus.ChannelNames;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * EmbeddedPeerEndpoint
 * =============================================================================
 * Emulator side of the bus protocol: makes an embedded emulator discoverable and
 * keeps debugger heartbeats answered.
 *
 * <h2>Channels</h2>
 * <ul>
 *   <li>Announcement channel: a JSON {@link Announcement} is posted on
 *       {@link #start()} and then every announcement interval.</li>
 *   <li>Session channel {@code nulldc-debugger-<id>}: {@value BusTransport#PING}
 *       is answered with {@value BusTransport#PONG}; any other string is handed
 *       to the inbound handler (the emulator's RPC server).</li>
 * </ul>
 */
public final class EmbeddedPeerEndpoint
{
    public static final Duration DEFAULT_ANNOUNCE_INTERVAL = Duration.ofMillis(1000);

    private static final Logger log = LoggerFactory.getLogger(EmbeddedPeerEndpoint.class);

    private final BusChannelFactory bus;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Duration announceInterval;
    private final AnnouncementParser codec = new AnnouncementParser();
    private final String id;
    private final String name;

    private final Object lock = new Object();
    private volatile TransportMessageHandler inbound = payload -> { };
    private BusChannel announcements;
    private BusChannel session;
    private PeriodicTask announcer;

    public EmbeddedPeerEndpoint(BusChannelFactory bus,
                                MonotonicScheduler scheduler,
                                MonotonicClock clock,
                                WallClock wallClock,
                                Duration announceInterval)
    {
        this(bus, scheduler, clock, wallClock, announceInterval, generateId(wallClock));
    }

    public EmbeddedPeerEndpoint(BusChannelFactory bus,
                                MonotonicScheduler scheduler,
                                MonotonicClock clock,
                                WallClock wallClock,
                                Duration announceInterval,
                                String id)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.announceInterval = Objects.requireNonNull(announceInterval, "announceInterval");
        this.id = Objects.requireNonNull(id, "id");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("id must not be empty");
        }
        this.name = "nullDC Instance " + id.substring(0, Math.min(8, id.length()));
    }

    /**
     * Hex epoch millis followed by a hex random number below one million.
     */
    static String generateId(WallClock wallClock)
    {
        long timestamp = wallClock.now().toEpochMilli();
        long random = ThreadLocalRandom.current().nextLong(1_000_000L);
        return Long.toHexString(timestamp) + Long.toHexString(random);
    }

    public String id()
    {
        return id;
    }

    public String name()
    {
        return name;
    }

    /**
     * Must be set before {@link #start()} to see the first payloads.
     */
    public void setInboundHandler(TransportMessageHandler handler)
    {
        this.inbound = Objects.requireNonNull(handler, "handler");
    }

    public void start()
    {
        synchronized (lock) {
            if (session != null) {
                return;
            }
            session = bus.open(ChannelNames.session(id), new SessionListener());
            announcements = bus.open(ChannelNames.ANNOUNCE, new IgnoringListener());
            announcer = PeriodicTask.start(scheduler, clock, announceInterval, this::announce);
        }
        log.info("Embedded peer {} started as '{}'", id, name);
        announce();
    }

    public void stop()
    {
        synchronized (lock) {
            if (announcer != null) {
                announcer.cancel();
                announcer = null;
            }
            if (announcements != null) {
                announcements.close();
                announcements = null;
            }
            if (session != null) {
                session.close();
                session = null;
            }
        }
    }

    /**
     * Post a payload to the debugger on the session channel.
     *
     * @throws TransportNotConnectedException if the endpoint is not started
     */
    public void send(String payload)
    {
        Objects.requireNonNull(payload, "payload");
        BusChannel target;
        synchronized (lock) {
            target = session;
        }
        if (target == null) {
            throw new TransportNotConnectedException();
        }
        target.post(payload);
    }

    private void announce()
    {
        BusChannel target;
        synchronized (lock) {
            target = announcements;
        }
        if (target == null) {
            return;
        }
        String json = codec.toJson(new Announcement(id, name, wallClock.now().toEpochMilli()));
        try {
            target.post(json);
        } catch (RuntimeException e) {
            log.error("Failed to post announcement", e);
        }
    }

    private void answerPing()
    {
        BusChannel target;
        synchronized (lock) {
            target = session;
        }
        if (target == null) {
            return;
        }
        try {
            target.post(BusTransport.PONG);
        } catch (RuntimeException e) {
            log.error("Failed to send pong", e);
        }
    }

    private final class SessionListener implements BusChannelListener
    {
        @Override
        public void onMessage(Object message)
        {
            if (!(message instanceof String payload)) {
                return;
            }
            if (BusTransport.PING.equals(payload)) {
                answerPing();
                return;
            }
            if (BusTransport.PONG.equals(payload)) {
                // Another peer answering; not ours to handle.
                return;
            }
            inbound.onMessage(payload);
        }

        @Override
        public void onMessageError(Throwable cause)
        {
            log.warn("Session channel error for peer {}", id, cause);
        }
    }

    /**
     * Announcements from other peers are of no interest to a peer.
     */
    private static final class IgnoringListener implements BusChannelListener
    {
        @Override
        public void onMessage(Object message)
        {
        }

        @Override
        public void onMessageError(Throwable cause)
        {
            log.debug("Announcement channel error", cause);
        }
    }
}

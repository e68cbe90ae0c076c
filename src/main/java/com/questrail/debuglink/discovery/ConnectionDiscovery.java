package com.questrail.debuglink.discovery;

import com.questrail.debuglink.internal.time.MonotonicClock;
import com.questrail.debuglink.internal.time.WallClock;
import com.questrail.debuglink.observability.AnnouncementDroppedEvent;
import com.questrail.debuglink.observability.LinkObservabilitySink;
import com.questrail.debuglink.observability.PeerEvent;
import com.questrail.debuglink.transport.Subscription;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * ConnectionDiscovery
 * =============================================================================
 * Live set of emulators a user could connect to, for one {@link ConnectionMode}.
 *
 * <h2>Ownership</h2>
 * The registry is private to this service. The {@link DiscoveryStrategy} writes
 * to it only through {@link DiscoveryRegistry}; consumers only ever see
 * immutable snapshots, from {@link #getAvailableConnections()} or delivered to
 * {@link ConnectionsChangedHandler}s.
 *
 * <h2>Notification</h2>
 * Handlers receive the full snapshot, never a diff, and only when the set of
 * ids changes: a new id appears, or a sweep removes at least one id (one
 * notification per sweep). Refreshing {@code lastSeen} of a known id does not
 * notify.
 *
 * <h2>Threading</h2>
 * Announcements and sweeps may arrive on different threads. Registry mutation
 * and the notification that follows it happen under one lock, so handlers see
 * snapshots in the order the registry changed.
 */
public final class ConnectionDiscovery
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionDiscovery.class);

    private final DiscoveryStrategy strategy;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final LinkObservabilitySink observability;

    private final Object lock = new Object();
    private final Map<String, Entry> connections = new LinkedHashMap<>();
    private final Set<ConnectionsChangedHandler> handlers = new CopyOnWriteArraySet<>();
    private final Registry registry = new Registry();
    private boolean started;

    public ConnectionDiscovery(DiscoveryStrategy strategy,
                               MonotonicClock clock,
                               WallClock wallClock,
                               LinkObservabilitySink observability)
    {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observability = Objects.requireNonNull(observability, "observability");
    }

    public ConnectionMode mode()
    {
        return strategy.mode();
    }

    /**
     * Start discovering. A second call while started is ignored. If the
     * strategy fails to start, the service stays stopped and may be started
     * again.
     */
    public void start()
    {
        synchronized (lock) {
            if (started) {
                return;
            }
            started = true;
        }
        log.debug("Starting {} discovery", strategy.mode());
        try {
            strategy.start(registry);
        } catch (RuntimeException e) {
            synchronized (lock) {
                started = false;
                connections.clear();
            }
            log.warn("Failed to start {} discovery", strategy.mode(), e);
            throw e;
        }
    }

    /**
     * Stop discovering and forget every peer. Subscribers are not notified.
     */
    public void stop()
    {
        strategy.stop();
        synchronized (lock) {
            started = false;
            connections.clear();
        }
        log.debug("Stopped {} discovery", strategy.mode());
    }

    /**
     * Point-in-time copy of the registry, in discovery order.
     */
    public List<AvailableConnection> getAvailableConnections()
    {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    public Subscription onConnectionsChanged(ConnectionsChangedHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    private List<AvailableConnection> snapshotLocked()
    {
        List<AvailableConnection> snapshot = new ArrayList<>(connections.size());
        for (Entry entry : connections.values()) {
            snapshot.add(entry.connection());
        }
        return List.copyOf(snapshot);
    }

    private void notifyLocked()
    {
        List<AvailableConnection> snapshot = snapshotLocked();
        for (ConnectionsChangedHandler handler : handlers) {
            try {
                handler.onConnectionsChanged(snapshot);
            } catch (RuntimeException e) {
                log.warn("Connections-changed handler failed", e);
            }
        }
    }

    /**
     * @param lastSeenNanos monotonic tick of the latest announcement; drives expiry
     */
    private record Entry(AvailableConnection connection, long lastSeenNanos)
    {
    }

    private final class Registry implements DiscoveryRegistry
    {
        @Override
        public void record(String id, String name, ConnectionMode mode)
        {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(mode, "mode");

            synchronized (lock) {
                if (!started) {
                    return;
                }

                Instant now = wallClock.now();
                Entry previous = connections.get(id);
                if (previous != null && previous.connection().lastSeen().isAfter(now)) {
                    // Wall clock stepped back; lastSeen never decreases.
                    now = previous.connection().lastSeen();
                }

                AvailableConnection connection = new AvailableConnection(id, name, mode, now);
                connections.put(id, new Entry(connection, clock.nowNanos()));

                if (previous == null) {
                    observability.onPeerEvent(new PeerEvent(now, PeerEvent.Kind.DISCOVERED, connection));
                    notifyLocked();
                }
            }
        }

        @Override
        public int expireIdle(Duration expiry)
        {
            Objects.requireNonNull(expiry, "expiry");

            synchronized (lock) {
                if (!started) {
                    return 0;
                }

                long nowNanos = clock.nowNanos();
                long expiryNanos = expiry.toNanos();
                List<AvailableConnection> expired = new ArrayList<>();

                Iterator<Entry> it = connections.values().iterator();
                while (it.hasNext()) {
                    Entry entry = it.next();
                    if (nowNanos - entry.lastSeenNanos() > expiryNanos) {
                        it.remove();
                        expired.add(entry.connection());
                    }
                }

                if (!expired.isEmpty()) {
                    Instant now = wallClock.now();
                    for (AvailableConnection connection : expired) {
                        observability.onPeerEvent(new PeerEvent(now, PeerEvent.Kind.EXPIRED, connection));
                    }
                    notifyLocked();
                }
                return expired.size();
            }
        }

        @Override
        public void dropped(Object raw, String reason, Throwable cause)
        {
            log.warn("Dropping announcement: {}", reason, cause);
            observability.onAnnouncementDropped(new AnnouncementDroppedEvent(wallClock.now(), reason, raw, cause));
        }
    }
}

package com.questrail.debuglink.discovery;

import com.questrail.debuglink.internal.time.MonotonicClock;
import com.questrail.debuglink.internal.time.MonotonicScheduler;
import com.questrail.debuglink.internal.time.PeriodicTask;
import com.questrail.debuglink.transport.bus.BusChannel;
import com.questrail.debuglink.transport.bus.BusChannelFactory;
import com.questrail.debuglink.transport.bus.BusChannelListener;
import com.questrail.debuglink.transport.bus.ChannelNames;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * EmbeddedDiscoveryStrategy
 * =============================================================================
 * Finds embedded emulators by listening on the announcement channel and ages
 * them out when they fall silent.
 *
 * <ul>
 *   <li>Each message is parsed by {@link AnnouncementParser}. Unparseable or
 *       incomplete announcements are reported as dropped; they never reach
 *       discovery subscribers and never stop the listener.</li>
 *   <li>Every {@link DiscoveryTimingPolicy#sweepInterval()} the registry expires
 *       peers idle for longer than {@link DiscoveryTimingPolicy#expiry()}.</li>
 * </ul>
 */
public final class EmbeddedDiscoveryStrategy implements DiscoveryStrategy
{
    private static final Logger log = LoggerFactory.getLogger(EmbeddedDiscoveryStrategy.class);

    private final BusChannelFactory bus;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final DiscoveryTimingPolicy timing;
    private final AnnouncementParser parser;

    private final Object lock = new Object();
    private BusChannel announcements;
    private PeriodicTask sweep;

    public EmbeddedDiscoveryStrategy(BusChannelFactory bus,
                                     MonotonicScheduler scheduler,
                                     MonotonicClock clock,
                                     DiscoveryTimingPolicy timing)
    {
        this(bus, scheduler, clock, timing, new AnnouncementParser());
    }

    public EmbeddedDiscoveryStrategy(BusChannelFactory bus,
                                     MonotonicScheduler scheduler,
                                     MonotonicClock clock,
                                     DiscoveryTimingPolicy timing,
                                     AnnouncementParser parser)
    {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timing = Objects.requireNonNull(timing, "timing");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public ConnectionMode mode()
    {
        return ConnectionMode.EMBEDDED;
    }

    @Override
    public void start(DiscoveryRegistry registry)
    {
        Objects.requireNonNull(registry, "registry");

        synchronized (lock) {
            if (announcements != null) {
                return;
            }
            announcements = bus.open(ChannelNames.ANNOUNCE, new AnnouncementListener(registry));
            sweep = PeriodicTask.start(scheduler, clock, timing.sweepInterval(),
                    () -> registry.expireIdle(timing.expiry()));
        }
        log.info("Listening for announcements on '{}'", ChannelNames.ANNOUNCE);
    }

    @Override
    public void stop()
    {
        synchronized (lock) {
            if (sweep != null) {
                sweep.cancel();
                sweep = null;
            }
            if (announcements != null) {
                announcements.close();
                announcements = null;
            }
        }
    }

    private final class AnnouncementListener implements BusChannelListener
    {
        private final DiscoveryRegistry registry;

        private AnnouncementListener(DiscoveryRegistry registry)
        {
            this.registry = registry;
        }

        @Override
        public void onMessage(Object message)
        {
            final Announcement announcement;
            try {
                announcement = parser.parse(message);
            } catch (AnnouncementDecodeException e) {
                registry.dropped(message, e.getMessage(), e);
                return;
            }

            if (!announcement.isComplete()) {
                registry.dropped(message, "announcement lacks id or name", null);
                return;
            }

            registry.record(announcement.id(), announcement.name(), ConnectionMode.EMBEDDED);
        }

        @Override
        public void onMessageError(Throwable cause)
        {
            registry.dropped(null, "announcement channel error", cause);
        }
    }
}

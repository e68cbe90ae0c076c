package com.questrail.debuglink.runtime;

import com.questrail.debuglink.discovery.ConnectionDiscovery;
import com.questrail.debuglink.discovery.ConnectionMode;
import com.questrail.debuglink.discovery.DiscoveryStrategy;
import com.questrail.debuglink.discovery.EmbeddedDiscoveryStrategy;
import com.questrail.debuglink.discovery.RemoteDiscoveryStrategy;
import com.questrail.debuglink.internal.time.MonotonicClock;
import com.questrail.debuglink.internal.time.MonotonicScheduler;
import com.questrail.debuglink.internal.time.ScheduledExecutorScheduler;
import com.questrail.debuglink.internal.time.SystemMonotonicClock;
import com.questrail.debuglink.internal.time.SystemWallClock;
import com.questrail.debuglink.internal.time.WallClock;
import com.questrail.debuglink.observability.TransportStateChangeEvent;
import com.questrail.debuglink.transport.Transport;
import com.questrail.debuglink.transport.bus.BusTransport;
import com.questrail.debuglink.transport.websocket.WebSocketTransport;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * DebugLinkRuntime
 * =============================================================================
 * Composition root for the connection layer of one debugger front-end.
 *
 * <h2>Ownership</h2>
 * <ul>
 *   <li>A single-threaded {@link ScheduledExecutorService} runs every heartbeat,
 *       pong timeout and discovery sweep.</li>
 *   <li>A Netty {@link EventLoopGroup} carries WebSocket I/O.</li>
 *   <li>The {@link ConnectionDiscovery} for the configured mode.</li>
 * </ul>
 * The bus, when configured, is owned by the caller.
 *
 * <h2>Mode selection</h2>
 * The mode is fixed at construction. It selects the discovery strategy once and
 * the transport variant returned by {@link #createTransport()}; nothing branches
 * on it afterwards.
 */
public final class DebugLinkRuntime
{
    private static final Logger log = LoggerFactory.getLogger(DebugLinkRuntime.class);

    private final DebugLinkConfig config;
    private final ScheduledExecutorService timerExecutor;
    private final EventLoopGroup eventLoop;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final ConnectionDiscovery discovery;

    public DebugLinkRuntime(DebugLinkConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = SystemMonotonicClock.INSTANCE;
        this.wallClock = SystemWallClock.INSTANCE;
        this.timerExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "debuglink-timer");
            t.setDaemon(true);
            return t;
        });
        this.scheduler = new ScheduledExecutorScheduler(timerExecutor, clock);
        this.eventLoop = new NioEventLoopGroup(1);
        this.discovery = new ConnectionDiscovery(strategyFor(config), clock, wallClock, config.observability());
    }

    private DiscoveryStrategy strategyFor(DebugLinkConfig config)
    {
        if (config.mode() == ConnectionMode.EMBEDDED) {
            return new EmbeddedDiscoveryStrategy(config.bus(), scheduler, clock, config.discovery());
        }
        return new RemoteDiscoveryStrategy(config.remoteOrigin());
    }

    public ConnectionMode mode()
    {
        return config.mode();
    }

    public ConnectionDiscovery discovery()
    {
        return discovery;
    }

    public void start()
    {
        log.info("Starting debug link in {} mode", config.mode());
        discovery.start();
    }

    public void stop()
    {
        discovery.stop();

        timerExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                timerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            timerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        eventLoop.shutdownGracefully();
        log.info("Debug link stopped");
    }

    /**
     * A fresh, unconnected transport for the configured mode, with its state
     * changes reported to the observability sink. Connect it with the
     * {@code id} of a connection from {@link #discovery()}.
     */
    public Transport createTransport()
    {
        Transport transport = config.mode() == ConnectionMode.EMBEDDED
                ? new BusTransport(config.bus(), scheduler, clock, config.heartbeat())
                : new WebSocketTransport(eventLoop);

        transport.onStateChange((state, cause) -> config.observability().onTransportStateChange(
                new TransportStateChangeEvent(wallClock.now(), transport.kind(), state, cause)));
        return transport;
    }
}

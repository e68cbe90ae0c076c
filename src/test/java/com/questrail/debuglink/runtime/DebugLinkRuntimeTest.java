package com.questrail.debuglink.runtime;

import com.questrail.debuglink.discovery.AvailableConnection;
import com.questrail.debuglink.discovery.ConnectionMode;
import com.questrail.debuglink.observability.RecordingObservabilitySink;
import com.questrail.debuglink.observability.TransportStateChangeEvent;
import com.questrail.debuglink.transport.Transport;
import com.questrail.debuglink.transport.TransportKind;
import com.questrail.debuglink.transport.TransportState;
import com.questrail.debuglink.transport.bus.BusChannel;
import com.questrail.debuglink.transport.bus.BusChannelListener;
import com.questrail.debuglink.transport.bus.BusTransport;
import com.questrail.debuglink.transport.bus.ChannelNames;
import com.questrail.debuglink.transport.bus.LocalBus;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke tests for the composition root with production schedulers.
 */
class DebugLinkRuntimeTest {

    private static final BusChannelListener DEAF = new BusChannelListener() {
        @Override
        public void onMessage(Object message) {
        }

        @Override
        public void onMessageError(Throwable cause) {
        }
    };

    @Test
    void remoteModeRequiresOrigin() {
        assertThrows(IllegalArgumentException.class,
                () -> DebugLinkConfig.builder().withMode(ConnectionMode.REMOTE).build());
    }

    @Test
    void embeddedModeRequiresBus() {
        assertThrows(IllegalArgumentException.class,
                () -> DebugLinkConfig.builder().withMode(ConnectionMode.EMBEDDED).build());
    }

    @Test
    void remoteModeDiscoversServingHostAndCreatesWebSocketTransports() {
        DebugLinkRuntime runtime = new DebugLinkRuntime(DebugLinkConfig.builder()
                .withMode(ConnectionMode.REMOTE)
                .withRemoteOrigin(URI.create("http://localhost:9999"))
                .build());
        try {
            runtime.start();

            List<AvailableConnection> found = runtime.discovery().getAvailableConnections();
            assertEquals(1, found.size());
            assertEquals("ws://localhost:9999/ws", found.get(0).id());

            Transport transport = runtime.createTransport();
            assertEquals(TransportKind.WEBSOCKET, transport.kind());
            assertEquals(TransportState.IDLE, transport.state());
        } finally {
            runtime.stop();
        }
    }

    @Test
    void embeddedModeDiscoversPeerAndReportsTransportStates() throws Exception {
        LocalBus bus = new LocalBus();
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        DebugLinkRuntime runtime = new DebugLinkRuntime(DebugLinkConfig.builder()
                .withMode(ConnectionMode.EMBEDDED)
                .withBus(bus)
                .withObservability(sink)
                .build());

        AtomicReference<BusChannel> session = new AtomicReference<>();
        session.set(bus.open(ChannelNames.session("peer42"), new BusChannelListener() {
            @Override
            public void onMessage(Object message) {
                if (BusTransport.PING.equals(message)) {
                    session.get().post(BusTransport.PONG);
                }
            }

            @Override
            public void onMessageError(Throwable cause) {
            }
        }));

        try {
            runtime.start();
            bus.open(ChannelNames.ANNOUNCE, DEAF)
                    .post("{\"id\":\"peer42\",\"name\":\"nullDC Instance peer42\",\"timestamp\":1}");

            List<AvailableConnection> found = runtime.discovery().getAvailableConnections();
            assertEquals(1, found.size());
            assertEquals(ConnectionMode.EMBEDDED, runtime.mode());

            Transport transport = runtime.createTransport();
            assertEquals(TransportKind.BUS, transport.kind());
            transport.connect(found.get(0).id()).get(1, TimeUnit.SECONDS);

            // Two heartbeat rounds on the real timer thread.
            Thread.sleep(2500);
            assertEquals(TransportState.OPEN, transport.state());

            transport.disconnect();

            List<TransportState> reported = sink.getStateChanges().stream()
                    .map(TransportStateChangeEvent::state)
                    .toList();
            assertEquals(List.of(TransportState.CONNECTING, TransportState.OPEN, TransportState.CLOSED), reported);
            assertFalse(sink.getPeerEvents().isEmpty());
        } finally {
            runtime.stop();
        }
    }
}

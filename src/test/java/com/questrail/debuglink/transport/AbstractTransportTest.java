package com.questrail.debuglink.transport;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Handler registry behaviour shared by both transports, exercised through a
 * minimal in-test transport.
 */
class AbstractTransportTest {

    private static final class StubTransport extends AbstractTransport {
        @Override
        public TransportKind kind() {
            return TransportKind.BUS;
        }

        @Override
        public CompletableFuture<Void> connect(String endpoint, TransportOptions options) {
            requireEndpoint(endpoint);
            broadcastState(TransportState.OPEN, null);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void disconnect(Integer code, String reason) {
            broadcastState(TransportState.CLOSED, null);
        }

        @Override
        public void send(String payload) {
            throw new TransportNotConnectedException();
        }

        void deliver(String payload) {
            broadcastMessage(payload);
        }
    }

    @Test
    void initialStateIsIdle() {
        assertEquals(TransportState.IDLE, new StubTransport().state());
    }

    @Test
    void unsubscribeRemovesExactlyThatHandler() {
        StubTransport transport = new StubTransport();
        List<String> a = new ArrayList<>();
        List<String> b = new ArrayList<>();

        Subscription subA = transport.subscribe(a::add);
        transport.subscribe(b::add);

        transport.deliver("one");
        subA.unsubscribe();
        transport.deliver("two");

        assertEquals(List.of("one"), a);
        assertEquals(List.of("one", "two"), b);
    }

    @Test
    void unsubscribeTwiceIsHarmless() {
        StubTransport transport = new StubTransport();
        List<String> seen = new ArrayList<>();

        Subscription sub = transport.subscribe(seen::add);
        sub.unsubscribe();
        sub.unsubscribe();

        transport.deliver("x");
        assertTrue(seen.isEmpty());
    }

    @Test
    void handlerRemovingAnotherDuringDispatchDoesNotSkipTheRestOfThatDispatch() {
        StubTransport transport = new StubTransport();
        List<String> seen = new ArrayList<>();
        AtomicReference<Subscription> second = new AtomicReference<>();

        transport.subscribe(p -> {
            seen.add("first:" + p);
            second.get().unsubscribe();
        });
        second.set(transport.subscribe(p -> seen.add("second:" + p)));

        transport.deliver("a");
        transport.deliver("b");

        assertEquals(List.of("first:a", "second:a", "first:b"), seen);
    }

    @Test
    void stateHandlerMayUnsubscribeItself() {
        StubTransport transport = new StubTransport();
        List<TransportState> seen = new ArrayList<>();
        AtomicReference<Subscription> self = new AtomicReference<>();

        self.set(transport.onStateChange((state, cause) -> {
            seen.add(state);
            self.get().unsubscribe();
        }));

        transport.connect("peer");
        transport.disconnect();

        assertEquals(List.of(TransportState.OPEN), seen);
        assertEquals(TransportState.CLOSED, transport.state());
    }

    @Test
    void failingHandlerDoesNotStopDeliveryToOthers() {
        StubTransport transport = new StubTransport();
        List<String> seen = new ArrayList<>();

        transport.subscribe(p -> { throw new IllegalStateException("boom"); });
        transport.subscribe(seen::add);

        transport.deliver("payload");
        assertEquals(List.of("payload"), seen);
    }

    @Test
    void emptyEndpointIsRejected() {
        StubTransport transport = new StubTransport();
        assertThrows(IllegalArgumentException.class, () -> transport.connect(""));
        assertEquals(TransportState.IDLE, transport.state());
    }
}

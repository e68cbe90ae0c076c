package com.questrail.debuglink.transport.bus.netty;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BusDatagramCodecTest {

    private final BusDatagramCodec codec = new BusDatagramCodec();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void encodesEnvelopeAsJsonObject() {
        String json = new String(codec.encode(new BusEnvelope("o-1", "nulldc-debugger-announce", "ping")),
                StandardCharsets.UTF_8);

        assertTrue(json.contains("\"origin\":\"o-1\""));
        assertTrue(json.contains("\"channel\":\"nulldc-debugger-announce\""));
        assertTrue(json.contains("\"data\":\"ping\""));
    }

    @Test
    void decodesEnvelopeWrittenByAnotherProcess() {
        Optional<BusEnvelope> decoded = codec.decode(
                utf8("{\"origin\":\"other\",\"channel\":\"nulldc-debugger-abc\",\"data\":\"pong\",\"v\":2}"));

        assertEquals(Optional.of(new BusEnvelope("other", "nulldc-debugger-abc", "pong")), decoded);
    }

    @Test
    void payloadWithEmbeddedJsonSurvivesUnchanged() {
        String payload = "{\"id\":\"abc\",\"name\":\"nullDC Instance abc\",\"timestamp\":1}";
        BusEnvelope envelope = new BusEnvelope("o", "c", payload);

        assertEquals(payload, codec.decode(codec.encode(envelope)).orElseThrow().data());
    }

    @Test
    void garbageIsDropped() {
        assertTrue(codec.decode(utf8("not json")).isEmpty());
        assertTrue(codec.decode(new byte[0]).isEmpty());
        assertTrue(codec.decode(utf8("[1,2,3]")).isEmpty());
        assertTrue(codec.decode(utf8("null")).isEmpty());
    }

    @Test
    void incompleteEnvelopeIsDropped() {
        assertTrue(codec.decode(utf8("{\"origin\":\"o\",\"channel\":\"c\"}")).isEmpty());
        assertTrue(codec.decode(utf8("{\"channel\":\"c\",\"data\":\"d\"}")).isEmpty());
    }
}

package com.questrail.debuglink.transport.bus.netty;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * BusDatagramCodec
 * -----------------------------------------------------------------------------
 * JSON encoding of {@link BusEnvelope}s.
 *
 * <p>Decoding never throws for bad input: anything that is not a complete
 * envelope is reported as empty and dropped by the caller, the same way the
 * UDP adapter drops datagrams that fail framing.</p>
 */
public final class BusDatagramCodec
{
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public byte[] encode(BusEnvelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");
        try {
            return mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode bus envelope", e);
        }
    }

    public Optional<BusEnvelope> decode(byte[] datagram)
    {
        Objects.requireNonNull(datagram, "datagram");
        final BusEnvelope envelope;
        try {
            envelope = mapper.readValue(datagram, BusEnvelope.class);
        } catch (IOException e) {
            return Optional.empty();
        }
        if (envelope == null
                || envelope.origin() == null
                || envelope.channel() == null
                || envelope.data() == null) {
            return Optional.empty();
        }
        return Optional.of(envelope);
    }
}

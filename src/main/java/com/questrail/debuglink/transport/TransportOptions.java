package com.questrail.debuglink.transport;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-connect options.
 *
 * @param protocols   WebSocket sub-protocols offered during the handshake; ignored by the bus
 * @param channelName explicit bus channel name; ignored by the WebSocket transport
 */
public record TransportOptions(List<String> protocols, Optional<String> channelName)
{
    private static final TransportOptions NONE = new TransportOptions(List.of(), Optional.empty());

    public TransportOptions {
        protocols = List.copyOf(Objects.requireNonNull(protocols, "protocols"));
        Objects.requireNonNull(channelName, "channelName");
    }

    public static TransportOptions none() {
        return NONE;
    }

    public static TransportOptions withProtocols(String... protocols) {
        return new TransportOptions(List.of(protocols), Optional.empty());
    }

    public static TransportOptions withChannelName(String channelName) {
        return new TransportOptions(List.of(), Optional.of(channelName));
    }
}

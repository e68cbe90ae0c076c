package com.questrail.debuglink.runtime;

import com.questrail.debuglink.discovery.ConnectionMode;
import com.questrail.debuglink.discovery.DiscoveryTimingPolicy;
import com.questrail.debuglink.observability.LinkObservabilitySink;
import com.questrail.debuglink.observability.NullObservabilitySink;
import com.questrail.debuglink.transport.bus.BusChannelFactory;
import com.questrail.debuglink.transport.bus.HeartbeatPolicy;

import java.net.URI;
import java.util.Objects;

/**
 * Aggregated configuration for {@link DebugLinkRuntime}.
 *
 * @param mode          which substrate the front-end uses
 * @param heartbeat     bus heartbeat timing
 * @param discovery     peer expiry timing
 * @param remoteOrigin  origin the front-end was served from; required for {@link ConnectionMode#REMOTE}
 * @param bus           bus to discover and connect over; required for {@link ConnectionMode#EMBEDDED}
 * @param observability sink for transport and discovery events
 */
public record DebugLinkConfig(
    ConnectionMode mode,
    HeartbeatPolicy heartbeat,
    DiscoveryTimingPolicy discovery,
    URI remoteOrigin,
    BusChannelFactory bus,
    LinkObservabilitySink observability
) {
    public DebugLinkConfig {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(heartbeat, "heartbeat");
        Objects.requireNonNull(discovery, "discovery");
        Objects.requireNonNull(observability, "observability");

        if (mode == ConnectionMode.REMOTE && remoteOrigin == null) {
            throw new IllegalArgumentException("remoteOrigin is required in REMOTE mode");
        }
        if (mode == ConnectionMode.EMBEDDED && bus == null) {
            throw new IllegalArgumentException("bus is required in EMBEDDED mode");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConnectionMode mode = ConnectionMode.REMOTE;
        private HeartbeatPolicy heartbeat = HeartbeatPolicy.defaults();
        private DiscoveryTimingPolicy discovery = DiscoveryTimingPolicy.defaults();
        private URI remoteOrigin;
        private BusChannelFactory bus;
        private LinkObservabilitySink observability = NullObservabilitySink.INSTANCE;

        public Builder withMode(ConnectionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder withHeartbeat(HeartbeatPolicy heartbeat) {
            this.heartbeat = heartbeat;
            return this;
        }

        public Builder withDiscoveryTiming(DiscoveryTimingPolicy discovery) {
            this.discovery = discovery;
            return this;
        }

        public Builder withRemoteOrigin(URI remoteOrigin) {
            this.remoteOrigin = remoteOrigin;
            return this;
        }

        public Builder withBus(BusChannelFactory bus) {
            this.bus = bus;
            return this;
        }

        public Builder withObservability(LinkObservabilitySink observability) {
            this.observability = observability;
            return this;
        }

        public DebugLinkConfig build() {
            return new DebugLinkConfig(mode, heartbeat, discovery, remoteOrigin, bus, observability);
        }
    }
}

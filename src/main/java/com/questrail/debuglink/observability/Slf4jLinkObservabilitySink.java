package com.questrail.debuglink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLinkObservabilitySink implements LinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLinkObservabilitySink.class);

    @Override
    public void onTransportStateChange(TransportStateChangeEvent event) {
        if (event.isFailure()) {
            log.warn("{} transport {}: {}", event.kind(), event.state(), event.cause().getMessage());
        } else {
            log.info("{} transport {}", event.kind(), event.state());
        }
    }

    @Override
    public void onPeerEvent(PeerEvent event) {
        log.info("Peer {} {} ({})",
            event.connection().id(),
            event.kind() == PeerEvent.Kind.DISCOVERED ? "discovered" : "expired",
            event.connection().name());
    }

    @Override
    public void onAnnouncementDropped(AnnouncementDroppedEvent event) {
        log.warn("Dropped announcement: {} [{}]", event.reason(), event.raw(), event.cause());
    }
}

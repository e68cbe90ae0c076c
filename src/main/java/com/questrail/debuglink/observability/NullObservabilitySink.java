package com.questrail.debuglink.observability;

/**
 * No-op implementation of LinkObservabilitySink.
 */
public final class NullObservabilitySink implements LinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportStateChange(TransportStateChangeEvent event) {}

    @Override
    public void onPeerEvent(PeerEvent event) {}

    @Override
    public void onAnnouncementDropped(AnnouncementDroppedEvent event) {}
}

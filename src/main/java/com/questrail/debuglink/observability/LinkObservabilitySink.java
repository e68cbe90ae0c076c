package com.questrail.debuglink.observability;

/**
 * Receives transport and discovery observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface LinkObservabilitySink {
    /**
     * Called for every transport state transition.
     */
    void onTransportStateChange(TransportStateChangeEvent event);

    /**
     * Called when discovery adds or expires a peer.
     */
    void onPeerEvent(PeerEvent event);

    /**
     * Called when discovery drops a malformed or incomplete announcement.
     * This is the counter hook for dropped announcements; they are never
     * surfaced to discovery subscribers.
     */
    void onAnnouncementDropped(AnnouncementDroppedEvent event);
}

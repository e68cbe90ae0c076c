package com.questrail.debuglink.observability;

import java.time.Instant;

/**
 * An announcement was received but could not be used.
 *
 * @param raw   the message as it came off the bus
 * @param cause parse failure; {@code null} when the message parsed but lacked fields
 */
public record AnnouncementDroppedEvent(
    Instant timestamp,
    String reason,
    Object raw,
    Throwable cause
) {
}

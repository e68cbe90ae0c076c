package com.questrail.debuglink.observability;

import com.questrail.debuglink.transport.TransportKind;
import com.questrail.debuglink.transport.TransportState;

import java.time.Instant;

/**
 * A transport entered a new state.
 *
 * @param cause failure behind a {@code CLOSED} transition, otherwise {@code null}
 */
public record TransportStateChangeEvent(
    Instant timestamp,
    TransportKind kind,
    TransportState state,
    Throwable cause
) {
    public boolean isFailure() {
        return state == TransportState.CLOSED && cause != null;
    }
}

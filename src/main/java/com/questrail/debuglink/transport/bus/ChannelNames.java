package com.questrail.debuglink.transport.bus;

import java.util.Objects;

/**
 * Well-known bus channel names shared by the debugger and embedded emulators.
 */
public final class ChannelNames
{
    /** Channel on which embedded emulators self-announce. */
    public static final String ANNOUNCE = "nulldc-debugger-announce";

    private static final String SESSION_PREFIX = "nulldc-debugger-";

    private ChannelNames() {}

    /**
     * Per-peer session channel for the given peer id.
     */
    public static String session(String peerId)
    {
        Objects.requireNonNull(peerId, "peerId");
        return SESSION_PREFIX + peerId;
    }
}

package com.questrail.debuglink.discovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Self-announcement posted by an embedded emulator on the announcement channel.
 *
 * @param id        peer token, also the suffix of its session channel
 * @param name      display name
 * @param timestamp epoch millis at which the peer posted it; informational only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Announcement(String id, String name, Long timestamp)
{
    /**
     * An announcement is usable only with a non-empty id and name.
     */
    public boolean isComplete()
    {
        return id != null && !id.isEmpty() && name != null && !name.isEmpty();
    }
}

package com.questrail.debuglink.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;

/**
 * AnnouncementParser
 * -----------------------------------------------------------------------------
 * Reads announcements in any of the shapes a bus can deliver them:
 * <ul>
 *   <li>a JSON string (what emulators post)</li>
 *   <li>an {@link Announcement} passed by reference on an in-JVM bus</li>
 *   <li>a {@code Map} with {@code id}/{@code name}/{@code timestamp} keys</li>
 * </ul>
 * Unknown JSON properties are ignored. Completeness ({@code id} and
 * {@code name}) is checked by the caller, not here.
 */
public final class AnnouncementParser
{
    private final ObjectMapper mapper;

    public AnnouncementParser()
    {
        this(new ObjectMapper());
    }

    public AnnouncementParser(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * @throws AnnouncementDecodeException if the message has none of the supported shapes
     */
    public Announcement parse(Object message)
    {
        Objects.requireNonNull(message, "message");

        if (message instanceof Announcement announcement) {
            return announcement;
        }

        if (message instanceof String json) {
            final Announcement parsed;
            try {
                parsed = mapper.readValue(json, Announcement.class);
            } catch (JsonProcessingException e) {
                throw new AnnouncementDecodeException("Announcement is not valid JSON", e);
            }
            if (parsed == null) {
                throw new AnnouncementDecodeException("Announcement is JSON null");
            }
            return parsed;
        }

        if (message instanceof Map<?, ?> map) {
            try {
                return mapper.convertValue(map, Announcement.class);
            } catch (IllegalArgumentException e) {
                throw new AnnouncementDecodeException("Announcement map has the wrong shape", e);
            }
        }

        throw new AnnouncementDecodeException("Unsupported announcement type " + message.getClass().getName());
    }

    /**
     * Serialize an announcement the way emulators post it.
     */
    public String toJson(Announcement announcement)
    {
        Objects.requireNonNull(announcement, "announcement");
        try {
            return mapper.writeValueAsString(announcement);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize announcement", e);
        }
    }
}

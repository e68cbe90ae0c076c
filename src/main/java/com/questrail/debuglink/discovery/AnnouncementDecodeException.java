package com.questrail.debuglink.discovery;

/**
 * A message on the announcement channel could not be read as an
 * {@link Announcement}.
 */
public final class AnnouncementDecodeException extends RuntimeException
{
    public AnnouncementDecodeException(String message) {
        super(message);
    }

    public AnnouncementDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

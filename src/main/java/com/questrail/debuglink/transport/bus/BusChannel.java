package com.questrail.debuglink.transport.bus;

/**
 * One open handle on a named bus channel.
 *
 * <p>A message posted on a handle is delivered to every <em>other</em> open
 * handle with the same name, never back to the poster. There is no connection
 * and therefore no disconnect signal.</p>
 */
public interface BusChannel
{
    String name();

    /**
     * Publish a message to the other listeners of this channel.
     *
     * @param message a {@code String}, or a structured value where the bus supports it
     * @throws IllegalStateException if this handle is closed
     */
    void post(Object message);

    /**
     * Close the handle. Idempotent.
     */
    void close();
}

package com.questrail.debuglink.transport.bus;

/**
 * Callback sink for a {@link BusChannel}.
 */
public interface BusChannelListener
{
    /**
     * A message posted by another handle on the same channel.
     */
    void onMessage(Object message);

    /**
     * The bus received something for this channel that it could not deliver.
     */
    void onMessageError(Throwable cause);
}

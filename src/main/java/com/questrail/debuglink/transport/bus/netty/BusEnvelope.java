package com.questrail.debuglink.transport.bus.netty;

/**
 * Wire form of one bus message carried in a multicast datagram.
 *
 * @param origin  id of the sending {@link NettyMulticastBus} instance
 * @param channel bus channel name
 * @param data    string payload
 */
public record BusEnvelope(String origin, String channel, String data)
{
}

package com.questrail.fleet.connection;

/**
 * Receives application messages from the live broker session.
 */
@FunctionalInterface
public interface InboundMessageListener
{
    void onMessage(String topic, byte[] payload);
}

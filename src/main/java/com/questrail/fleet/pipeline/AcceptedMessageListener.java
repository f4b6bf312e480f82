package com.questrail.fleet.pipeline;

import com.questrail.fleet.protocol.vda5050.model.SequencedMessage;

/**
 * Notified of every message that passed decoding and sequencing, after the
 * telemetry store was updated. Runs on the network thread; must not block.
 */
@FunctionalInterface
public interface AcceptedMessageListener
{
    void onAccepted(SequencedMessage message);
}

package com.questrail.fleet.protocol.vda5050.model;

import com.questrail.fleet.api.VehicleId;

/**
 * Vda5050Message
 * =============================================================================
 * Semantic result of decoding one broker frame.
 *
 * <p>The variant is chosen by the trailing topic segment, never by payload
 * sniffing. Everything downstream of the decoder (sequencing, telemetry,
 * acknowledgement matching) works exclusively on these types and never sees
 * JSON or raw bytes.</p>
 */
public sealed interface Vda5050Message permits SequencedMessage, UnknownMessage {

    /**
     * The vehicle the message concerns, as named in the topic.
     */
    VehicleId vehicle();
}

package com.questrail.fleet.protocol.vda5050.model;

import com.questrail.fleet.api.VehicleId;

import java.util.Objects;

/**
 * A frame on a topic whose trailing segment the fleet link does not interpret
 * (factsheet, vendor extensions). Kept so callers can count it; never applied
 * to telemetry.
 *
 * @param vehicle      vehicle named in the topic
 * @param segment      trailing topic segment
 * @param payloadBytes size of the ignored payload
 */
public record UnknownMessage(VehicleId vehicle, String segment, int payloadBytes) implements Vda5050Message {
    public UnknownMessage {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(segment, "segment");
    }
}

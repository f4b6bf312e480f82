package com.questrail.fleet.protocol.vda5050.codec;

import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.protocol.vda5050.model.Vda5050Topic;

import java.util.Objects;
import java.util.Optional;

/**
 * A topic name split into its VDA5050 parts.
 *
 * @param vehicle vehicle named by the manufacturer and serial segments
 * @param segment trailing segment, verbatim
 * @param kind    known topic kind for {@code segment}, if any
 */
public record ParsedTopic(VehicleId vehicle, String segment, Optional<Vda5050Topic> kind) {
    public ParsedTopic {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(kind, "kind");
    }
}

package com.questrail.fleet.protocol.vda5050.model;

import com.questrail.fleet.api.VehicleId;

import java.time.Instant;
import java.util.Objects;

/**
 * Mandatory VDA5050 message header.
 *
 * @param headerId  per-topic sequence number chosen by the sender
 * @param timestamp sender's clock at publication; display only
 * @param version   protocol version string, e.g. {@code 2.0.0}
 * @param vehicle   manufacturer and serial number of the vehicle concerned
 */
public record Header(long headerId, Instant timestamp, String version, VehicleId vehicle) {
    public Header {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(vehicle, "vehicle");
        if (headerId < 0) {
            throw new IllegalArgumentException("headerId must be >= 0");
        }
    }
}

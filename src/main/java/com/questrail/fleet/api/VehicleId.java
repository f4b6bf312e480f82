package com.questrail.fleet.api;

import java.util.Objects;

/**
 * VehicleId
 * -----------------------------------------------------------------------------
 * Identity of a single AGV in the fleet.
 *
 * <p>VDA5050 identifies a vehicle by the pair (manufacturer, serialNumber); both
 * appear in every topic name and every message header. Serial numbers are only
 * unique per manufacturer, so neither field is usable as a key on its own.</p>
 *
 * @param manufacturer vehicle manufacturer as used in topic names
 * @param serialNumber manufacturer-scoped serial number
 */
public record VehicleId(String manufacturer, String serialNumber) implements Comparable<VehicleId>
{
    public VehicleId {
        Objects.requireNonNull(manufacturer, "manufacturer");
        Objects.requireNonNull(serialNumber, "serialNumber");
        if (manufacturer.isBlank()) {
            throw new IllegalArgumentException("manufacturer must not be blank");
        }
        if (serialNumber.isBlank()) {
            throw new IllegalArgumentException("serialNumber must not be blank");
        }
        if (manufacturer.contains("/") || serialNumber.contains("/")) {
            throw new IllegalArgumentException("vehicle id segments must not contain '/'");
        }
    }

    public static VehicleId of(String manufacturer, String serialNumber) {
        return new VehicleId(manufacturer, serialNumber);
    }

    @Override
    public int compareTo(VehicleId other) {
        int c = manufacturer.compareTo(other.manufacturer);
        return c != 0 ? c : serialNumber.compareTo(other.serialNumber);
    }

    @Override
    public String toString() {
        return manufacturer + "/" + serialNumber;
    }
}

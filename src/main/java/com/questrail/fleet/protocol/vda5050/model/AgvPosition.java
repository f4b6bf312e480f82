package com.questrail.fleet.protocol.vda5050.model;

import java.util.Objects;

/**
 * Vehicle pose in map coordinates.
 */
public record AgvPosition(double x, double y, double theta, String mapId, boolean positionInitialized) {
    public AgvPosition {
        Objects.requireNonNull(mapId, "mapId");
    }
}

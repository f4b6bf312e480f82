package com.questrail.fleet.protocol.vda5050.model;

import java.util.Objects;

/**
 * Target pose of an order node.
 */
public record NodePosition(double x, double y, double theta, String mapId) {
    public NodePosition {
        Objects.requireNonNull(mapId, "mapId");
    }
}

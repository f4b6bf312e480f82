package com.questrail.fleet.protocol.vda5050.model;

import java.util.Optional;

/**
 * The VDA5050 topic kinds the fleet link knows about.
 *
 * <p>A topic name is {@code <interfaceName>/<manufacturer>/<serialNumber>/<segment>};
 * this enum models only the trailing segment.</p>
 */
public enum Vda5050Topic {
    ORDER("order"),
    INSTANT_ACTIONS("instantActions"),
    STATE("state"),
    CONNECTION("connection"),
    VISUALIZATION("visualization");

    private final String segment;

    Vda5050Topic(String segment) {
        this.segment = segment;
    }

    public String segment() {
        return segment;
    }

    /**
     * Topics published by vehicles and consumed by the fleet link.
     */
    public boolean isVehicleOriginated() {
        return this == STATE || this == CONNECTION || this == VISUALIZATION;
    }

    public static Optional<Vda5050Topic> fromSegment(String segment) {
        for (Vda5050Topic t : values()) {
            if (t.segment.equals(segment)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}

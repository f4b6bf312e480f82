package com.questrail.fleet.observability;

import com.questrail.fleet.api.AckState;
import com.questrail.fleet.api.VehicleId;

import java.time.Instant;
import java.util.Objects;

/**
 * Acknowledgement state change of a dispatched order.
 */
public record MissionEvent(Instant timestamp, String orderId, long orderUpdateId, VehicleId vehicle, AckState state) {
    public MissionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(state, "state");
    }
}

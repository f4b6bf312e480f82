package com.questrail.fleet.protocol.vda5050.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded {@code state} message: the vehicle's periodic full status report.
 *
 * <p>The {@code orderId}/{@code orderUpdateId} pair is how a vehicle
 * acknowledges an order; an empty {@code orderId} means no order is active.</p>
 */
public record StateMessage(
        Header header,
        String orderId,
        long orderUpdateId,
        String lastNodeId,
        long lastNodeSequenceId,
        boolean driving,
        OperatingMode operatingMode,
        BatteryState battery,
        Optional<AgvPosition> position,
        List<AgvError> errors,
        boolean fullResync
) implements SequencedMessage {

    public StateMessage {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(lastNodeId, "lastNodeId");
        Objects.requireNonNull(operatingMode, "operatingMode");
        Objects.requireNonNull(battery, "battery");
        Objects.requireNonNull(position, "position");
        errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    @Override
    public Vda5050Topic topic() {
        return Vda5050Topic.STATE;
    }

    public boolean hasActiveOrder() {
        return !orderId.isEmpty();
    }
}

package com.questrail.fleet.mission;

import com.questrail.fleet.api.AckState;
import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.protocol.vda5050.model.Order;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One dispatched order and its acknowledgement state.
 *
 * <p>Immutable; every state change produces a new instance. A retry replaces
 * the entry with a new orderUpdateId and a fresh deadline.</p>
 *
 * @param ackDeadlineNanos monotonic deadline; {@code ackDeadline} is its wall-clock rendering
 * @param resolvedAt       when the order left PENDING
 * @param detail           reason for FAILED or TIMEOUT; empty otherwise
 */
public record MissionOrder(
        VehicleId vehicle,
        Order order,
        Instant dispatchedAt,
        Instant ackDeadline,
        long ackDeadlineNanos,
        AckState ackState,
        Optional<Instant> resolvedAt,
        String detail
) {
    public MissionOrder {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(dispatchedAt, "dispatchedAt");
        Objects.requireNonNull(ackDeadline, "ackDeadline");
        Objects.requireNonNull(ackState, "ackState");
        Objects.requireNonNull(resolvedAt, "resolvedAt");
        Objects.requireNonNull(detail, "detail");
    }

    static MissionOrder pending(VehicleId vehicle, Order order, Instant dispatchedAt, Instant ackDeadline, long ackDeadlineNanos) {
        return new MissionOrder(vehicle, order, dispatchedAt, ackDeadline, ackDeadlineNanos,
                AckState.PENDING, Optional.empty(), "");
    }

    public String orderId() {
        return order.orderId();
    }

    public long orderUpdateId() {
        return order.orderUpdateId();
    }

    MissionOrder resolve(AckState state, Instant at, String why) {
        return new MissionOrder(vehicle, order, dispatchedAt, ackDeadline, ackDeadlineNanos,
                state, Optional.of(at), why);
    }
}

package com.questrail.fleet.telemetry;

import com.questrail.fleet.api.VehicleConnectionState;
import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.protocol.vda5050.model.AgvError;
import com.questrail.fleet.protocol.vda5050.model.AgvPosition;
import com.questrail.fleet.protocol.vda5050.model.BatteryState;
import com.questrail.fleet.protocol.vda5050.model.ConnectionMessage;
import com.questrail.fleet.protocol.vda5050.model.OperatingMode;
import com.questrail.fleet.protocol.vda5050.model.ReportedConnectionState;
import com.questrail.fleet.protocol.vda5050.model.SequencedMessage;
import com.questrail.fleet.protocol.vda5050.model.StateMessage;
import com.questrail.fleet.protocol.vda5050.model.Velocity;
import com.questrail.fleet.protocol.vda5050.model.VisualizationMessage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * AgvRecord
 * -----------------------------------------------------------------------------
 * Immutable snapshot of everything the fleet link knows about one vehicle.
 *
 * <p>{@code lastSeenAt} and {@code lastSeenNanos} are <b>arrival</b> times taken
 * from the local clocks. The vehicle's own header timestamp is kept separately
 * in {@code messageTimestamp} for display and is never used for liveness.</p>
 *
 * @param latestState        most recent accepted state message
 * @param position           most recent pose, from state or visualization
 * @param velocity           most recent velocity, from visualization
 * @param reportedConnection the vehicle's own connection report, if any
 * @param messageTimestamp   header timestamp of the most recent message
 * @param lastSeenAt         wall-clock arrival of the most recent message
 * @param lastSeenNanos      monotonic arrival of the most recent message
 * @param connectionState    liveness derived from arrival times
 */
public record AgvRecord(
        VehicleId vehicle,
        Optional<StateMessage> latestState,
        Optional<AgvPosition> position,
        Optional<Velocity> velocity,
        Optional<ReportedConnectionState> reportedConnection,
        Instant messageTimestamp,
        Instant lastSeenAt,
        long lastSeenNanos,
        VehicleConnectionState connectionState
) {
    public AgvRecord {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(latestState, "latestState");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(velocity, "velocity");
        Objects.requireNonNull(reportedConnection, "reportedConnection");
        Objects.requireNonNull(messageTimestamp, "messageTimestamp");
        Objects.requireNonNull(lastSeenAt, "lastSeenAt");
        Objects.requireNonNull(connectionState, "connectionState");
    }

    /**
     * Fold one accepted message into the previous record (which may be null
     * for a vehicle seen for the first time).
     */
    static AgvRecord apply(AgvRecord previous, SequencedMessage message, Instant arrivedAt, long arrivedNanos) {
        Optional<StateMessage> state = previous == null ? Optional.empty() : previous.latestState;
        Optional<AgvPosition> position = previous == null ? Optional.empty() : previous.position;
        Optional<Velocity> velocity = previous == null ? Optional.empty() : previous.velocity;
        Optional<ReportedConnectionState> reported = previous == null ? Optional.empty() : previous.reportedConnection;
        VehicleConnectionState liveness = VehicleConnectionState.ONLINE;

        if (message instanceof StateMessage s) {
            state = Optional.of(s);
            if (s.position().isPresent()) {
                position = s.position();
            }
        } else if (message instanceof VisualizationMessage v) {
            if (v.position().isPresent()) {
                position = v.position();
            }
            if (v.velocity().isPresent()) {
                velocity = v.velocity();
            }
        } else if (message instanceof ConnectionMessage c) {
            reported = Optional.of(c.connectionState());
            if (c.connectionState() != ReportedConnectionState.ONLINE) {
                liveness = VehicleConnectionState.OFFLINE;
            }
        }

        return new AgvRecord(
                message.vehicle(),
                state,
                position,
                velocity,
                reported,
                message.header().timestamp(),
                arrivedAt,
                arrivedNanos,
                liveness);
    }

    AgvRecord withConnectionState(VehicleConnectionState next) {
        if (next == connectionState) {
            return this;
        }
        return new AgvRecord(vehicle, latestState, position, velocity, reportedConnection,
                messageTimestamp, lastSeenAt, lastSeenNanos, next);
    }

    public Optional<BatteryState> battery() {
        return latestState.map(StateMessage::battery);
    }

    public Optional<OperatingMode> operatingMode() {
        return latestState.map(StateMessage::operatingMode);
    }

    public List<AgvError> errors() {
        return latestState.map(StateMessage::errors).orElse(List.of());
    }
}

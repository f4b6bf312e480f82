package com.questrail.fleet.telemetry;

import com.questrail.fleet.protocol.vda5050.model.SequencedMessage;
import com.questrail.fleet.protocol.vda5050.model.Vda5050Topic;

import java.time.Instant;
import java.util.Objects;

/**
 * One accepted inbound message as kept in a vehicle's recent-event window.
 *
 * @param arrivedAt local wall-clock arrival time
 */
public record TelemetryEvent(Instant arrivedAt, SequencedMessage message) {
    public TelemetryEvent {
        Objects.requireNonNull(arrivedAt, "arrivedAt");
        Objects.requireNonNull(message, "message");
    }

    public Vda5050Topic topic() {
        return message.topic();
    }

    public long headerId() {
        return message.header().headerId();
    }
}

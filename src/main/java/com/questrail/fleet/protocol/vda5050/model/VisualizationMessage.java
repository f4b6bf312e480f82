package com.questrail.fleet.protocol.vda5050.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Decoded {@code visualization} message: high-rate pose updates.
 */
public record VisualizationMessage(Header header, Optional<AgvPosition> position, Optional<Velocity> velocity)
        implements SequencedMessage {

    public VisualizationMessage {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(velocity, "velocity");
    }

    @Override
    public Vda5050Topic topic() {
        return Vda5050Topic.VISUALIZATION;
    }
}

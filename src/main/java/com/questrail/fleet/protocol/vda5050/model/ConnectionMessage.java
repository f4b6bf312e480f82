package com.questrail.fleet.protocol.vda5050.model;

import java.util.Objects;

/**
 * Decoded {@code connection} message, including broker last-will deliveries.
 */
public record ConnectionMessage(Header header, ReportedConnectionState connectionState, boolean fullResync)
        implements SequencedMessage {

    public ConnectionMessage {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(connectionState, "connectionState");
    }

    @Override
    public Vda5050Topic topic() {
        return Vda5050Topic.CONNECTION;
    }
}

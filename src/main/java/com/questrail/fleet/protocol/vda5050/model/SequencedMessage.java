package com.questrail.fleet.protocol.vda5050.model;

import com.questrail.fleet.api.VehicleId;

/**
 * A fully validated message carrying a VDA5050 header, and therefore subject
 * to header-sequence checks.
 */
public sealed interface SequencedMessage extends Vda5050Message
        permits StateMessage, ConnectionMessage, VisualizationMessage, OrderMessage {

    Header header();

    Vda5050Topic topic();

    /**
     * Whether the sender asked for its sequence baseline to be reset.
     */
    default boolean fullResync() {
        return false;
    }

    @Override
    default VehicleId vehicle() {
        return header().vehicle();
    }
}

package com.questrail.fleet.protocol.vda5050.codec;

import com.questrail.fleet.protocol.vda5050.model.Order;

import java.util.Objects;

/**
 * An encoded order together with the order as actually sent, i.e. carrying the
 * orderUpdateId the encoder assigned.
 */
public record EncodedOrder(EncodedMessage message, Order order, long headerId) {
    public EncodedOrder {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(order, "order");
    }
}

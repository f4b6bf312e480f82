package com.questrail.fleet.protocol.vda5050.model;

import java.util.Objects;

/**
 * Decoded {@code order} message. The fleet link normally only produces orders;
 * decoding them supports monitoring of orders issued by other masters and
 * verification of encoded payloads.
 */
public record OrderMessage(Header header, Order order) implements SequencedMessage {
    public OrderMessage {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(order, "order");
    }

    @Override
    public Vda5050Topic topic() {
        return Vda5050Topic.ORDER;
    }
}

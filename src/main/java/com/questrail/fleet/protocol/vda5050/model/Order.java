package com.questrail.fleet.protocol.vda5050.model;

import java.util.List;
import java.util.Objects;

/**
 * The semantic content of a VDA5050 {@code order}: identity plus route graph.
 *
 * <p>Shape validation (non-empty, strictly increasing sequence ids) is the
 * mission dispatcher's job; this type only guarantees non-null parts.</p>
 */
public record Order(String orderId, long orderUpdateId, List<Node> nodes, List<Edge> edges) {
    public Order {
        Objects.requireNonNull(orderId, "orderId");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
        if (orderUpdateId < 0) {
            throw new IllegalArgumentException("orderUpdateId must be >= 0");
        }
    }

    public Order withOrderUpdateId(long updateId) {
        return new Order(orderId, updateId, nodes, edges);
    }
}

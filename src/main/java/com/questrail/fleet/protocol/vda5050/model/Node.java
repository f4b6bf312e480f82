package com.questrail.fleet.protocol.vda5050.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Order node. Nodes carry even sequence ids, edges the odd ids between them.
 */
public record Node(String nodeId, long sequenceId, boolean released, Optional<NodePosition> position, List<Action> actions) {
    public Node {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(position, "position");
        actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
    }

    public static Node released(String nodeId, long sequenceId, NodePosition position) {
        return new Node(nodeId, sequenceId, true, Optional.ofNullable(position), List.of());
    }
}

package com.questrail.fleet.protocol.vda5050.model;

import java.util.List;
import java.util.Objects;

/**
 * Order edge connecting two consecutive nodes.
 */
public record Edge(String edgeId, long sequenceId, String startNodeId, String endNodeId, boolean released, List<Action> actions) {
    public Edge {
        Objects.requireNonNull(edgeId, "edgeId");
        Objects.requireNonNull(startNodeId, "startNodeId");
        Objects.requireNonNull(endNodeId, "endNodeId");
        actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
    }

    public static Edge released(String edgeId, long sequenceId, String startNodeId, String endNodeId) {
        return new Edge(edgeId, sequenceId, startNodeId, endNodeId, true, List.of());
    }
}

package com.questrail.fleet.mission;

import java.util.Objects;

/**
 * One line of an operator-entered node list.
 *
 * @param theta      heading in radians, normalised to [-π, π]
 * @param lineNumber 1-based line in the source text
 */
public record ParsedNode(String nodeId, double x, double y, double theta, int lineNumber) {
    public ParsedNode {
        Objects.requireNonNull(nodeId, "nodeId");
    }
}

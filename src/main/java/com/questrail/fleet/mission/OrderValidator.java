package com.questrail.fleet.mission;

import com.questrail.fleet.protocol.vda5050.model.Edge;
import com.questrail.fleet.protocol.vda5050.model.Node;
import com.questrail.fleet.protocol.vda5050.model.Order;

import java.util.List;

/**
 * Route shape checks applied before anything is published.
 *
 * <ul>
 *   <li>at least one node;</li>
 *   <li>node ids non-blank;</li>
 *   <li>exactly one edge between each pair of consecutive nodes, linking them
 *       by id;</li>
 *   <li>sequence ids strictly increasing along node, edge, node, ...</li>
 * </ul>
 */
final class OrderValidator
{
    private OrderValidator() {}

    static void validate(Order order) {
        List<Node> nodes = order.nodes();
        List<Edge> edges = order.edges();
        if (nodes.isEmpty()) {
            throw invalid("order " + order.orderId() + " has no nodes");
        }
        if (edges.size() != nodes.size() - 1) {
            throw invalid("order " + order.orderId() + " has " + nodes.size() + " nodes but "
                    + edges.size() + " edges");
        }

        long previous = Long.MIN_VALUE;
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.nodeId().isBlank()) {
                throw invalid("node " + i + " has a blank id");
            }
            previous = requireAfter(previous, node.sequenceId(), "node " + node.nodeId());

            if (i < edges.size()) {
                Edge edge = edges.get(i);
                Node next = nodes.get(i + 1);
                if (!edge.startNodeId().equals(node.nodeId()) || !edge.endNodeId().equals(next.nodeId())) {
                    throw invalid("edge " + edge.edgeId() + " does not connect "
                            + node.nodeId() + " to " + next.nodeId());
                }
                previous = requireAfter(previous, edge.sequenceId(), "edge " + edge.edgeId());
            }
        }
    }

    private static long requireAfter(long previous, long sequenceId, String what) {
        if (sequenceId <= previous) {
            throw invalid(what + " has sequenceId " + sequenceId + ", expected > " + previous);
        }
        return sequenceId;
    }

    private static MissionException invalid(String message) {
        return new MissionException(MissionException.Reason.INVALID_ORDER, message);
    }
}

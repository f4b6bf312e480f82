package com.questrail.fleet.mission;

import com.questrail.fleet.protocol.vda5050.model.Edge;
import com.questrail.fleet.protocol.vda5050.model.Node;
import com.questrail.fleet.protocol.vda5050.model.NodePosition;
import com.questrail.fleet.protocol.vda5050.model.Order;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns a parsed node list into a linear VDA5050 route.
 *
 * <p>Nodes get sequence ids 0, 2, 4, ...; the edge between node {@code i} and
 * node {@code i+1} gets the odd id in between. Everything is released.</p>
 *
 * <p>Advisory findings (nodes closer than {@value #MIN_NODE_SPACING_METRES} m,
 * more nodes than recommended) do not block dispatch; they are returned in
 * {@link Plan#warnings()} for the operator.</p>
 */
public final class MissionPlanner
{
    public static final double MIN_NODE_SPACING_METRES = 0.1;

    /**
     * @param warnings advisory findings, empty when none
     */
    public record Plan(Order order, List<String> warnings) {
        public Plan {
            Objects.requireNonNull(order, "order");
            warnings = List.copyOf(warnings);
        }
    }

    private final int maxNodesPerMission;
    private final String mapId;

    public MissionPlanner(int maxNodesPerMission, String mapId) {
        if (maxNodesPerMission < 1) {
            throw new IllegalArgumentException("maxNodesPerMission must be >= 1");
        }
        this.maxNodesPerMission = maxNodesPerMission;
        this.mapId = Objects.requireNonNull(mapId, "mapId");
    }

    public Plan plan(String orderId, List<ParsedNode> route) {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(route, "route");
        if (route.isEmpty()) {
            throw new MissionException(MissionException.Reason.INVALID_ORDER, "route has no nodes");
        }

        List<Node> nodes = new ArrayList<>(route.size());
        List<Edge> edges = new ArrayList<>(Math.max(0, route.size() - 1));
        for (int i = 0; i < route.size(); i++) {
            ParsedNode p = route.get(i);
            nodes.add(Node.released(p.nodeId(), 2L * i, new NodePosition(p.x(), p.y(), p.theta(), mapId)));
            if (i > 0) {
                ParsedNode prev = route.get(i - 1);
                edges.add(Edge.released(prev.nodeId() + "->" + p.nodeId(), 2L * i - 1, prev.nodeId(), p.nodeId()));
            }
        }

        return new Plan(new Order(orderId, 0, nodes, edges), warnings(route));
    }

    private List<String> warnings(List<ParsedNode> route) {
        List<String> warnings = new ArrayList<>();
        if (route.size() > maxNodesPerMission) {
            warnings.add("too many nodes: " + route.size() + " (recommended maximum " + maxNodesPerMission + ")");
        }
        for (int i = 0; i + 1 < route.size(); i++) {
            ParsedNode a = route.get(i);
            ParsedNode b = route.get(i + 1);
            double distance = Math.hypot(b.x() - a.x(), b.y() - a.y());
            if (distance < MIN_NODE_SPACING_METRES) {
                warnings.add(String.format(Locale.ROOT, "nodes '%s' and '%s' are very close (%.2f m)",
                        a.nodeId(), b.nodeId(), distance));
            }
        }
        return warnings;
    }
}

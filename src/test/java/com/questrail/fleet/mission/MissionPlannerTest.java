package com.questrail.fleet.mission;

import com.questrail.fleet.protocol.vda5050.model.Edge;
import com.questrail.fleet.protocol.vda5050.model.Node;
import com.questrail.fleet.protocol.vda5050.model.Order;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MissionPlannerTest {

    private final MissionPlanner planner = new MissionPlanner(3, "hall-2");

    @Test
    void buildsReleasedLinearRouteThatPassesValidation() {
        MissionPlanner.Plan plan = planner.plan("ORDER-1",
                NodeListParser.parse("a,0,0,0\nb,5,0,0\nc,5,5,1.57"));

        Order order = plan.order();
        assertEquals("ORDER-1", order.orderId());
        assertEquals(List.of(0L, 2L, 4L), order.nodes().stream().map(Node::sequenceId).toList());
        assertEquals(List.of(1L, 3L), order.edges().stream().map(Edge::sequenceId).toList());
        assertEquals("a->b", order.edges().get(0).edgeId());
        assertTrue(order.nodes().stream().allMatch(Node::released));
        assertEquals("hall-2", order.nodes().get(2).position().orElseThrow().mapId());
        assertTrue(plan.warnings().isEmpty());
        assertDoesNotThrow(() -> OrderValidator.validate(order));
    }

    @Test
    void closeNodesAndLongRoutesOnlyWarn() {
        MissionPlanner.Plan plan = planner.plan("ORDER-2",
                NodeListParser.parse("a,0,0,0\nb,0.05,0,0\nc,3,0,0\nd,6,0,0"));

        assertEquals(4, plan.order().nodes().size());
        assertEquals(2, plan.warnings().size());
        assertTrue(plan.warnings().get(0).startsWith("too many nodes: 4"));
        assertEquals("nodes 'a' and 'b' are very close (0.05 m)", plan.warnings().get(1));
    }

    @Test
    void emptyRouteIsRejected() {
        assertThrows(MissionException.class, () -> planner.plan("ORDER-3", List.of()));
        assertThrows(IllegalArgumentException.class, () -> new MissionPlanner(0, "m"));
    }
}

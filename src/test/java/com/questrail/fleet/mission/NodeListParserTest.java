package com.questrail.fleet.mission;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeListParserTest {

    @Test
    void parsesLinesAndSkipsBlanks() {
        List<ParsedNode> nodes = NodeListParser.parse(
                "warehouse_pickup,10.5,20.3,0.0\n\n  delivery_zone_A , 15.2 ,25.1, 1.57 \r\n");

        assertEquals(2, nodes.size());
        assertEquals(new ParsedNode("warehouse_pickup", 10.5, 20.3, 0.0, 1), nodes.get(0));
        ParsedNode second = nodes.get(1);
        assertEquals("delivery_zone_A", second.nodeId());
        assertEquals(3, second.lineNumber());
        assertEquals(1.57, second.theta(), 1e-9);
    }

    @Test
    void headingIsNormalised() {
        ParsedNode n = NodeListParser.parse("a,0,0,4.0").get(0);
        assertEquals(4.0 - 2 * Math.PI, n.theta(), 1e-9);
        assertEquals(Math.PI, NodeListParser.normalizeTheta(Math.PI), 1e-12);
        assertEquals(-Math.PI / 2, NodeListParser.normalizeTheta(3 * Math.PI / 2), 1e-9);
    }

    @Test
    void errorsNameTheLine() {
        MissionException wrongArity = assertThrows(MissionException.class,
                () -> NodeListParser.parse("a,0,0,0\nb,1,1"));
        assertTrue(wrongArity.getMessage().contains("line 2"), wrongArity.getMessage());

        MissionException notNumber = assertThrows(MissionException.class,
                () -> NodeListParser.parse("a,zero,0,0"));
        assertTrue(notNumber.getMessage().contains("'zero'"));

        assertThrows(MissionException.class, () -> NodeListParser.parse(" ,0,0,0"));
        assertThrows(MissionException.class, () -> NodeListParser.parse("a,NaN,0,0"));
    }

    @Test
    void rejectsEmptyInputOutOfRangeAndDuplicates() {
        assertThrows(MissionException.class, () -> NodeListParser.parse("  \n "));
        assertThrows(MissionException.class, () -> NodeListParser.parse(null));
        assertThrows(MissionException.class, () -> NodeListParser.parse("far,1000.1,0,0"));
        assertDoesNotThrow(() -> NodeListParser.parse("edge,1000,-1000,0"));

        MissionException dup = assertThrows(MissionException.class,
                () -> NodeListParser.parse("a,0,0,0\nb,1,0,0\na,2,0,0"));
        assertEquals(MissionException.Reason.INVALID_ORDER, dup.reason());
        assertTrue(dup.getMessage().contains("a"));
    }
}

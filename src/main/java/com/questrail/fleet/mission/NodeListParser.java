package com.questrail.fleet.mission;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses operator-entered routes, one {@code nodeId,x,y,theta} per line.
 *
 * <pre>
 *   warehouse_pickup,10.5,20.3,0.0
 *   delivery_zone_A,15.2,25.1,1.57
 * </pre>
 *
 * Blank lines are skipped. Any malformed line rejects the whole list with a
 * {@link MissionException} naming the line.
 */
public final class NodeListParser
{
    /** Coordinates beyond this many metres from the origin are rejected. */
    public static final double MAX_COORDINATE = 1000.0;

    private NodeListParser() {}

    public static List<ParsedNode> parse(String text) {
        if (text == null || text.isBlank()) {
            throw invalid("empty node list");
        }

        List<ParsedNode> nodes = new ArrayList<>();
        String[] lines = text.strip().split("\\R");
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }

            String[] parts = line.split(",", -1);
            if (parts.length != 4) {
                throw invalid("line " + lineNumber + ": expected 4 values (nodeId,x,y,theta), got " + parts.length);
            }
            String nodeId = parts[0].strip();
            if (nodeId.isEmpty()) {
                throw invalid("line " + lineNumber + ": node id cannot be empty");
            }

            double x = number(parts[1], lineNumber);
            double y = number(parts[2], lineNumber);
            double theta = number(parts[3], lineNumber);
            if (Math.abs(x) > MAX_COORDINATE || Math.abs(y) > MAX_COORDINATE) {
                throw invalid("line " + lineNumber + ": coordinates exceed ±" + (int) MAX_COORDINATE + " m");
            }
            nodes.add(new ParsedNode(nodeId, x, y, normalizeTheta(theta), lineNumber));
        }

        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (ParsedNode n : nodes) {
            if (!seen.add(n.nodeId())) {
                duplicates.add(n.nodeId());
            }
        }
        if (!duplicates.isEmpty()) {
            throw invalid("duplicate node ids: " + String.join(", ", duplicates));
        }
        return List.copyOf(nodes);
    }

    static double normalizeTheta(double theta) {
        double t = theta;
        while (t > Math.PI) {
            t -= 2 * Math.PI;
        }
        while (t < -Math.PI) {
            t += 2 * Math.PI;
        }
        return t;
    }

    private static double number(String raw, int lineNumber) {
        try {
            double v = Double.parseDouble(raw.strip());
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new NumberFormatException("not finite");
            }
            return v;
        } catch (NumberFormatException e) {
            throw invalid("line " + lineNumber + ": invalid number '" + raw.strip() + "'");
        }
    }

    private static MissionException invalid(String message) {
        return new MissionException(MissionException.Reason.INVALID_ORDER, message);
    }
}

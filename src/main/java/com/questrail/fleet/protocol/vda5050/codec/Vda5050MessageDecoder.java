package com.questrail.fleet.protocol.vda5050.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.protocol.vda5050.model.*;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Vda5050MessageDecoder
 * ============================================================================
 * Converts a raw broker frame (topic + JSON bytes) into a semantic
 * {@link Vda5050Message}.
 *
 * <h2>Architectural Role</h2>
 * This class is the explicit boundary between wire data and protocol
 * semantics. Telemetry, sequencing and mission tracking operate exclusively on
 * {@link Vda5050Message} and never reason about JSON.
 *
 * <h2>Variant selection</h2>
 * The variant is chosen by the topic's trailing segment:
 * <ul>
 *   <li>{@code state} → {@link StateMessage}</li>
 *   <li>{@code connection} → {@link ConnectionMessage}</li>
 *   <li>{@code visualization} → {@link VisualizationMessage}</li>
 *   <li>{@code order} → {@link OrderMessage}</li>
 *   <li>anything else → {@link UnknownMessage} (payload not parsed)</li>
 * </ul>
 *
 * <h2>Validation</h2>
 * Every headered message must carry {@code headerId}, {@code timestamp}
 * (ISO-8601 with offset), {@code version}, {@code manufacturer} and
 * {@code serialNumber}; the latter two must match the topic. Topic-specific
 * mandatory fields are checked per variant. Unknown JSON properties are
 * ignored so newer minor protocol versions still decode.
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Sequence checks (see {@link HeaderSequenceGuard})</li>
 *   <li>Telemetry updates or acknowledgement matching</li>
 *   <li>Logging; failures are reported only by {@link ProtocolException}</li>
 * </ul>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
public final class Vda5050MessageDecoder
{
    private final ObjectMapper mapper;
    private final Vda5050TopicCodec topics;

    public Vda5050MessageDecoder(ObjectMapper mapper, Vda5050TopicCodec topics) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.topics = Objects.requireNonNull(topics, "topics");
    }

    /**
     * Decodes one frame.
     *
     * @throws ProtocolException if the topic or payload is malformed or a
     *         mandatory field is missing
     */
    public Vda5050Message decode(String topic, byte[] payload) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        ParsedTopic parsed = topics.parse(topic);
        if (parsed.kind().isEmpty()) {
            return new UnknownMessage(parsed.vehicle(), parsed.segment(), payload.length);
        }

        JsonNode root = readTree(payload);
        Header header = decodeHeader(root, parsed.vehicle());

        return switch (parsed.kind().get()) {
            case STATE -> decodeState(root, header);
            case CONNECTION -> decodeConnection(root, header);
            case VISUALIZATION -> decodeVisualization(root, header);
            case ORDER -> new OrderMessage(header, decodeOrder(root));
            case INSTANT_ACTIONS -> new UnknownMessage(parsed.vehicle(), parsed.segment(), payload.length);
        };
    }

    // ========================================================================
    // Header
    // ========================================================================

    private JsonNode readTree(byte[] payload) {
        final JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "Payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "Payload must be a JSON object");
        }
        return root;
    }

    private Header decodeHeader(JsonNode root, VehicleId topicVehicle) {
        long headerId = requiredLong(root, "headerId");
        if (headerId < 0) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_VALUE,
                    "headerId must be non-negative: " + headerId);
        }
        Instant timestamp = parseTimestamp(requiredText(root, "timestamp"));
        String version = requiredText(root, "version");
        String manufacturer = requiredText(root, "manufacturer");
        String serialNumber = requiredText(root, "serialNumber");

        if (!manufacturer.equals(topicVehicle.manufacturer())
                || !serialNumber.equals(topicVehicle.serialNumber())) {
            throw new ProtocolException(ProtocolException.Reason.IDENTITY_MISMATCH,
                    "Header names " + manufacturer + "/" + serialNumber
                            + " but topic names " + topicVehicle);
        }
        return new Header(headerId, timestamp, version, topicVehicle);
    }

    private static Instant parseTimestamp(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_VALUE,
                    "timestamp is not ISO-8601 with offset: " + text, e);
        }
    }

    // ========================================================================
    // Vehicle → master topics
    // ========================================================================

    private StateMessage decodeState(JsonNode root, Header header) {
        JsonNode battery = requiredObject(root, "batteryState");
        double charge = requiredDouble(battery, "batteryCharge");
        if (charge < 0.0 || charge > 100.0) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_VALUE,
                    "batteryCharge out of range: " + charge);
        }

        OperatingMode mode = requiredEnum(root, "operatingMode", OperatingMode.class);

        JsonNode errorsNode = root.get("errors");
        if (errorsNode == null || !errorsNode.isArray()) {
            throw new ProtocolException(ProtocolException.Reason.MISSING_FIELD,
                    "Missing mandatory array 'errors'");
        }
        List<AgvError> errors = new ArrayList<>();
        for (JsonNode e : errorsNode) {
            errors.add(decodeError(e));
        }

        return new StateMessage(
                header,
                optionalText(root, "orderId", ""),
                optionalLong(root, "orderUpdateId", 0L),
                requiredTextAllowEmpty(root, "lastNodeId"),
                optionalLong(root, "lastNodeSequenceId", 0L),
                optionalBoolean(root, "driving", false),
                mode,
                new BatteryState(charge, optionalBoolean(battery, "charging", false)),
                optionalObject(root, "agvPosition").map(this::decodePosition),
                errors,
                optionalBoolean(root, "fullResync", false));
    }

    private AgvError decodeError(JsonNode e) {
        if (!e.isObject()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "errors[] entries must be objects");
        }
        Map<String, String> refs = new LinkedHashMap<>();
        JsonNode refsNode = e.get("errorReferences");
        if (refsNode != null && refsNode.isArray()) {
            for (JsonNode r : refsNode) {
                refs.put(requiredText(r, "referenceKey"), requiredTextAllowEmpty(r, "referenceValue"));
            }
        }
        return new AgvError(
                requiredText(e, "errorType"),
                requiredEnum(e, "errorLevel", ErrorLevel.class),
                optionalText(e, "errorDescription", ""),
                refs);
    }

    private ConnectionMessage decodeConnection(JsonNode root, Header header) {
        return new ConnectionMessage(
                header,
                requiredEnum(root, "connectionState", ReportedConnectionState.class),
                optionalBoolean(root, "fullResync", false));
    }

    private VisualizationMessage decodeVisualization(JsonNode root, Header header) {
        Optional<Velocity> velocity = optionalObject(root, "velocity").map(v -> new Velocity(
                optionalDouble(v, "vx", 0.0),
                optionalDouble(v, "vy", 0.0),
                optionalDouble(v, "omega", 0.0)));
        return new VisualizationMessage(
                header,
                optionalObject(root, "agvPosition").map(this::decodePosition),
                velocity);
    }

    private AgvPosition decodePosition(JsonNode p) {
        return new AgvPosition(
                requiredDouble(p, "x"),
                requiredDouble(p, "y"),
                requiredDouble(p, "theta"),
                requiredText(p, "mapId"),
                optionalBoolean(p, "positionInitialized", true));
    }

    // ========================================================================
    // Master → vehicle topics
    // ========================================================================

    private Order decodeOrder(JsonNode root) {
        String orderId = requiredText(root, "orderId");
        long orderUpdateId = requiredLong(root, "orderUpdateId");
        if (orderUpdateId < 0) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_VALUE,
                    "orderUpdateId must be non-negative");
        }

        List<Node> nodes = new ArrayList<>();
        for (JsonNode n : requiredArray(root, "nodes")) {
            nodes.add(new Node(
                    requiredText(n, "nodeId"),
                    requiredLong(n, "sequenceId"),
                    optionalBoolean(n, "released", true),
                    optionalObject(n, "nodePosition").map(p -> new NodePosition(
                            requiredDouble(p, "x"),
                            requiredDouble(p, "y"),
                            optionalDouble(p, "theta", 0.0),
                            requiredText(p, "mapId"))),
                    decodeActions(n)));
        }

        List<Edge> edges = new ArrayList<>();
        for (JsonNode e : requiredArray(root, "edges")) {
            edges.add(new Edge(
                    requiredText(e, "edgeId"),
                    requiredLong(e, "sequenceId"),
                    requiredText(e, "startNodeId"),
                    requiredText(e, "endNodeId"),
                    optionalBoolean(e, "released", true),
                    decodeActions(e)));
        }
        return new Order(orderId, orderUpdateId, nodes, edges);
    }

    private List<Action> decodeActions(JsonNode owner) {
        JsonNode actions = owner.get("actions");
        if (actions == null || actions.isNull()) {
            return List.of();
        }
        if (!actions.isArray()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD, "'actions' must be an array");
        }
        List<Action> out = new ArrayList<>();
        for (JsonNode a : actions) {
            Map<String, String> params = new LinkedHashMap<>();
            JsonNode ps = a.get("actionParameters");
            if (ps != null && ps.isArray()) {
                for (JsonNode p : ps) {
                    JsonNode value = p.get("value");
                    params.put(requiredText(p, "key"), value == null ? "" : value.asText());
                }
            }
            out.add(new Action(
                    requiredText(a, "actionType"),
                    requiredText(a, "actionId"),
                    requiredEnum(a, "blockingType", BlockingType.class),
                    params));
        }
        return out;
    }

    // ========================================================================
    // Field helpers
    // ========================================================================

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ProtocolException(ProtocolException.Reason.MISSING_FIELD,
                    "Missing mandatory field '" + field + "'");
        }
        return value;
    }

    private static String requiredText(JsonNode node, String field) {
        String text = requiredTextAllowEmpty(node, field);
        if (text.isEmpty()) {
            throw new ProtocolException(ProtocolException.Reason.MISSING_FIELD,
                    "Mandatory field '" + field + "' is empty");
        }
        return text;
    }

    private static String requiredTextAllowEmpty(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "Field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static long requiredLong(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isIntegralNumber()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "Field '" + field + "' must be an integer");
        }
        if (!value.canConvertToLong()) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_VALUE,
                    "Field '" + field + "' is out of range: " + value.asText());
        }
        return value.asLong();
    }

    private static double requiredDouble(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isNumber()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "Field '" + field + "' must be a number");
        }
        return value.asDouble();
    }

    private static JsonNode requiredObject(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isObject()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "Field '" + field + "' must be an object");
        }
        return value;
    }

    private static JsonNode requiredArray(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isArray()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "Field '" + field + "' must be an array");
        }
        return value;
    }

    private static <E extends Enum<E>> E requiredEnum(JsonNode node, String field, Class<E> type) {
        String text = requiredText(node, field);
        try {
            return Enum.valueOf(type, text);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_VALUE,
                    "Unsupported " + field + ": " + text, e);
        }
    }

    private static String optionalText(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }

    private static long optionalLong(JsonNode node, String field, long fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isIntegralNumber()) {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED_PAYLOAD,
                    "Field '" + field + "' must be an integer");
        }
        if (!value.canConvertToLong()) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_VALUE,
                    "Field '" + field + "' is out of range: " + value.asText());
        }
        return value.asLong();
    }

    private static double optionalDouble(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        return value == null || !value.isNumber() ? fallback : value.asDouble();
    }

    private static boolean optionalBoolean(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        return value == null || !value.isBoolean() ? fallback : value.asBoolean();
    }

    private static Optional<JsonNode> optionalObject(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isObject() ? Optional.of(value) : Optional.empty();
    }
}

package com.questrail.fleet.protocol.vda5050.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.internal.time.WallClock;
import com.questrail.fleet.protocol.vda5050.model.Action;
import com.questrail.fleet.protocol.vda5050.model.Edge;
import com.questrail.fleet.protocol.vda5050.model.Node;
import com.questrail.fleet.protocol.vda5050.model.Order;
import com.questrail.fleet.protocol.vda5050.model.Vda5050Topic;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Vda5050MessageEncoder
 * ============================================================================
 * Produces outbound VDA5050 {@code order} and {@code instantActions} messages.
 *
 * <h2>Sequencing owned here</h2>
 * <ul>
 *   <li>{@code headerId}: one counter per (vehicle, topic), starting at 0.</li>
 *   <li>{@code orderUpdateId}: strictly increasing per {@code orderId}, via
 *       {@link OrderUpdateSequencer}.</li>
 * </ul>
 *
 * <p>The encoder does not validate route shape; callers validate before
 * encoding so that a rejected order never consumes an orderUpdateId.</p>
 */
public final class Vda5050MessageEncoder {

    private record CounterKey(VehicleId vehicle, Vda5050Topic topic) {}

    private final ObjectMapper mapper;
    private final Vda5050TopicCodec topics;
    private final WallClock wallClock;
    private final String protocolVersion;
    private final OrderUpdateSequencer updateSequencer;
    private final ConcurrentMap<CounterKey, AtomicLong> headerCounters = new ConcurrentHashMap<>();

    public Vda5050MessageEncoder(ObjectMapper mapper,
                                 Vda5050TopicCodec topics,
                                 WallClock wallClock,
                                 String protocolVersion,
                                 OrderUpdateSequencer updateSequencer) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.protocolVersion = Objects.requireNonNull(protocolVersion, "protocolVersion");
        this.updateSequencer = Objects.requireNonNull(updateSequencer, "updateSequencer");
    }

    public OrderUpdateSequencer updateSequencer() {
        return updateSequencer;
    }

    /**
     * Encode an order for {@code vehicle}, assigning its orderUpdateId.
     */
    public EncodedOrder encodeOrder(VehicleId vehicle, Order order) {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(order, "order");

        long updateId = updateSequencer.next(order.orderId(), order.orderUpdateId());
        Order assigned = order.withOrderUpdateId(updateId);

        long headerId = nextHeaderId(vehicle, Vda5050Topic.ORDER);
        ObjectNode root = header(vehicle, headerId);
        root.put("orderId", assigned.orderId());
        root.put("orderUpdateId", assigned.orderUpdateId());

        ArrayNode nodes = root.putArray("nodes");
        for (Node n : assigned.nodes()) {
            ObjectNode node = nodes.addObject();
            node.put("nodeId", n.nodeId());
            node.put("sequenceId", n.sequenceId());
            node.put("released", n.released());
            n.position().ifPresent(p -> {
                ObjectNode pos = node.putObject("nodePosition");
                pos.put("x", p.x());
                pos.put("y", p.y());
                pos.put("theta", p.theta());
                pos.put("mapId", p.mapId());
            });
            writeActions(node.putArray("actions"), n.actions());
        }

        ArrayNode edges = root.putArray("edges");
        for (Edge e : assigned.edges()) {
            ObjectNode edge = edges.addObject();
            edge.put("edgeId", e.edgeId());
            edge.put("sequenceId", e.sequenceId());
            edge.put("released", e.released());
            edge.put("startNodeId", e.startNodeId());
            edge.put("endNodeId", e.endNodeId());
            writeActions(edge.putArray("actions"), e.actions());
        }

        EncodedMessage message = new EncodedMessage(topics.topicFor(vehicle, Vda5050Topic.ORDER), write(root));
        return new EncodedOrder(message, assigned, headerId);
    }

    /**
     * Encode an {@code instantActions} message (e.g. {@code cancelOrder}).
     */
    public EncodedMessage encodeInstantActions(VehicleId vehicle, List<Action> actions) {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(actions, "actions");
        if (actions.isEmpty()) {
            throw new IllegalArgumentException("instantActions requires at least one action");
        }

        ObjectNode root = header(vehicle, nextHeaderId(vehicle, Vda5050Topic.INSTANT_ACTIONS));
        writeActions(root.putArray("actions"), actions);
        return new EncodedMessage(topics.topicFor(vehicle, Vda5050Topic.INSTANT_ACTIONS), write(root));
    }

    private long nextHeaderId(VehicleId vehicle, Vda5050Topic topic) {
        return headerCounters
                .computeIfAbsent(new CounterKey(vehicle, topic), k -> new AtomicLong())
                .getAndIncrement();
    }

    private ObjectNode header(VehicleId vehicle, long headerId) {
        ObjectNode root = mapper.createObjectNode();
        root.put("headerId", headerId);
        root.put("timestamp", wallClock.now().toString());
        root.put("version", protocolVersion);
        root.put("manufacturer", vehicle.manufacturer());
        root.put("serialNumber", vehicle.serialNumber());
        return root;
    }

    private static void writeActions(ArrayNode target, List<Action> actions) {
        for (Action a : actions) {
            ObjectNode action = target.addObject();
            action.put("actionType", a.actionType());
            action.put("actionId", a.actionId());
            action.put("blockingType", a.blockingType().name());
            ArrayNode params = action.putArray("actionParameters");
            for (Map.Entry<String, String> p : a.parameters().entrySet()) {
                ObjectNode param = params.addObject();
                param.put("key", p.getKey());
                param.put("value", p.getValue());
            }
        }
    }

    private byte[] write(ObjectNode root) {
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            // Tree nodes built above always serialize.
            throw new IllegalStateException("Failed to serialize VDA5050 payload", e);
        }
    }
}

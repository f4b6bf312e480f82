package com.questrail.fleet.protocol.vda5050.codec;

import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.protocol.vda5050.model.Vda5050Topic;

import java.util.List;
import java.util.Objects;

/**
 * Vda5050TopicCodec
 * -----------------------------------------------------------------------------
 * Builds and parses VDA5050 topic names.
 *
 * <pre>
 *   &lt;interfaceName&gt;/&lt;manufacturer&gt;/&lt;serialNumber&gt;/&lt;segment&gt;
 * </pre>
 *
 * <p>The interface name is deployment configuration and may itself contain
 * slashes (VDA5050 2.x deployments commonly use {@code uagv/v2}). Parsing
 * therefore anchors on the configured prefix and reads exactly three segments
 * after it.</p>
 */
public final class Vda5050TopicCodec {

    private final String interfaceName;
    private final String prefix;

    public Vda5050TopicCodec(String interfaceName) {
        this.interfaceName = checkInterfaceName(interfaceName);
        this.prefix = interfaceName + "/";
    }

    /**
     * Rejects prefixes that cannot anchor a topic: blank, leading or trailing
     * {@code /}, or containing an MQTT wildcard.
     *
     * @return {@code interfaceName} unchanged
     */
    public static String checkInterfaceName(String interfaceName) {
        Objects.requireNonNull(interfaceName, "interfaceName");
        if (interfaceName.isBlank() || interfaceName.startsWith("/") || interfaceName.endsWith("/")) {
            throw new IllegalArgumentException("invalid interfaceName: '" + interfaceName + "'");
        }
        if (interfaceName.contains("+") || interfaceName.contains("#")) {
            throw new IllegalArgumentException("interfaceName must not contain MQTT wildcards");
        }
        return interfaceName;
    }

    public String interfaceName() {
        return interfaceName;
    }

    public String topicFor(VehicleId vehicle, Vda5050Topic topic) {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(topic, "topic");
        return prefix + vehicle.manufacturer() + "/" + vehicle.serialNumber() + "/" + topic.segment();
    }

    /**
     * Subscription filter matching {@code topic} for every vehicle in the fleet.
     */
    public String fleetFilter(Vda5050Topic topic) {
        Objects.requireNonNull(topic, "topic");
        return prefix + "+/+/" + topic.segment();
    }

    /**
     * The fixed set of filters the fleet link subscribes to on every session.
     */
    public List<String> fleetSubscriptions() {
        return List.of(
                fleetFilter(Vda5050Topic.STATE),
                fleetFilter(Vda5050Topic.CONNECTION),
                fleetFilter(Vda5050Topic.VISUALIZATION));
    }

    /**
     * @throws ProtocolException with {@link ProtocolException.Reason#INVALID_TOPIC}
     *         if the topic is outside this interface or has the wrong shape
     */
    public ParsedTopic parse(String topic) {
        Objects.requireNonNull(topic, "topic");
        if (!topic.startsWith(prefix)) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_TOPIC,
                    "Topic outside interface '" + interfaceName + "': " + topic);
        }

        String[] parts = topic.substring(prefix.length()).split("/", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_TOPIC,
                    "Expected <manufacturer>/<serialNumber>/<topic> after interface: " + topic);
        }

        final VehicleId vehicle;
        try {
            vehicle = new VehicleId(parts[0], parts[1]);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(ProtocolException.Reason.INVALID_TOPIC,
                    "Invalid vehicle segments in topic: " + topic, e);
        }
        return new ParsedTopic(vehicle, parts[2], Vda5050Topic.fromSegment(parts[2]));
    }
}

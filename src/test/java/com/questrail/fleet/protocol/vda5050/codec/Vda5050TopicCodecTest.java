package com.questrail.fleet.protocol.vda5050.codec;

import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.protocol.vda5050.model.Vda5050Topic;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class Vda5050TopicCodecTest {

    private final Vda5050TopicCodec codec = new Vda5050TopicCodec("uagv/v2");
    private final VehicleId agv = VehicleId.of("KUKA", "AGV-07");

    @Test
    void buildsTopicWithMultiSegmentInterfaceName() {
        assertEquals("uagv/v2/KUKA/AGV-07/order", codec.topicFor(agv, Vda5050Topic.ORDER));
        assertEquals("uagv/v2/KUKA/AGV-07/instantActions", codec.topicFor(agv, Vda5050Topic.INSTANT_ACTIONS));
    }

    @Test
    void fleetSubscriptionsCoverVehicleToMasterTopics() {
        assertEquals(List.of(
                "uagv/v2/+/+/state",
                "uagv/v2/+/+/connection",
                "uagv/v2/+/+/visualization"), codec.fleetSubscriptions());
    }

    @Test
    void parsesKnownAndUnknownSegments() {
        ParsedTopic state = codec.parse("uagv/v2/KUKA/AGV-07/state");
        assertEquals(agv, state.vehicle());
        assertEquals(Optional.of(Vda5050Topic.STATE), state.kind());

        ParsedTopic factsheet = codec.parse("uagv/v2/KUKA/AGV-07/factsheet");
        assertEquals("factsheet", factsheet.segment());
        assertTrue(factsheet.kind().isEmpty());
    }

    @Test
    void rejectsTopicsOutsideInterfaceOrWithWrongShape() {
        for (String bad : List.of(
                "other/v2/KUKA/AGV-07/state",
                "uagv/v2/KUKA/state",
                "uagv/v2/KUKA/AGV-07/state/extra",
                "uagv/v2//AGV-07/state")) {
            ProtocolException e = assertThrows(ProtocolException.class, () -> codec.parse(bad), bad);
            assertEquals(ProtocolException.Reason.INVALID_TOPIC, e.reason());
        }
    }

    @Test
    void rejectsWildcardInterfaceName() {
        assertThrows(IllegalArgumentException.class, () -> new Vda5050TopicCodec("uagv/+"));
        assertThrows(IllegalArgumentException.class, () -> new Vda5050TopicCodec("/uagv"));
    }
}

package com.questrail.fleet.mission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fleet.api.AckState;
import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.connection.ConnectionManager;
import com.questrail.fleet.connection.FakeBrokerTransport;
import com.questrail.fleet.connection.PublishException;
import com.questrail.fleet.credentials.BrokerConfig;
import com.questrail.fleet.observability.MissionEvent;
import com.questrail.fleet.observability.RecordingObservabilitySink;
import com.questrail.fleet.protocol.vda5050.codec.OrderUpdateSequencer;
import com.questrail.fleet.protocol.vda5050.codec.Vda5050MessageEncoder;
import com.questrail.fleet.protocol.vda5050.codec.Vda5050TopicCodec;
import com.questrail.fleet.protocol.vda5050.model.*;
import com.questrail.fleet.time.DeterministicScheduler;
import com.questrail.fleet.time.ManualMonotonicClock;
import com.questrail.fleet.time.MutableWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MissionDispatcherTest
 * -----------------------------------------------------------------------------
 * Dispatch, acknowledgement matching, timeouts and operator retry.
 *
 * Acknowledgements are fed as decoded state messages; ack deadlines run on a
 * deterministic scheduler.
 */
class MissionDispatcherTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final VehicleId agv = VehicleId.of("KUKA", "AGV-07");
    private final VehicleId other = VehicleId.of("MiR", "250-1");
    private final ObjectMapper mapper = new ObjectMapper();

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private MutableWallClock wallClock;
    private FakeBrokerTransport transport;
    private RecordingObservabilitySink sink;
    private ConnectionManager connection;
    private Vda5050MessageEncoder encoder;
    private MissionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        wallClock = new MutableWallClock(T0);
        transport = new FakeBrokerTransport();
        sink = new RecordingObservabilitySink();
        connection = new ConnectionManager(transport, Duration.ofMillis(200), Duration.ofMillis(200), wallClock, sink);
        encoder = new Vda5050MessageEncoder(mapper, new Vda5050TopicCodec("uagv/v2"), wallClock, "2.0.0",
                new OrderUpdateSequencer());
        dispatcher = newDispatcher(50);
        connection.connect(BrokerConfig.defaults());
    }

    private MissionDispatcher newDispatcher(int historyLimit) {
        return new MissionDispatcher(connection, encoder,
                new OrderIdGenerator("ORDER", wallClock, ZoneOffset.UTC),
                Duration.ofSeconds(30), historyLimit, clock, scheduler, wallClock, sink);
    }

    private static Order route(String orderId) {
        return new Order(orderId, 0,
                List.of(Node.released("pickup", 0, new NodePosition(0, 0, 0, "floor1")),
                        Node.released("drop", 2, new NodePosition(8, 3, 1.57, "floor1"))),
                List.of(Edge.released("pickup->drop", 1, "pickup", "drop")));
    }

    private StateMessage stateReporting(VehicleId vehicle, String orderId, long updateId) {
        return new StateMessage(new Header(7, wallClock.now(), "2.0.0", vehicle), orderId, updateId, "pickup", 0,
                true, OperatingMode.AUTOMATIC, new BatteryState(64, false), Optional.empty(), List.of(), false);
    }

    private StateMessage stateWithError(VehicleId vehicle, String errorType, String orderId) {
        AgvError error = new AgvError(errorType, ErrorLevel.WARNING, "no route", Map.of("orderId", orderId));
        return new StateMessage(new Header(8, wallClock.now(), "2.0.0", vehicle), "", 0, "", 0,
                false, OperatingMode.AUTOMATIC, new BatteryState(64, false), Optional.empty(), List.of(error), false);
    }

    private void advance(Duration d) {
        clock.advance(d);
        wallClock.advance(d);
        scheduler.runDueTasks();
    }

    @Test
    void dispatchPublishesOrderAndRecordsPending() throws Exception {
        MissionOrder m = dispatcher.dispatch(agv, route("ORDER-A"));

        assertEquals(AckState.PENDING, m.ackState());
        assertEquals(0, m.orderUpdateId());
        assertEquals(T0.plusSeconds(30), m.ackDeadline());

        assertEquals(1, transport.published().size());
        FakeBrokerTransport.Published p = transport.published().get(0);
        assertEquals("uagv/v2/KUKA/AGV-07/order", p.topic());
        JsonNode json = mapper.readTree(p.payload());
        assertEquals("ORDER-A", json.get("orderId").asText());
        assertEquals(2, json.get("nodes").size());
        assertEquals(List.of(m), dispatcher.pending());
    }

    @Test
    void blankOrderIdIsGenerated() {
        MissionOrder first = dispatcher.dispatch(agv, route(""));
        MissionOrder second = dispatcher.dispatch(agv, route(""));

        assertEquals("ORDER-20240501-100000", first.orderId());
        assertEquals("ORDER-20240501-100000-2", second.orderId());
    }

    @Test
    void dispatchWhileDisconnectedLeavesNoTrace() {
        connection.disconnect();

        assertThrows(PublishException.class, () -> dispatcher.dispatch(agv, route("ORDER-A")));

        assertTrue(dispatcher.history().isEmpty());
        assertEquals(0, scheduler.pendingCount());
        assertFalse(sink.hasEventOfType(MissionEvent.class));
    }

    @Test
    void failedDispatchesDoNotAccumulateUpdateCounters() {
        connection.disconnect();
        OrderUpdateSequencer sequencer = encoder.updateSequencer();

        List<String> attempted = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            String id = "ORDER-" + i;
            attempted.add(id);
            assertThrows(PublishException.class, () -> dispatcher.dispatch(agv, route(id)));
        }
        assertThrows(PublishException.class, () -> dispatcher.dispatch(agv, route("")));

        for (String id : attempted) {
            assertEquals(-1, sequencer.lastAssigned(id), id);
        }
        assertEquals(-1, sequencer.lastAssigned("ORDER-20240501-100000"));
    }

    @Test
    void failedRetryStillConsumesTheUpdateId() {
        dispatcher.dispatch(agv, route("ORDER-A"));
        advance(Duration.ofSeconds(30));
        connection.disconnect();

        assertThrows(PublishException.class, () -> dispatcher.retry("ORDER-A"));

        assertEquals(1, encoder.updateSequencer().lastAssigned("ORDER-A"));
        assertEquals(AckState.TIMEOUT, dispatcher.find("ORDER-A").orElseThrow().ackState());
    }

    @Test
    void invalidRouteIsRejectedBeforePublishing() {
        Order broken = new Order("ORDER-A", 0,
                List.of(Node.released("a", 0, new NodePosition(0, 0, 0, "m")),
                        Node.released("b", 2, new NodePosition(1, 0, 0, "m"))),
                List.of());

        MissionException e = assertThrows(MissionException.class, () -> dispatcher.dispatch(agv, broken));
        assertEquals(MissionException.Reason.INVALID_ORDER, e.reason());
        assertThrows(MissionException.class, () -> dispatcher.dispatch(agv, route("bad id!")));
        assertTrue(transport.published().isEmpty());
    }

    @Test
    void stateReportingOrderAcknowledgesIt() {
        List<MissionOrder> updates = new ArrayList<>();
        dispatcher.addListener(updates::add);
        dispatcher.dispatch(agv, route("ORDER-A"));

        dispatcher.onStateMessage(stateReporting(other, "ORDER-A", 0));
        assertEquals(AckState.PENDING, dispatcher.find("ORDER-A").orElseThrow().ackState(), "other vehicle");

        advance(Duration.ofSeconds(3));
        dispatcher.onStateMessage(stateReporting(agv, "ORDER-A", 0));

        MissionOrder acked = dispatcher.find("ORDER-A").orElseThrow();
        assertEquals(AckState.ACKED, acked.ackState());
        assertEquals(Optional.of(T0.plusSeconds(3)), acked.resolvedAt());
        assertEquals(List.of(AckState.PENDING, AckState.ACKED),
                updates.stream().map(MissionOrder::ackState).toList());

        advance(Duration.ofSeconds(60));
        assertEquals(AckState.ACKED, dispatcher.find("ORDER-A").orElseThrow().ackState(), "deadline after ack is a no-op");
    }

    @Test
    void olderUpdateIdDoesNotAcknowledge() {
        dispatcher.dispatch(agv, route("ORDER-A"));
        dispatcher.onStateMessage(stateReporting(agv, "ORDER-A", 0));
        advance(Duration.ofSeconds(1));
        MissionOrder second = dispatcher.dispatch(agv, route("ORDER-A"));
        assertEquals(1, second.orderUpdateId());

        dispatcher.onStateMessage(stateReporting(agv, "ORDER-A", 0));
        assertEquals(AckState.PENDING, dispatcher.find("ORDER-A").orElseThrow().ackState());

        dispatcher.onStateMessage(stateReporting(agv, "ORDER-A", 1));
        assertEquals(AckState.ACKED, dispatcher.find("ORDER-A").orElseThrow().ackState());
    }

    @Test
    void orderErrorFailsTheReferencedOrder() {
        dispatcher.dispatch(agv, route("ORDER-A"));

        dispatcher.onStateMessage(stateWithError(agv, "batteryLowError", "ORDER-A"));
        assertEquals(AckState.PENDING, dispatcher.find("ORDER-A").orElseThrow().ackState());

        dispatcher.onStateMessage(stateWithError(agv, "noRouteError", "ORDER-A"));
        MissionOrder failed = dispatcher.find("ORDER-A").orElseThrow();
        assertEquals(AckState.FAILED, failed.ackState());
        assertEquals("noRouteError: no route", failed.detail());
    }

    @Test
    void missingAcknowledgementTimesOutExactlyOnce() {
        dispatcher.dispatch(agv, route("ORDER-A"));

        advance(Duration.ofSeconds(29));
        assertEquals(AckState.PENDING, dispatcher.find("ORDER-A").orElseThrow().ackState());

        advance(Duration.ofSeconds(1));
        assertEquals(AckState.TIMEOUT, dispatcher.find("ORDER-A").orElseThrow().ackState());

        advance(Duration.ofMinutes(10));
        assertEquals(1, transport.published().size(), "never re-sent automatically");
        assertEquals(1, Collections.frequency(sink.missionStates("ORDER-A"), AckState.TIMEOUT));

        dispatcher.onStateMessage(stateReporting(agv, "ORDER-A", 0));
        assertEquals(AckState.TIMEOUT, dispatcher.find("ORDER-A").orElseThrow().ackState(), "late ack ignored");
    }

    @Test
    void requireAckedSurfacesOutcomeAsException() {
        dispatcher.dispatch(agv, route("ORDER-A"));
        dispatcher.dispatch(agv, route("ORDER-B"));
        assertEquals(MissionException.Reason.ILLEGAL_STATE,
                assertThrows(MissionException.class, () -> dispatcher.requireAcked("ORDER-A")).reason());

        dispatcher.onStateMessage(stateReporting(agv, "ORDER-B", 0));
        advance(Duration.ofSeconds(30));

        assertEquals(MissionException.Reason.ACK_TIMEOUT,
                assertThrows(MissionException.class, () -> dispatcher.requireAcked("ORDER-A")).reason());
        assertEquals("ORDER-B", dispatcher.requireAcked("ORDER-B").orderId());
        assertEquals(MissionException.Reason.UNKNOWN_ORDER,
                assertThrows(MissionException.class, () -> dispatcher.requireAcked("ORDER-Z")).reason());
    }

    @Test
    void retryResendsWithNextUpdateId() throws Exception {
        dispatcher.dispatch(agv, route("ORDER-A"));
        advance(Duration.ofSeconds(30));

        MissionOrder retried = dispatcher.retry("ORDER-A");

        assertEquals(AckState.PENDING, retried.ackState());
        assertEquals(1, retried.orderUpdateId());
        JsonNode json = mapper.readTree(transport.published().get(1).payload());
        assertEquals(1, json.get("orderUpdateId").asLong());

        advance(Duration.ofSeconds(29));
        assertEquals(AckState.PENDING, dispatcher.find("ORDER-A").orElseThrow().ackState(),
                "first deadline does not expire the retried update");
        dispatcher.onStateMessage(stateReporting(agv, "ORDER-A", 1));
        assertEquals(AckState.ACKED, dispatcher.find("ORDER-A").orElseThrow().ackState());
    }

    @Test
    void retryRequiresTerminalFailure() {
        MissionException unknown = assertThrows(MissionException.class, () -> dispatcher.retry("nope"));
        assertEquals(MissionException.Reason.UNKNOWN_ORDER, unknown.reason());

        dispatcher.dispatch(agv, route("ORDER-A"));
        MissionException pending = assertThrows(MissionException.class, () -> dispatcher.retry("ORDER-A"));
        assertEquals(MissionException.Reason.ILLEGAL_STATE, pending.reason());

        MissionException again = assertThrows(MissionException.class,
                () -> dispatcher.dispatch(agv, route("ORDER-A")));
        assertEquals(MissionException.Reason.ILLEGAL_STATE, again.reason());
    }

    @Test
    void historyEvictsOldestTerminalOrdersOnly() {
        MissionDispatcher small = newDispatcher(2);
        small.dispatch(agv, route("A"));
        advance(Duration.ofSeconds(1));
        small.dispatch(agv, route("B"));
        small.onStateMessage(stateReporting(agv, "B", 0));
        advance(Duration.ofSeconds(1));
        small.dispatch(agv, route("C"));

        assertEquals(List.of("C", "A"), small.history().stream().map(MissionOrder::orderId).toList());
        assertEquals(-1, encoder.updateSequencer().lastAssigned("B"));
        assertTrue(small.find("A").isPresent(), "pending orders are kept");
    }

    @Test
    void cancelSendsCancelOrderInstantAction() throws Exception {
        dispatcher.cancel(agv);

        FakeBrokerTransport.Published p = transport.published().get(0);
        assertEquals("uagv/v2/KUKA/AGV-07/instantActions", p.topic());
        JsonNode action = mapper.readTree(p.payload()).get("actions").get(0);
        assertEquals("cancelOrder", action.get("actionType").asText());
        assertEquals("HARD", action.get("blockingType").asText());
        assertTrue(action.get("actionId").asText().startsWith("cancel-"));
    }

    @Test
    void failingListenerDoesNotBreakDispatch() {
        dispatcher.addListener(o -> {
            throw new IllegalStateException("ui gone");
        });

        assertDoesNotThrow(() -> dispatcher.dispatch(agv, route("ORDER-A")));
        assertTrue(dispatcher.find("ORDER-A").isPresent());
    }
}

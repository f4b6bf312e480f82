package com.questrail.fleet.connection;

import com.questrail.fleet.api.SessionState;
import com.questrail.fleet.credentials.BrokerConfig;
import com.questrail.fleet.observability.FleetErrorEvent;
import com.questrail.fleet.observability.RecordingObservabilitySink;
import com.questrail.fleet.observability.SessionTransitionEvent;
import com.questrail.fleet.time.MutableWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConnectionManagerTest
 * -----------------------------------------------------------------------------
 * Session lifecycle against an in-memory transport. Every operation here
 * completes synchronously except the hung connect, which exercises the
 * connect budget.
 */
class ConnectionManagerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private FakeBrokerTransport transport;
    private RecordingObservabilitySink sink;
    private MutableWallClock clock;
    private ConnectionManager manager;
    private BrokerConfig config;

    @BeforeEach
    void setUp() {
        transport = new FakeBrokerTransport();
        sink = new RecordingObservabilitySink();
        clock = new MutableWallClock(T0);
        manager = new ConnectionManager(transport, Duration.ofMillis(200), Duration.ofMillis(200), clock, sink);
        config = BrokerConfig.defaults()
                .withEndpoint("broker.plant.local", 1883, false)
                .withCredentials("fleet", "secret");
    }

    /** Connect budget long enough that only a cancel can end a hung attempt in time. */
    private ConnectionManager patientManager() {
        return new ConnectionManager(transport, Duration.ofSeconds(10), Duration.ofMillis(200), clock, sink);
    }

    /** Completes with the failure, or with {@code null} when the connect succeeded. */
    static CompletableFuture<ConnectionException> connectInBackground(ConnectionManager m, BrokerConfig c) {
        CompletableFuture<ConnectionException> outcome = new CompletableFuture<>();
        Thread t = new Thread(() -> {
            try {
                m.connect(c);
                outcome.complete(null);
            } catch (ConnectionException e) {
                outcome.complete(e);
            } catch (RuntimeException e) {
                outcome.completeExceptionally(e);
            }
        }, "connect-in-background");
        t.setDaemon(true);
        t.start();
        return outcome;
    }

    private void awaitOpens(int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (transport.openCount() < count) {
            if (System.nanoTime() > deadline) {
                fail("transport was opened " + transport.openCount() + " times, expected " + count);
            }
            Thread.sleep(5);
        }
    }

    @Test
    void connectSubscribesToFleetTopics() {
        manager.connect(config);

        assertEquals(SessionState.CONNECTED, manager.state().get());
        assertEquals(List.of(List.of("uagv/v2/+/+/state", "uagv/v2/+/+/connection", "uagv/v2/+/+/visualization")),
                transport.subscribeCalls());
        ConnectionSession s = manager.session();
        assertEquals(1, s.sessionId());
        assertEquals(Optional.of("mqtt://broker.plant.local:1883"), s.brokerUrl());
        assertEquals(Optional.of(T0), s.connectedAt());
        assertEquals(3, manager.subscriptions().size());
    }

    @Test
    void transitionsAreReportedToSink() {
        manager.connect(config);

        List<SessionTransitionEvent> t = sink.eventsOfType(SessionTransitionEvent.class);
        assertEquals(2, t.size());
        assertEquals(SessionState.DISCONNECTED, t.get(0).from());
        assertEquals(SessionState.CONNECTING, t.get(0).to());
        assertEquals(SessionState.CONNECTED, t.get(1).to());
        assertEquals("connect-succeeded", t.get(1).cause());
        assertEquals(List.of(SessionState.CONNECTING, SessionState.CONNECTED), sink.sessionStates());
    }

    @Test
    void failedOpenLeavesSessionDisconnectedWithKind() {
        transport.failNextOpen(new ConnectionException(ConnectionException.Kind.AUTH, "bad password"));

        ConnectionException e = assertThrows(ConnectionException.class, () -> manager.connect(config));

        assertEquals(ConnectionException.Kind.AUTH, e.kind());
        assertEquals(SessionState.DISCONNECTED, manager.state().get());
        assertTrue(transport.subscribeCalls().isEmpty());
        assertEquals(1, transport.closeCount());
        assertEquals("connect-failed:AUTH",
                sink.eventsOfType(SessionTransitionEvent.class).get(1).cause());
    }

    @Test
    void unclassifiedFailureBecomesNetwork() {
        transport.failNextOpen(new UnknownHostException("nowhere"));

        ConnectionException e = assertThrows(ConnectionException.class, () -> manager.connect(config));
        assertEquals(ConnectionException.Kind.NETWORK, e.kind());
    }

    @Test
    void failedSubscribeClosesTheHalfOpenSession() {
        transport.failSubscribes(new ConnectionException(ConnectionException.Kind.AUTH, "not authorized"));

        assertThrows(ConnectionException.class, () -> manager.connect(config));

        assertEquals(SessionState.DISCONNECTED, manager.state().get());
        assertFalse(transport.isOpen());
    }

    @Test
    void connectTimesOutWhenBrokerNeverAnswers() {
        transport.hangNextOpen();

        ConnectionException e = assertThrows(ConnectionException.class, () -> manager.connect(config));

        assertEquals(ConnectionException.Kind.TIMEOUT, e.kind());
        assertEquals(SessionState.DISCONNECTED, manager.state().get());
    }

    @Test
    void transportThrowingOnOpenLeavesSessionDisconnected() {
        transport.throwFromNextOpen(new IllegalStateException("event loop rejected the channel"));

        ConnectionException e = assertThrows(ConnectionException.class, () -> manager.connect(config));

        assertEquals(ConnectionException.Kind.NETWORK, e.kind());
        assertEquals(SessionState.DISCONNECTED, manager.state().get());
        manager.connect(config);
        assertEquals(SessionState.CONNECTED, manager.state().get());
    }

    @Test
    void cancelPendingConnectAbortsTheAttempt() throws Exception {
        ConnectionManager patient = patientManager();
        transport.hangNextOpen();

        CompletableFuture<ConnectionException> outcome = connectInBackground(patient, config);
        awaitOpens(1);
        patient.cancelPendingConnect();

        ConnectionException e = outcome.get(2, TimeUnit.SECONDS);
        assertNotNull(e, "connect should have failed");
        assertEquals(ConnectionException.Kind.CANCELLED, e.kind());
        assertEquals(SessionState.DISCONNECTED, patient.state().get());
    }

    @Test
    void newConfigurationCancelsConnectInFlight() throws Exception {
        ConnectionManager patient = patientManager();
        BrokerConfig primary = config.withEndpoint("primary.plant.local", 1883, false);
        BrokerConfig standby = config.withEndpoint("standby.plant.local", 1883, false);
        transport.hangNextOpen();

        CompletableFuture<ConnectionException> first = connectInBackground(patient, primary);
        awaitOpens(1);
        long started = System.nanoTime();
        patient.connect(standby);
        long waitedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        ConnectionException e = first.get(2, TimeUnit.SECONDS);
        assertNotNull(e, "first connect should have failed");
        assertEquals(ConnectionException.Kind.CANCELLED, e.kind());
        assertTrue(waitedMillis < 2_000, "waited " + waitedMillis + " ms for the old attempt");
        assertEquals(SessionState.CONNECTED, patient.state().get());
        assertEquals(Optional.of("mqtt://standby.plant.local:1883"), patient.session().brokerUrl());
        assertEquals(Optional.of(standby), patient.lastConfig());
        assertEquals(List.of(primary, standby), transport.openedWith());
    }

    @Test
    void publishRequiresConnectedSession() {
        assertThrows(PublishException.class,
                () -> manager.publish("uagv/v2/KUKA/AGV-07/order", new byte[] {1}));

        manager.connect(config);
        transport.missHeartbeat();
        assertEquals(SessionState.DEGRADED, manager.state().get());
        assertThrows(PublishException.class,
                () -> manager.publish("uagv/v2/KUKA/AGV-07/order", new byte[] {1}));

        transport.restoreHeartbeat();
        manager.publish("uagv/v2/KUKA/AGV-07/order", "{}".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, transport.published().size());
        assertEquals("{}", transport.published().get(0).payloadAsString());
    }

    @Test
    void brokerRejectionSurfacesAsPublishException() {
        manager.connect(config);
        transport.failPublishes(new IllegalStateException("channel closed"));

        PublishException e = assertThrows(PublishException.class,
                () -> manager.publish("uagv/v2/KUKA/AGV-07/order", new byte[] {1}));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void droppedSessionReconnectsAndResubscribes() {
        manager.connect(config);
        transport.drop(new IOException("connection reset"));

        assertEquals(SessionState.DISCONNECTED, manager.state().get());

        manager.reconnect();

        assertEquals(SessionState.CONNECTED, manager.state().get());
        assertEquals(2, transport.openCount());
        assertEquals(2, transport.subscribeCalls().size());
        assertEquals(transport.subscribeCalls().get(0), transport.subscribeCalls().get(1));
        assertEquals(2, manager.session().sessionId());
    }

    @Test
    void reconnectWithoutConfigurationIsRejected() {
        assertThrows(IllegalStateException.class, manager::reconnect);
        assertTrue(manager.lastConfig().isEmpty());
    }

    @Test
    void disconnectUnsubscribesAndIsIdempotent() {
        manager.connect(config);

        manager.disconnect();
        manager.disconnect();

        assertEquals(SessionState.DISCONNECTED, manager.state().get());
        assertEquals(1, transport.unsubscribeCalls().size());
        assertFalse(transport.isOpen());
    }

    @Test
    void inboundMessagesReachListenerOnlyWhileSessionIsLive() {
        List<String> seen = new ArrayList<>();
        manager.setInboundListener((topic, payload) -> seen.add(topic));

        transport.inject("uagv/v2/KUKA/AGV-07/state", "{}");
        manager.connect(config);
        transport.inject("uagv/v2/KUKA/AGV-07/state", "{}");

        assertEquals(List.of("uagv/v2/KUKA/AGV-07/state"), seen);
    }

    @Test
    void failingInboundListenerIsReportedNotPropagated() {
        manager.setInboundListener((topic, payload) -> {
            throw new IllegalStateException("boom");
        });
        manager.connect(config);

        assertDoesNotThrow(() -> transport.inject("uagv/v2/KUKA/AGV-07/state", "{}"));
        assertTrue(sink.hasEventOfType(FleetErrorEvent.class));
    }

    @Test
    void healthCheckIsRecordedInSnapshot() {
        manager.connect(config);
        Instant probe = T0.plusSeconds(30);

        manager.noteHealthCheck(probe, 2);

        assertEquals(Optional.of(probe), manager.session().lastHealthCheckAt());
        assertEquals(2, manager.session().reconnectAttempts());
    }
}

package com.questrail.fleet.connection;

import com.questrail.fleet.api.ObservableValue;
import com.questrail.fleet.api.SessionState;
import com.questrail.fleet.credentials.BrokerConfig;
import com.questrail.fleet.internal.time.WallClock;
import com.questrail.fleet.observability.FleetErrorEvent;
import com.questrail.fleet.observability.FleetObservabilitySink;
import com.questrail.fleet.observability.SessionTransitionEvent;
import com.questrail.fleet.protocol.vda5050.codec.Vda5050TopicCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ConnectionManager
 * =============================================================================
 * Owns the single broker session: connect, subscribe, publish, disconnect.
 *
 * <h2>State</h2>
 * Session state changes only through {@link SessionStateReducer}; the result
 * is published in {@link #state()} for the health monitor and the dashboard.
 *
 * <h2>Timeouts and retries</h2>
 * Every broker operation is bounded: {@code connectTimeout} covers resolve,
 * TLS, authentication and the fleet subscription; {@code publishTimeout}
 * covers one acknowledged publish. This class never retries. A failed connect
 * raises {@link ConnectionException} and leaves the session DISCONNECTED.
 *
 * <h2>Cleanup</h2>
 * Any connect that does not end CONNECTED closes the transport before it
 * returns. {@link #close()} is {@link #disconnect()}, so the manager can be
 * held in try-with-resources.
 *
 * <h2>Cancellation</h2>
 * {@link #cancelPendingConnect()} may be called from any thread and aborts an
 * in-flight connect, which then fails with
 * {@link ConnectionException.Kind#CANCELLED}.
 */
public final class ConnectionManager implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final BrokerTransport transport;
    private final Duration connectTimeout;
    private final Duration publishTimeout;
    private final WallClock clock;
    private final FleetObservabilitySink sink;

    private final SessionStateReducer reducer = new SessionStateReducer();
    private final ObservableValue<SessionState> state = new ObservableValue<>(SessionState.DISCONNECTED);
    private final AtomicReference<ConnectionSession> session = new AtomicReference<>(ConnectionSession.initial());

    // Serializes connect/disconnect. Never held by transport callbacks.
    private final Object lifecycle = new Object();
    // Serializes reducer application.
    private final Object transitions = new Object();

    private volatile CompletableFuture<Void> pendingConnect;
    // Bumped by every connect, cancel and disconnect; an attempt holding an older ticket cancels itself.
    private final AtomicLong lifecycleRequests = new AtomicLong();
    private volatile BrokerConfig lastConfig;
    private volatile InboundMessageListener inbound = (topic, payload) -> {};

    public ConnectionManager(BrokerTransport transport,
                             Duration connectTimeout,
                             Duration publishTimeout,
                             WallClock clock,
                             FleetObservabilitySink sink) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.publishTimeout = Objects.requireNonNull(publishTimeout, "publishTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.transport.setListener(new TransportCallbacks());
    }

    public void setInboundListener(InboundMessageListener listener) {
        this.inbound = Objects.requireNonNull(listener, "listener");
    }

    public ObservableValue<SessionState> state() {
        return state;
    }

    public ConnectionSession session() {
        return session.get();
    }

    /**
     * Topic filters of the current (or last) session. These are re-applied on
     * every connect.
     */
    public Set<String> subscriptions() {
        return session.get().subscriptions();
    }

    public Optional<BrokerConfig> lastConfig() {
        return Optional.ofNullable(lastConfig);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Open a session and subscribe to the fleet topics of
     * {@code config.interfaceName()}. An existing session is closed first and
     * a connect still in flight is cancelled, so a new configuration takes
     * effect without waiting out the old attempt.
     *
     * @throws ConnectionException classified failure; the session is DISCONNECTED
     */
    public void connect(BrokerConfig config) {
        Objects.requireNonNull(config, "config");
        long ticket = supersedePendingConnect();

        synchronized (lifecycle) {
            List<String> filters = new Vda5050TopicCodec(config.interfaceName()).fleetSubscriptions();
            if (state.get() != SessionState.DISCONNECTED) {
                fire(new SessionEvent.DisconnectRequested());
                transport.close();
            }

            lastConfig = config;
            session.updateAndGet(s -> s.withSubscriptions(Set.copyOf(filters)));
            fire(new SessionEvent.ConnectRequested());
            log.info("Connecting to {} as {}", config.brokerUrl(), config.clientId());

            CompletableFuture<Void> attempt;
            try {
                attempt = transport.open(config).thenCompose(v -> transport.subscribe(filters));
            } catch (RuntimeException e) {
                throw failConnect(classify(config, e));
            }
            pendingConnect = attempt;
            // Superseded before pendingConnect was visible.
            if (lifecycleRequests.get() != ticket) {
                attempt.cancel(true);
            }
            try {
                attempt.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw failConnect(new ConnectionException(ConnectionException.Kind.TIMEOUT,
                        "no answer from " + config.brokerUrl() + " within " + connectTimeout, e));
            } catch (CancellationException e) {
                throw failConnect(new ConnectionException(ConnectionException.Kind.CANCELLED,
                        "connect to " + config.brokerUrl() + " cancelled", e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw failConnect(new ConnectionException(ConnectionException.Kind.CANCELLED,
                        "connect to " + config.brokerUrl() + " interrupted", e));
            } catch (ExecutionException e) {
                throw failConnect(classify(config, e.getCause()));
            } finally {
                pendingConnect = null;
            }

            session.updateAndGet(s -> s.established(config.brokerUrl(), clock.now()));
            fire(new SessionEvent.ConnectSucceeded());
            if (state.get() != SessionState.CONNECTED) {
                transport.close();
                throw new ConnectionException(ConnectionException.Kind.NETWORK,
                        "session to " + config.brokerUrl() + " dropped while connecting");
            }
            log.info("Connected to {}, subscribed to {}", config.brokerUrl(), filters);
        }
    }

    /**
     * Connect again with the most recent configuration.
     *
     * @throws IllegalStateException if {@link #connect(BrokerConfig)} was never called
     */
    public void reconnect() {
        BrokerConfig config = lastConfig;
        if (config == null) {
            throw new IllegalStateException("no broker configuration to reconnect with");
        }
        connect(config);
    }

    /**
     * Abort an in-flight connect, if any; it fails with
     * {@link ConnectionException.Kind#CANCELLED}. Safe from any thread.
     */
    public void cancelPendingConnect() {
        supersedePendingConnect();
    }

    private long supersedePendingConnect() {
        long ticket = lifecycleRequests.incrementAndGet();
        CompletableFuture<Void> attempt = pendingConnect;
        if (attempt != null) {
            attempt.cancel(true);
        }
        return ticket;
    }

    /**
     * Unsubscribe and release the session. Idempotent.
     */
    public void disconnect() {
        cancelPendingConnect();
        synchronized (lifecycle) {
            SessionState current = state.get();
            if (current == SessionState.CONNECTED || current == SessionState.DEGRADED) {
                List<String> filters = List.copyOf(subscriptions());
                try {
                    transport.unsubscribe(filters).get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while unsubscribing; closing session anyway");
                } catch (ExecutionException | TimeoutException e) {
                    log.warn("Unsubscribe failed; closing session anyway: {}", e.toString());
                }
            }
            fire(new SessionEvent.DisconnectRequested());
            transport.close();
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    // ---------------------------------------------------------------------
    // Publishing
    // ---------------------------------------------------------------------

    /**
     * Publish and wait for the broker's acknowledgement, at most
     * {@code publishTimeout}.
     *
     * @throws PublishException if the session is not CONNECTED or the broker
     *                          did not acknowledge in time
     */
    public void publish(String topic, byte[] payload) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");

        SessionState current = state.get();
        if (!current.acceptsPublish()) {
            throw new PublishException("cannot publish to " + topic + ": session is " + current);
        }
        try {
            transport.publish(topic, payload).get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new PublishException("broker did not acknowledge " + topic + " within " + publishTimeout, e);
        } catch (ExecutionException e) {
            throw new PublishException("publish to " + topic + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("interrupted while publishing to " + topic, e);
        }
    }

    /**
     * Record the outcome of a health probe in the session snapshot.
     */
    public void noteHealthCheck(Instant at, int reconnectAttempts) {
        Objects.requireNonNull(at, "at");
        session.updateAndGet(s -> s.withHealthCheck(at, reconnectAttempts));
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private ConnectionException failConnect(ConnectionException failure) {
        fire(new SessionEvent.ConnectFailed(failure.kind()));
        transport.close();
        log.warn("Connect failed ({}): {}", failure.kind(), failure.getMessage());
        return failure;
    }

    private static ConnectionException classify(BrokerConfig config, Throwable cause) {
        Throwable c = cause;
        while (c instanceof CompletionException && c.getCause() != null) {
            c = c.getCause();
        }
        if (c instanceof ConnectionException ce) {
            return ce;
        }
        if (c instanceof CancellationException) {
            return new ConnectionException(ConnectionException.Kind.CANCELLED,
                    "connect to " + config.brokerUrl() + " cancelled", c);
        }
        return new ConnectionException(ConnectionException.Kind.NETWORK,
                "connect to " + config.brokerUrl() + " failed: " + c, c);
    }

    private void fire(SessionEvent event) {
        synchronized (transitions) {
            SessionState previous = state.get();
            SessionStateReducer.Result result = reducer.apply(previous, event);
            if (!result.changed(previous)) {
                return;
            }
            session.updateAndGet(s -> s.withState(result.newState()));
            state.set(result.newState());
            sink.onSessionTransition(new SessionTransitionEvent(clock.now(), previous, result.newState(), result.cause()));
        }
    }

    private final class TransportCallbacks implements BrokerTransportListener
    {
        @Override
        public void onMessage(String topic, byte[] payload) {
            if (state.get() == SessionState.DISCONNECTED) {
                return;
            }
            try {
                inbound.onMessage(topic, payload);
            } catch (RuntimeException e) {
                log.error("Inbound handler failed for {}", topic, e);
                sink.onError(new FleetErrorEvent(clock.now(), "inbound handler failed for " + topic, e));
            }
        }

        @Override
        public void onHeartbeatMissed() {
            fire(new SessionEvent.HeartbeatMissed());
        }

        @Override
        public void onHeartbeatRestored() {
            fire(new SessionEvent.HeartbeatRestored());
        }

        @Override
        public void onTransportDown(Throwable cause) {
            String label = cause == null ? "closed-by-broker" : cause.getClass().getSimpleName();
            SessionState before = state.get();
            fire(new SessionEvent.TransportLost(label));
            if (before != SessionState.DISCONNECTED && before != SessionState.CONNECTING) {
                log.warn("Broker session lost: {}", cause == null ? label : cause.toString());
            }
        }
    }
}

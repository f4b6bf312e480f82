package com.questrail.fleet.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fleet.api.HealthStatus;
import com.questrail.fleet.api.ObservableValue;
import com.questrail.fleet.api.SessionState;
import com.questrail.fleet.config.FleetConfiguration;
import com.questrail.fleet.config.FleetSettings;
import com.questrail.fleet.connection.BrokerTransport;
import com.questrail.fleet.connection.ConnectionException;
import com.questrail.fleet.connection.ConnectionManager;
import com.questrail.fleet.connection.netty.NettyMqttBrokerTransport;
import com.questrail.fleet.credentials.BrokerConfig;
import com.questrail.fleet.health.BackoffPolicy;
import com.questrail.fleet.health.HealthMonitor;
import com.questrail.fleet.health.HealthPolicy;
import com.questrail.fleet.internal.time.MonotonicClock;
import com.questrail.fleet.internal.time.MonotonicScheduler;
import com.questrail.fleet.internal.time.ScheduledExecutorScheduler;
import com.questrail.fleet.internal.time.SystemMonotonicClock;
import com.questrail.fleet.internal.time.SystemWallClock;
import com.questrail.fleet.internal.time.WallClock;
import com.questrail.fleet.mission.MissionDispatcher;
import com.questrail.fleet.mission.MissionPlanner;
import com.questrail.fleet.mission.OrderIdGenerator;
import com.questrail.fleet.observability.FleetErrorEvent;
import com.questrail.fleet.observability.FleetObservabilitySink;
import com.questrail.fleet.observability.NullFleetObservabilitySink;
import com.questrail.fleet.pipeline.InboundPipeline;
import com.questrail.fleet.protocol.vda5050.codec.HeaderSequenceGuard;
import com.questrail.fleet.protocol.vda5050.codec.OrderUpdateSequencer;
import com.questrail.fleet.protocol.vda5050.codec.Vda5050MessageDecoder;
import com.questrail.fleet.protocol.vda5050.codec.Vda5050MessageEncoder;
import com.questrail.fleet.protocol.vda5050.codec.Vda5050TopicCodec;
import com.questrail.fleet.protocol.vda5050.model.StateMessage;
import com.questrail.fleet.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * FleetLinkRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one fleet link: broker session,
 * decode pipeline, telemetry cache, health monitor and mission dispatcher.
 *
 * <p>Wiring:</p>
 * <pre>
 *   BrokerTransport -&gt; ConnectionManager -&gt; InboundPipeline -&gt; TelemetryStore
 *                                                           \-&gt; MissionDispatcher (acks)
 *   HealthMonitor   -&gt; ConnectionManager (reconnect), TelemetryStore (liveness)
 * </pre>
 *
 * <p>A runtime is started once and stopped once. Executors it created itself
 * are shut down by {@link #stop()}; injected ones are left to their owner.</p>
 */
public final class FleetLinkRuntime implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(FleetLinkRuntime.class);

    private final FleetConfiguration configuration;
    private final BrokerTransport transport;
    private final ConnectionManager connection;
    private final InboundPipeline pipeline;
    private final TelemetryStore telemetry;
    private final HealthMonitor health;
    private final MissionDispatcher missions;
    private final MissionPlanner planner;
    private final FleetObservabilitySink sink;
    private final WallClock wallClock;
    private final ScheduledExecutorService ownedScheduler;
    private final ExecutorService ownedReconnectExecutor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private FleetLinkRuntime(Builder b,
                             BrokerTransport transport,
                             ConnectionManager connection,
                             InboundPipeline pipeline,
                             TelemetryStore telemetry,
                             HealthMonitor health,
                             MissionDispatcher missions,
                             MissionPlanner planner,
                             ScheduledExecutorService ownedScheduler,
                             ExecutorService ownedReconnectExecutor) {
        this.configuration = b.configuration;
        this.sink = b.sink;
        this.wallClock = b.wallClock;
        this.transport = transport;
        this.connection = connection;
        this.pipeline = pipeline;
        this.telemetry = telemetry;
        this.health = health;
        this.missions = missions;
        this.planner = planner;
        this.ownedScheduler = ownedScheduler;
        this.ownedReconnectExecutor = ownedReconnectExecutor;
    }

    /**
     * Start health probing and open the broker session.
     *
     * <p>A failed first connect is not fatal: it is reported and the health
     * monitor retries with backoff, exactly as after a dropped session.</p>
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("runtime already stopped");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        health.start();
        try {
            connection.connect(configuration.broker());
        } catch (ConnectionException e) {
            log.warn("Initial connect to {} failed ({}): {}",
                    configuration.broker().brokerUrl(), e.kind(), e.getMessage());
            sink.onError(new FleetErrorEvent(wallClock.now(), "initial connect failed", e));
        }
    }

    /**
     * Switch the link to another broker. A connect still in flight is
     * cancelled, and later reconnects by the health monitor use
     * {@code broker}.
     *
     * <p>The VDA5050 interface name is fixed for the life of the runtime
     * because the codecs are built from it.</p>
     *
     * @throws ConnectionException if the new broker cannot be reached; the
     *         health monitor keeps retrying it
     * @throws IllegalArgumentException if {@code broker} names another interface
     */
    public void reconfigure(BrokerConfig broker) {
        Objects.requireNonNull(broker, "broker");
        if (!started.get() || stopped.get()) {
            throw new IllegalStateException("runtime is not running");
        }
        String current = configuration.broker().interfaceName();
        if (!current.equals(broker.interfaceName())) {
            throw new IllegalArgumentException("interfaceName is fixed at '" + current
                    + "', cannot switch to '" + broker.interfaceName() + "'");
        }
        log.info("Reconfiguring fleet link to {}", broker.brokerUrl());
        connection.connect(broker);
    }

    /**
     * Stop probing, close the session and release owned threads. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        health.stop();
        connection.close();
        transport.shutdown();
        shutdown(ownedReconnectExecutor);
        shutdown(ownedScheduler);
        log.info("Fleet link runtime stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private static void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public FleetConfiguration configuration() {
        return configuration;
    }

    public ObservableValue<SessionState> sessionState() {
        return connection.state();
    }

    public ObservableValue<HealthStatus> healthStatus() {
        return health.status();
    }

    public ConnectionManager connection() {
        return connection;
    }

    public InboundPipeline pipeline() {
        return pipeline;
    }

    public TelemetryStore telemetry() {
        return telemetry;
    }

    public HealthMonitor health() {
        return health;
    }

    public MissionDispatcher missions() {
        return missions;
    }

    public MissionPlanner planner() {
        return planner;
    }

    public static Builder builder(FleetConfiguration configuration) {
        return new Builder(configuration);
    }

    public static final class Builder {
        private final FleetConfiguration configuration;
        private BrokerTransport transport;
        private FleetObservabilitySink sink = NullFleetObservabilitySink.INSTANCE;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private Executor reconnectExecutor;
        private ObjectMapper mapper = new ObjectMapper();
        private ZoneId zone = ZoneId.systemDefault();
        private String mapId = "default";

        private Builder(FleetConfiguration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
        }

        /** Defaults to the Netty MQTT transport. */
        public Builder withTransport(BrokerTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder withObservabilitySink(FleetObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withClocks(MonotonicClock clock, WallClock wallClock) {
            this.clock = clock;
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Scheduler for probes and ack deadlines. Must run on the clock given
         * to {@link #withClocks}. Defaults to a single-threaded executor owned
         * by the runtime.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /** Where reconnect attempts block. Defaults to a runtime-owned thread. */
        public Builder withReconnectExecutor(Executor executor) {
            this.reconnectExecutor = executor;
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        /** Time zone of generated order ids. */
        public Builder withZone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        /** Map id stamped on planned node positions. */
        public Builder withMapId(String mapId) {
            this.mapId = mapId;
            return this;
        }

        public FleetLinkRuntime build() {
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(mapper, "mapper");
            FleetSettings settings = configuration.settings();

            // 1. Threads
            ScheduledExecutorService ownedScheduler = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedScheduler = Executors.newSingleThreadScheduledExecutor(daemon("fleet-link-scheduler"));
                effectiveScheduler = new ScheduledExecutorScheduler(ownedScheduler, clock);
            }
            ExecutorService ownedReconnect = null;
            Executor effectiveReconnect = reconnectExecutor;
            if (effectiveReconnect == null) {
                ownedReconnect = Executors.newSingleThreadExecutor(daemon("fleet-link-reconnect"));
                effectiveReconnect = ownedReconnect;
            }

            // 2. Transport and session
            BrokerTransport effectiveTransport = transport != null
                    ? transport
                    : new NettyMqttBrokerTransport(settings.connectTimeout());
            ConnectionManager connection = new ConnectionManager(effectiveTransport,
                    settings.connectTimeout(), settings.publishTimeout(), wallClock, sink);

            // 3. Codec
            Vda5050TopicCodec topics = new Vda5050TopicCodec(configuration.broker().interfaceName());
            Vda5050MessageDecoder decoder = new Vda5050MessageDecoder(mapper, topics);
            Vda5050MessageEncoder encoder = new Vda5050MessageEncoder(mapper, topics, wallClock,
                    settings.protocolVersion(), new OrderUpdateSequencer());

            // 4. Inbound path
            TelemetryStore telemetry = new TelemetryStore(settings.telemetryWindowSize(),
                    settings.staleAfter(), settings.offlineAfter());
            InboundPipeline pipeline = new InboundPipeline(decoder, new HeaderSequenceGuard(),
                    telemetry, clock, wallClock, sink);
            connection.setInboundListener(pipeline);

            // 5. Missions; acks arrive through the pipeline
            MissionDispatcher missions = new MissionDispatcher(connection, encoder,
                    new OrderIdGenerator(settings.orderIdPrefix(), wallClock, zone),
                    settings.ackTimeout(), settings.missionHistoryLimit(),
                    clock, effectiveScheduler, wallClock, sink);
            pipeline.addListener(message -> {
                if (message instanceof StateMessage state) {
                    missions.onStateMessage(state);
                }
            });
            MissionPlanner planner = new MissionPlanner(settings.maxNodesPerMission(), mapId);

            // 6. Health
            HealthMonitor health = new HealthMonitor(connection, telemetry,
                    HealthPolicy.from(settings), BackoffPolicy.from(settings),
                    clock, effectiveScheduler, effectiveReconnect, wallClock, sink);

            return new FleetLinkRuntime(this, effectiveTransport, connection, pipeline, telemetry,
                    health, missions, planner, ownedScheduler, ownedReconnect);
        }

        private static ThreadFactory daemon(String name) {
            return r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            };
        }
    }
}

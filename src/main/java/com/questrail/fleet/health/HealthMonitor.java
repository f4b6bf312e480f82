package com.questrail.fleet.health;

import com.questrail.fleet.api.HealthStatus;
import com.questrail.fleet.api.ObservableValue;
import com.questrail.fleet.api.SessionState;
import com.questrail.fleet.connection.ConnectionException;
import com.questrail.fleet.connection.ConnectionManager;
import com.questrail.fleet.internal.time.Cancellable;
import com.questrail.fleet.internal.time.MonotonicClock;
import com.questrail.fleet.internal.time.MonotonicScheduler;
import com.questrail.fleet.internal.time.WallClock;
import com.questrail.fleet.observability.FleetErrorEvent;
import com.questrail.fleet.observability.FleetObservabilitySink;
import com.questrail.fleet.observability.HealthStatusEvent;
import com.questrail.fleet.telemetry.AgvRecord;
import com.questrail.fleet.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HealthMonitor
 * =============================================================================
 * Periodic liveness probe that owns the reconnect policy.
 *
 * <h2>Probe</h2>
 * Every {@code probeInterval} the monitor:
 * <ol>
 *   <li>demotes silent vehicles in the {@link TelemetryStore};</li>
 *   <li>reads the session state:
 *     <ul>
 *       <li>DISCONNECTED after a session was requested: start reconnecting
 *           at once;</li>
 *       <li>DEGRADED: count a missed probe; at {@code missedProbeThreshold}
 *           consecutive misses force a reconnect;</li>
 *       <li>CONNECTED: HEALTHY, or DEGRADED while the whole fleet has been
 *           silent longer than {@code telemetrySilence}.</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <h2>Reconnect</h2>
 * Attempts are spaced by {@link BackoffPolicy}. At most one reconnect cycle
 * runs at a time. When the attempt budget is spent the status becomes
 * {@link HealthStatus#FAILED} and stays there until
 * {@link #manualReconnect()}: the monitor never retries forever behind the
 * operator's back.
 *
 * <h2>Threading</h2>
 * Probes run on the scheduler; connect attempts run on
 * {@code reconnectExecutor} so a slow broker never delays the probe. Shared
 * state is a handful of atomics; no lock is shared with the decode path.
 */
public final class HealthMonitor
{
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ConnectionManager connection;
    private final TelemetryStore telemetry;
    private final HealthPolicy policy;
    private final BackoffPolicy backoff;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Executor reconnectExecutor;
    private final WallClock wallClock;
    private final FleetObservabilitySink sink;

    private final ObservableValue<HealthStatus> status = new ObservableValue<>(HealthStatus.HEALTHY);
    private final ReconnectAttemptTracker attempts = new ReconnectAttemptTracker();
    private final AtomicInteger missedProbes = new AtomicInteger();
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong lastSessionUpNanos = new AtomicLong();

    private volatile Cancellable nextProbe;
    private volatile Cancellable nextAttempt;
    private volatile long nextProbeDeadline;

    public HealthMonitor(ConnectionManager connection,
                         TelemetryStore telemetry,
                         HealthPolicy policy,
                         BackoffPolicy backoff,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         Executor reconnectExecutor,
                         WallClock wallClock,
                         FleetObservabilitySink sink)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.reconnectExecutor = Objects.requireNonNull(reconnectExecutor, "reconnectExecutor");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");

        connection.state().subscribe(s -> {
            if (s == SessionState.CONNECTED) {
                lastSessionUpNanos.set(clock.nowNanos());
            }
        });
    }

    public ObservableValue<HealthStatus> status() {
        return status;
    }

    public int reconnectAttempts() {
        return attempts.attempts();
    }

    /**
     * Start probing. Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            lastSessionUpNanos.set(clock.nowNanos());
            nextProbeDeadline = clock.nowNanos() + policy.probeInterval().toNanos();
            nextProbe = scheduler.scheduleAtNanos(nextProbeDeadline, this::probe);
            log.info("Health monitor started, probing every {}", policy.probeInterval());
        }
    }

    /**
     * Stop probing and abandon any reconnect in progress, including an
     * in-flight connect. Idempotent.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            cancel(nextProbe);
            cancel(nextAttempt);
            connection.cancelPendingConnect();
            reconnecting.set(false);
            log.info("Health monitor stopped");
        }
    }

    /**
     * Operator-initiated reconnect, the only way out of FAILED. Starts a fresh
     * attempt budget with an immediate first attempt.
     *
     * @return {@code false} if a reconnect cycle is already running
     */
    public boolean manualReconnect() {
        if (!reconnecting.compareAndSet(false, true)) {
            return false;
        }
        attempts.reset();
        missedProbes.set(0);
        transition(HealthStatus.RECONNECTING, "manual reconnect");
        reconnectExecutor.execute(() -> attempt(1));
        return true;
    }

    // ---------------------------------------------------------------------
    // Probe
    // ---------------------------------------------------------------------

    void probe() {
        if (!running.get()) {
            return;
        }
        nextProbeDeadline += policy.probeInterval().toNanos();
        nextProbe = scheduler.scheduleAtNanos(nextProbeDeadline, this::probe);

        long now = clock.nowNanos();
        List<AgvRecord> demoted = telemetry.evictStale(now);
        for (AgvRecord r : demoted) {
            log.info("Vehicle {} is now {}", r.vehicle(), r.connectionState());
        }

        try {
            evaluate(now);
        } finally {
            connection.noteHealthCheck(wallClock.now(), attempts.attempts());
        }
    }

    private void evaluate(long now) {
        if (reconnecting.get() || status.get() == HealthStatus.FAILED) {
            return;
        }

        SessionState session = connection.state().get();
        switch (session) {
            case DISCONNECTED -> {
                if (connection.lastConfig().isPresent()) {
                    beginReconnect("session lost");
                }
            }
            case CONNECTING -> { }
            case DEGRADED -> {
                int missed = missedProbes.incrementAndGet();
                transition(HealthStatus.DEGRADED, "heartbeat missed (" + missed + "/" + policy.missedProbeThreshold() + ")");
                if (missed >= policy.missedProbeThreshold()) {
                    beginReconnect(missed + " consecutive missed probes");
                }
            }
            case CONNECTED -> {
                missedProbes.set(0);
                if (fleetSilent(now)) {
                    transition(HealthStatus.DEGRADED, "no telemetry for " + policy.telemetrySilence());
                } else {
                    transition(HealthStatus.HEALTHY, "session connected");
                }
            }
        }
    }

    private boolean fleetSilent(long now) {
        OptionalLong last = telemetry.lastArrivalNanos();
        if (last.isEmpty()) {
            return false;
        }
        long reference = Math.max(last.getAsLong(), lastSessionUpNanos.get());
        return now - reference > policy.telemetrySilence().toNanos();
    }

    // ---------------------------------------------------------------------
    // Reconnect cycle
    // ---------------------------------------------------------------------

    private void beginReconnect(String reason) {
        if (!reconnecting.compareAndSet(false, true)) {
            return;
        }
        attempts.reset();
        missedProbes.set(0);
        log.warn("Reconnecting: {}", reason);
        transition(HealthStatus.RECONNECTING, reason);
        scheduleAttempt(1);
    }

    private void scheduleAttempt(int attempt) {
        nextAttempt = scheduler.scheduleAfter(backoff.delayBefore(attempt), clock,
                () -> reconnectExecutor.execute(() -> attempt(attempt)));
    }

    private void attempt(int attempt) {
        if (!running.get() || !reconnecting.get()) {
            return;
        }
        attempts.recordAttempt();
        try {
            connection.reconnect();
            reconnecting.set(false);
            attempts.reset();
            missedProbes.set(0);
            transition(HealthStatus.HEALTHY, "reconnected on attempt " + attempt);
        } catch (ConnectionException e) {
            if (e.kind() == ConnectionException.Kind.CANCELLED && !running.get()) {
                return;
            }
            log.warn("Reconnect attempt {}/{} failed ({}): {}",
                    attempt, backoff.maxAttempts(), e.kind(), e.getMessage());
            if (backoff.exhausted(attempt)) {
                giveUp("reconnect attempts exhausted, last failure " + e.kind(), e);
            } else {
                scheduleAttempt(attempt + 1);
            }
        } catch (IllegalStateException e) {
            giveUp("no broker configuration to reconnect with", e);
        } catch (RuntimeException e) {
            log.error("Reconnect attempt {} failed unexpectedly", attempt, e);
            giveUp("reconnect attempt failed: " + e, e);
        }
    }

    private void giveUp(String detail, Exception cause) {
        reconnecting.set(false);
        transition(HealthStatus.FAILED, detail);
        sink.onError(new FleetErrorEvent(wallClock.now(), "fleet link FAILED: " + detail, cause));
    }

    private void transition(HealthStatus next, String detail) {
        HealthStatus previous = status.set(next);
        if (previous != next) {
            sink.onHealthStatus(new HealthStatusEvent(wallClock.now(), previous, next, attempts.attempts(), detail));
        }
    }

    private static void cancel(Cancellable c) {
        if (c != null) {
            c.cancel();
        }
    }
}

package com.questrail.fleet.telemetry;

import com.questrail.fleet.api.VehicleConnectionState;
import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.protocol.vda5050.model.SequencedMessage;
import com.questrail.fleet.protocol.vda5050.model.Vda5050Topic;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TelemetryStore
 * =============================================================================
 * Per-vehicle cache of the latest decoded state plus capped recent-event
 * windows.
 *
 * <h2>Concurrency contract</h2>
 * <ul>
 *   <li>The decode pipeline is the single writer of message content
 *       ({@link #upsert}, {@link #appendEvent}).</li>
 *   <li>The health timer demotes liveness through {@link #evictStale}; both
 *       writers go through per-key atomic {@code compute} so neither can lose
 *       the other's update.</li>
 *   <li>Readers never lock. Every record and every window snapshot is
 *       immutable, so a read always observes a complete record.</li>
 * </ul>
 *
 * <h2>Retention</h2>
 * Records are never removed. A vehicle that goes silent is demoted to
 * {@link VehicleConnectionState#STALE} and later
 * {@link VehicleConnectionState#OFFLINE}; mission history may still refer
 * to it.
 */
public final class TelemetryStore
{
    private record WindowKey(VehicleId vehicle, Vda5050Topic topic) {}

    private final int windowSize;
    private final long staleAfterNanos;
    private final long offlineAfterNanos;

    private final ConcurrentMap<VehicleId, AgvRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentMap<WindowKey, TelemetryWindow<TelemetryEvent>> windows = new ConcurrentHashMap<>();
    private final AtomicLong lastArrivalNanos = new AtomicLong(Long.MIN_VALUE);

    public TelemetryStore(int windowSize, Duration staleAfter, Duration offlineAfter) {
        Objects.requireNonNull(staleAfter, "staleAfter");
        Objects.requireNonNull(offlineAfter, "offlineAfter");
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0");
        }
        if (staleAfter.isNegative() || offlineAfter.compareTo(staleAfter) < 0) {
            throw new IllegalArgumentException("require 0 <= staleAfter <= offlineAfter");
        }
        this.windowSize = windowSize;
        this.staleAfterNanos = staleAfter.toNanos();
        this.offlineAfterNanos = offlineAfter.toNanos();
    }

    // ---------------------------------------------------------------------
    // Writer path
    // ---------------------------------------------------------------------

    /**
     * Fold an accepted message into the vehicle's record, creating it on first
     * sight, and stamp it with the arrival time.
     *
     * @return the record now stored
     */
    public AgvRecord upsert(SequencedMessage message, Instant arrivedAt, long arrivedNanos) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(arrivedAt, "arrivedAt");
        AgvRecord next = records.compute(message.vehicle(),
                (id, previous) -> AgvRecord.apply(previous, message, arrivedAt, arrivedNanos));
        lastArrivalNanos.accumulateAndGet(arrivedNanos, Math::max);
        return next;
    }

    /**
     * Push an event into the window for its vehicle and topic, dropping the
     * oldest entry once the window is full.
     */
    public void appendEvent(VehicleId vehicle, TelemetryEvent event) {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(event, "event");
        windows.computeIfAbsent(new WindowKey(vehicle, event.topic()), k -> new TelemetryWindow<>(windowSize))
                .append(event);
    }

    /**
     * Demote silent vehicles: STALE past the idle threshold, OFFLINE past the
     * offline threshold. Never promotes and never removes.
     *
     * @return records whose liveness changed, in vehicle order
     */
    public List<AgvRecord> evictStale(long nowNanos) {
        List<AgvRecord> changed = new ArrayList<>();
        for (VehicleId id : records.keySet()) {
            records.computeIfPresent(id, (k, current) -> {
                VehicleConnectionState target = livenessAt(current, nowNanos);
                if (target.compareTo(current.connectionState()) <= 0) {
                    return current;
                }
                AgvRecord demoted = current.withConnectionState(target);
                changed.add(demoted);
                return demoted;
            });
        }
        changed.sort(Comparator.comparing(AgvRecord::vehicle));
        return changed;
    }

    private VehicleConnectionState livenessAt(AgvRecord record, long nowNanos) {
        long age = nowNanos - record.lastSeenNanos();
        if (age > offlineAfterNanos) {
            return VehicleConnectionState.OFFLINE;
        }
        if (age > staleAfterNanos) {
            return VehicleConnectionState.STALE;
        }
        return VehicleConnectionState.ONLINE;
    }

    // ---------------------------------------------------------------------
    // Lock-free reads
    // ---------------------------------------------------------------------

    public Optional<AgvRecord> get(VehicleId vehicle) {
        return Optional.ofNullable(records.get(vehicle));
    }

    /**
     * All records, sorted by vehicle id.
     */
    public List<AgvRecord> snapshot() {
        List<AgvRecord> all = new ArrayList<>(records.values());
        all.sort(Comparator.comparing(AgvRecord::vehicle));
        return List.copyOf(all);
    }

    public List<TelemetryEvent> recentEvents(VehicleId vehicle, Vda5050Topic topic) {
        TelemetryWindow<TelemetryEvent> window = windows.get(new WindowKey(vehicle, topic));
        return window == null ? List.of() : window.snapshot();
    }

    public long countByState(VehicleConnectionState state) {
        return records.values().stream().filter(r -> r.connectionState() == state).count();
    }

    /**
     * Monotonic arrival time of the newest message from any vehicle, if any
     * message was ever accepted. Used as the fleet-wide freshness index.
     */
    public OptionalLong lastArrivalNanos() {
        long last = lastArrivalNanos.get();
        return last == Long.MIN_VALUE ? OptionalLong.empty() : OptionalLong.of(last);
    }

    public int windowSize() {
        return windowSize;
    }
}

package com.questrail.fleet.config;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * FleetSettings
 * -----------------------------------------------------------------------------
 * Tunable thresholds of the fleet link.
 *
 * <p>These are operational values only: probe cadence, backoff spacing,
 * liveness thresholds, buffer sizes and timeouts. The numbers in
 * {@link #defaults()} are starting points and every one of them can be
 * overridden from the settings file.</p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>healthProbeInterval</b> fixed period of the health probe.</li>
 *   <li><b>missedProbeThreshold</b> consecutive failed probes that force a reconnect.</li>
 *   <li><b>backoffBase / backoffMax / maxReconnectAttempts</b> exponential
 *       reconnect spacing and the attempt budget before FAILED.</li>
 *   <li><b>staleAfter / offlineAfter</b> vehicle silence thresholds.</li>
 *   <li><b>telemetryWindowSize</b> events kept per vehicle and topic.</li>
 *   <li><b>ackTimeout</b> how long a dispatched order may stay PENDING.</li>
 *   <li><b>connectTimeout / publishTimeout</b> broker I/O budgets.</li>
 *   <li><b>idleTeardown</b> how long the session outlives its last client.</li>
 *   <li><b>missionHistoryLimit</b> orders remembered before terminal ones are evicted.</li>
 *   <li><b>maxNodesPerMission</b> advisory route length limit.</li>
 *   <li><b>orderIdPrefix / protocolVersion</b> outbound identity.</li>
 * </ul>
 */
public record FleetSettings(
        Duration healthProbeInterval,
        int missedProbeThreshold,
        Duration backoffBase,
        Duration backoffMax,
        int maxReconnectAttempts,
        Duration staleAfter,
        Duration offlineAfter,
        int telemetryWindowSize,
        Duration ackTimeout,
        Duration connectTimeout,
        Duration publishTimeout,
        Duration idleTeardown,
        int missionHistoryLimit,
        int maxNodesPerMission,
        String orderIdPrefix,
        String protocolVersion
) {
    private static final Pattern PREFIX = Pattern.compile("[A-Za-z0-9_]+");

    public FleetSettings {
        requirePositive(healthProbeInterval, "healthProbeInterval");
        requirePositive(backoffBase, "backoffBase");
        requirePositive(backoffMax, "backoffMax");
        requirePositive(staleAfter, "staleAfter");
        requirePositive(offlineAfter, "offlineAfter");
        requirePositive(ackTimeout, "ackTimeout");
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(publishTimeout, "publishTimeout");
        Objects.requireNonNull(idleTeardown, "idleTeardown");
        Objects.requireNonNull(orderIdPrefix, "orderIdPrefix");
        Objects.requireNonNull(protocolVersion, "protocolVersion");

        if (idleTeardown.isNegative()) {
            throw new IllegalArgumentException("idleTeardown must be non-negative");
        }
        if (missedProbeThreshold < 1) {
            throw new IllegalArgumentException("missedProbeThreshold must be >= 1");
        }
        if (maxReconnectAttempts < 1) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 1");
        }
        if (backoffMax.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException("backoffMax must be >= backoffBase");
        }
        if (offlineAfter.compareTo(staleAfter) < 0) {
            throw new IllegalArgumentException("offlineAfter must be >= staleAfter");
        }
        if (telemetryWindowSize < 1) {
            throw new IllegalArgumentException("telemetryWindowSize must be >= 1");
        }
        if (missionHistoryLimit < 1) {
            throw new IllegalArgumentException("missionHistoryLimit must be >= 1");
        }
        if (maxNodesPerMission < 2) {
            throw new IllegalArgumentException("maxNodesPerMission must be >= 2");
        }
        if (!PREFIX.matcher(orderIdPrefix).matches()) {
            throw new IllegalArgumentException("orderIdPrefix must match " + PREFIX.pattern());
        }
        if (protocolVersion.isBlank()) {
            throw new IllegalArgumentException("protocolVersion must not be blank");
        }
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>health probe every 30s, 3 missed probes force a reconnect</li>
     *   <li>backoff 2s doubling up to 60s, 5 attempts</li>
     *   <li>STALE after 60s, OFFLINE after 120s</li>
     *   <li>100 events per window</li>
     *   <li>ack timeout 30s, connect 10s, publish 5s</li>
     *   <li>idle teardown 5 minutes</li>
     *   <li>500 orders of history, 100 nodes per mission</li>
     *   <li>order prefix {@code ORDER}, protocol {@code 2.0.0}</li>
     * </ul>
     */
    public static FleetSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .healthProbeInterval(healthProbeInterval)
                .missedProbeThreshold(missedProbeThreshold)
                .backoffBase(backoffBase)
                .backoffMax(backoffMax)
                .maxReconnectAttempts(maxReconnectAttempts)
                .staleAfter(staleAfter)
                .offlineAfter(offlineAfter)
                .telemetryWindowSize(telemetryWindowSize)
                .ackTimeout(ackTimeout)
                .connectTimeout(connectTimeout)
                .publishTimeout(publishTimeout)
                .idleTeardown(idleTeardown)
                .missionHistoryLimit(missionHistoryLimit)
                .maxNodesPerMission(maxNodesPerMission)
                .orderIdPrefix(orderIdPrefix)
                .protocolVersion(protocolVersion);
    }

    public static final class Builder {
        private Duration healthProbeInterval = Duration.ofSeconds(30);
        private int missedProbeThreshold = 3;
        private Duration backoffBase = Duration.ofSeconds(2);
        private Duration backoffMax = Duration.ofSeconds(60);
        private int maxReconnectAttempts = 5;
        private Duration staleAfter = Duration.ofSeconds(60);
        private Duration offlineAfter = Duration.ofSeconds(120);
        private int telemetryWindowSize = 100;
        private Duration ackTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration publishTimeout = Duration.ofSeconds(5);
        private Duration idleTeardown = Duration.ofMinutes(5);
        private int missionHistoryLimit = 500;
        private int maxNodesPerMission = 100;
        private String orderIdPrefix = "ORDER";
        private String protocolVersion = "2.0.0";

        private Builder() {}

        public Builder healthProbeInterval(Duration v) { this.healthProbeInterval = v; return this; }
        public Builder missedProbeThreshold(int v) { this.missedProbeThreshold = v; return this; }
        public Builder backoffBase(Duration v) { this.backoffBase = v; return this; }
        public Builder backoffMax(Duration v) { this.backoffMax = v; return this; }
        public Builder maxReconnectAttempts(int v) { this.maxReconnectAttempts = v; return this; }
        public Builder staleAfter(Duration v) { this.staleAfter = v; return this; }
        public Builder offlineAfter(Duration v) { this.offlineAfter = v; return this; }
        public Builder telemetryWindowSize(int v) { this.telemetryWindowSize = v; return this; }
        public Builder ackTimeout(Duration v) { this.ackTimeout = v; return this; }
        public Builder connectTimeout(Duration v) { this.connectTimeout = v; return this; }
        public Builder publishTimeout(Duration v) { this.publishTimeout = v; return this; }
        public Builder idleTeardown(Duration v) { this.idleTeardown = v; return this; }
        public Builder missionHistoryLimit(int v) { this.missionHistoryLimit = v; return this; }
        public Builder maxNodesPerMission(int v) { this.maxNodesPerMission = v; return this; }
        public Builder orderIdPrefix(String v) { this.orderIdPrefix = v; return this; }
        public Builder protocolVersion(String v) { this.protocolVersion = v; return this; }

        public FleetSettings build() {
            return new FleetSettings(
                    healthProbeInterval,
                    missedProbeThreshold,
                    backoffBase,
                    backoffMax,
                    maxReconnectAttempts,
                    staleAfter,
                    offlineAfter,
                    telemetryWindowSize,
                    ackTimeout,
                    connectTimeout,
                    publishTimeout,
                    idleTeardown,
                    missionHistoryLimit,
                    maxNodesPerMission,
                    orderIdPrefix,
                    protocolVersion
            );
        }
    }
}

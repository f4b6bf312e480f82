package com.questrail.fleet.health;

import com.questrail.fleet.config.FleetSettings;

import java.time.Duration;
import java.util.Objects;

/**
 * HealthPolicy
 * -----------------------------------------------------------------------------
 * When the health monitor probes and how many failed probes it tolerates.
 *
 * @param probeInterval        fixed period of the probe
 * @param missedProbeThreshold consecutive probes finding the session DEGRADED
 *                             before a reconnect is forced
 * @param telemetrySilence     fleet-wide silence after which the link is shown
 *                             DEGRADED even though the session looks fine
 */
public record HealthPolicy(Duration probeInterval, int missedProbeThreshold, Duration telemetrySilence) {
    public HealthPolicy {
        Objects.requireNonNull(probeInterval, "probeInterval");
        Objects.requireNonNull(telemetrySilence, "telemetrySilence");
        if (probeInterval.isNegative() || probeInterval.isZero()) {
            throw new IllegalArgumentException("probeInterval must be positive");
        }
        if (missedProbeThreshold < 1) {
            throw new IllegalArgumentException("missedProbeThreshold must be >= 1");
        }
        if (telemetrySilence.isNegative()) {
            throw new IllegalArgumentException("telemetrySilence must be non-negative");
        }
    }

    public static HealthPolicy from(FleetSettings settings) {
        return new HealthPolicy(settings.healthProbeInterval(), settings.missedProbeThreshold(), settings.staleAfter());
    }
}

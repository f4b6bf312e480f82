package com.questrail.fleet.observability;

import com.questrail.fleet.api.HealthStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Health status change.
 *
 * @param reconnectAttempt number of reconnect attempts made in the current outage; 0 when healthy
 */
public record HealthStatusEvent(Instant timestamp, HealthStatus from, HealthStatus to, int reconnectAttempt, String detail) {
    public HealthStatusEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(detail, "detail");
    }
}

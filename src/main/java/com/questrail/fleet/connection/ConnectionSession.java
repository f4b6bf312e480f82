package com.questrail.fleet.connection;

import com.questrail.fleet.api.SessionState;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the broker session for diagnostics and display.
 *
 * @param sessionId         increments on every successful connect; 0 before the first
 * @param brokerUrl         target of the current or last session
 * @param connectedAt       when the current session was established
 * @param reconnectAttempts attempts made by the health monitor in the current outage
 * @param lastHealthCheckAt last completed health probe
 * @param subscriptions     topic filters re-applied on every connect
 */
public record ConnectionSession(
        long sessionId,
        SessionState state,
        Optional<String> brokerUrl,
        Optional<Instant> connectedAt,
        int reconnectAttempts,
        Optional<Instant> lastHealthCheckAt,
        Set<String> subscriptions
) {
    public ConnectionSession {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(brokerUrl, "brokerUrl");
        Objects.requireNonNull(connectedAt, "connectedAt");
        Objects.requireNonNull(lastHealthCheckAt, "lastHealthCheckAt");
        subscriptions = Set.copyOf(Objects.requireNonNull(subscriptions, "subscriptions"));
    }

    static ConnectionSession initial() {
        return new ConnectionSession(0, SessionState.DISCONNECTED, Optional.empty(), Optional.empty(),
                0, Optional.empty(), Set.of());
    }

    ConnectionSession withState(SessionState next) {
        return new ConnectionSession(sessionId, next, brokerUrl, connectedAt, reconnectAttempts,
                lastHealthCheckAt, subscriptions);
    }

    ConnectionSession established(String url, Instant at) {
        return new ConnectionSession(sessionId + 1, state, Optional.of(url), Optional.of(at), reconnectAttempts,
                lastHealthCheckAt, subscriptions);
    }

    ConnectionSession withSubscriptions(Set<String> next) {
        return new ConnectionSession(sessionId, state, brokerUrl, connectedAt, reconnectAttempts,
                lastHealthCheckAt, next);
    }

    ConnectionSession withHealthCheck(Instant at, int attempts) {
        return new ConnectionSession(sessionId, state, brokerUrl, connectedAt, attempts,
                Optional.of(at), subscriptions);
    }
}

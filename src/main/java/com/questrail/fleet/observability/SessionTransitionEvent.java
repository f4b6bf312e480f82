package com.questrail.fleet.observability;

import com.questrail.fleet.api.SessionState;

import java.time.Instant;
import java.util.Objects;

/**
 * Broker session state change.
 *
 * @param cause short machine-oriented reason, e.g. {@code connack-accepted}
 */
public record SessionTransitionEvent(Instant timestamp, SessionState from, SessionState to, String cause) {
    public SessionTransitionEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(cause, "cause");
    }
}

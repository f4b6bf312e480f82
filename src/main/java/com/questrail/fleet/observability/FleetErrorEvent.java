package com.questrail.fleet.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Something went wrong that an operator should hear about: a failed first
 * connect, an exhausted reconnect budget, a crashing inbound handler.
 *
 * @param cause may be null when the failure has no exception behind it
 */
public record FleetErrorEvent(Instant timestamp, String message, Throwable cause) {
    public FleetErrorEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(message, "message");
    }
}

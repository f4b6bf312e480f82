package com.questrail.fleet.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * An inbound message the decode pipeline refused.
 *
 * @param reason drop category name
 * @param detail human readable explanation; never contains payload bytes
 */
public record ProtocolDropEvent(Instant timestamp, String topic, String reason, String detail) {
    public ProtocolDropEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(detail, "detail");
    }
}

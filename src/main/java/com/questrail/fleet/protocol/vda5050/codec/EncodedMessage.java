package com.questrail.fleet.protocol.vda5050.codec;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Wire-ready outbound message: a topic plus UTF-8 JSON payload.
 */
public record EncodedMessage(String topic, byte[] payload) {
    public EncodedMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }
}

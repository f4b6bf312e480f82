package com.questrail.fleet.protocol.vda5050.codec;

import com.questrail.fleet.api.FleetLinkException;

import java.util.Objects;

/**
 * Indicates that a single broker frame could not be turned into a valid
 * semantic VDA5050 message.
 *
 * <p>This is a per-message failure. The inbound pipeline counts it and drops
 * the frame; it never tears down the session or affects other vehicles.</p>
 */
public final class ProtocolException extends FleetLinkException
{
    /**
     * Coarse classification used for drop statistics.
     */
    public enum Reason {
        /** Payload is not parseable JSON, or a field has the wrong JSON type. */
        MALFORMED_PAYLOAD,
        /** A mandatory field is absent or empty. */
        MISSING_FIELD,
        /** A field holds a value outside the protocol's enumeration or range. */
        INVALID_VALUE,
        /** Topic does not follow {@code <interface>/<manufacturer>/<serial>/<segment>}. */
        INVALID_TOPIC,
        /** Header manufacturer/serialNumber disagree with the topic. */
        IDENTITY_MISMATCH
    }

    private final Reason reason;

    public ProtocolException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public ProtocolException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}

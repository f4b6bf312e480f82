package com.questrail.fleet.pipeline;

import com.questrail.fleet.protocol.vda5050.codec.ProtocolException;

/**
 * Why the inbound pipeline refused a message.
 */
public enum DropReason
{
    MALFORMED_PAYLOAD,
    MISSING_FIELD,
    INVALID_VALUE,
    INVALID_TOPIC,
    IDENTITY_MISMATCH,
    /** Topic segment the fleet link does not consume. */
    UNSUPPORTED_TOPIC,
    /** headerId not newer than the last accepted one for the vehicle and topic. */
    DUPLICATE,
    /** A downstream consumer failed; the message was not fully applied. */
    INTERNAL_ERROR;

    static DropReason of(ProtocolException.Reason reason) {
        return switch (reason) {
            case MALFORMED_PAYLOAD -> MALFORMED_PAYLOAD;
            case MISSING_FIELD -> MISSING_FIELD;
            case INVALID_VALUE -> INVALID_VALUE;
            case INVALID_TOPIC -> INVALID_TOPIC;
            case IDENTITY_MISMATCH -> IDENTITY_MISMATCH;
        };
    }
}

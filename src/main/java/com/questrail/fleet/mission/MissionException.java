package com.questrail.fleet.mission;

import com.questrail.fleet.api.FleetLinkException;

import java.util.Objects;

/**
 * A mission request cannot be carried out.
 */
public final class MissionException extends FleetLinkException
{
    public enum Reason {
        /** Route shape or order id is invalid. Nothing was published. */
        INVALID_ORDER,
        /** The vehicle did not acknowledge in time. */
        ACK_TIMEOUT,
        /** No order with that id is in mission history. */
        UNKNOWN_ORDER,
        /** The order is in a state that does not allow the operation. */
        ILLEGAL_STATE,
        /** A saved route is invalid or clashes with an existing one. */
        INVALID_ROUTE,
        /** The route library file could not be read or written. */
        STORAGE
    }

    private final Reason reason;

    public MissionException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public MissionException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() {
        return reason;
    }
}

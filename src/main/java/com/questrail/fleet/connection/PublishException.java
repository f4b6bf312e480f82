package com.questrail.fleet.connection;

import com.questrail.fleet.api.FleetLinkException;

/**
 * An outbound message was not delivered to the broker: the session was not
 * CONNECTED, or the broker did not acknowledge within the publish budget.
 */
public final class PublishException extends FleetLinkException
{
    public PublishException(String message) {
        super(message);
    }

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.fleet.api;

/**
 * Base type of every error the fleet link raises on purpose.
 *
 * <p>All fleet-link errors are unchecked. Callers that need to distinguish
 * them catch the concrete subtype ({@code ConfigException},
 * {@code ConnectionException}, {@code ProtocolException},
 * {@code PublishException}, {@code MissionException}).</p>
 */
public abstract class FleetLinkException extends RuntimeException
{
    protected FleetLinkException(String message) {
        super(message);
    }

    protected FleetLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}

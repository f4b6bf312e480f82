package com.questrail.fleet.connection;

import com.questrail.fleet.api.FleetLinkException;

import java.util.Objects;

/**
 * A broker session could not be established.
 *
 * <p>The connection manager never retries on its own. This exception reaches
 * the health monitor, which owns the retry policy, or the caller of an
 * explicit connect.</p>
 */
public final class ConnectionException extends FleetLinkException
{
    public enum Kind {
        /** Broker host name could not be resolved. */
        DNS,
        /** TLS handshake or certificate validation failed. */
        TLS,
        /** The broker refused the credentials or client id. */
        AUTH,
        /** No answer within the connect budget. */
        TIMEOUT,
        /** Socket-level failure: refused, reset, unreachable. */
        NETWORK,
        /** Aborted by shutdown or reconfiguration while in flight. */
        CANCELLED
    }

    private final Kind kind;

    public ConnectionException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ConnectionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }
}

package com.questrail.fleet.api;

/**
 * SessionState
 * -----------------------------------------------------------------------------
 * Lifecycle of the single broker session owned by the connection manager.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED ⇄ DEGRADED
 *        ↑              │            │          │
 *        └──────────────┴────────────┴──────────┘
 * </pre>
 */
public enum SessionState
{
    /** No session. Publishing is rejected. */
    DISCONNECTED,

    /** A connect attempt is in flight (resolve, TLS, authenticate, subscribe). */
    CONNECTING,

    /** Authenticated and subscribed to the fleet topics. */
    CONNECTED,

    /**
     * Keep-alive was missed. Inbound traffic is still accepted, but the health
     * monitor treats the session as suspect and outbound orders are refused
     * until the broker answers again.
     */
    DEGRADED;

    /**
     * Whether outbound traffic may be published in this state.
     */
    public boolean acceptsPublish() {
        return this == CONNECTED;
    }
}

package com.questrail.fleet.connection;

import com.questrail.fleet.api.SessionState;

import java.util.Objects;

/**
 * SessionStateReducer
 * -----------------------------------------------------------------------------
 * Pure transition function of the broker session state machine.
 *
 * <pre>
 *   DISCONNECTED --ConnectRequested--> CONNECTING
 *   CONNECTING   --ConnectSucceeded--> CONNECTED
 *   CONNECTING   --ConnectFailed-----> DISCONNECTED
 *   CONNECTED    --HeartbeatMissed---> DEGRADED
 *   DEGRADED     --HeartbeatRestored-> CONNECTED
 *   any live     --TransportLost-----> DISCONNECTED
 *   any          --DisconnectRequested-> DISCONNECTED
 * </pre>
 *
 * <p>Events that do not apply to the current state leave it unchanged; late
 * callbacks from a session that is already gone must not resurrect it.</p>
 */
public final class SessionStateReducer
{
    /**
     * @param newState state after the event
     * @param cause    short label for observability, e.g. {@code connect-failed:AUTH}
     */
    public record Result(SessionState newState, String cause) {
        public boolean changed(SessionState previous) {
            return previous != newState;
        }
    }

    public Result apply(SessionState state, SessionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        if (event instanceof SessionEvent.ConnectRequested) {
            return state == SessionState.DISCONNECTED
                    ? new Result(SessionState.CONNECTING, "connect-requested")
                    : unchanged(state);
        }
        if (event instanceof SessionEvent.ConnectSucceeded) {
            return state == SessionState.CONNECTING
                    ? new Result(SessionState.CONNECTED, "connect-succeeded")
                    : unchanged(state);
        }
        if (event instanceof SessionEvent.ConnectFailed e) {
            return state == SessionState.CONNECTING
                    ? new Result(SessionState.DISCONNECTED, "connect-failed:" + e.kind())
                    : unchanged(state);
        }
        if (event instanceof SessionEvent.HeartbeatMissed) {
            return state == SessionState.CONNECTED
                    ? new Result(SessionState.DEGRADED, "heartbeat-missed")
                    : unchanged(state);
        }
        if (event instanceof SessionEvent.HeartbeatRestored) {
            return state == SessionState.DEGRADED
                    ? new Result(SessionState.CONNECTED, "heartbeat-restored")
                    : unchanged(state);
        }
        if (event instanceof SessionEvent.TransportLost e) {
            return state == SessionState.DISCONNECTED
                    ? unchanged(state)
                    : new Result(SessionState.DISCONNECTED, "transport-lost:" + e.cause());
        }
        if (event instanceof SessionEvent.DisconnectRequested) {
            return new Result(SessionState.DISCONNECTED, "disconnect-requested");
        }
        return unchanged(state);
    }

    private static Result unchanged(SessionState state) {
        return new Result(state, "ignored");
    }
}

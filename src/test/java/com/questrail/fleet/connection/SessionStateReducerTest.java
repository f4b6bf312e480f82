package com.questrail.fleet.connection;

import com.questrail.fleet.api.SessionState;
import org.junit.jupiter.api.Test;

import static com.questrail.fleet.api.SessionState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SessionStateReducerTest
 * -----------------------------------------------------------------------------
 * Exhaustive checks of the session transition table. The reducer is pure,
 * so every case is a single call.
 */
class SessionStateReducerTest {

    private final SessionStateReducer reducer = new SessionStateReducer();

    private SessionState next(SessionState from, SessionEvent event) {
        return reducer.apply(from, event).newState();
    }

    @Test
    void happyPathConnects() {
        assertEquals(CONNECTING, next(DISCONNECTED, new SessionEvent.ConnectRequested()));
        assertEquals(CONNECTED, next(CONNECTING, new SessionEvent.ConnectSucceeded()));
    }

    @Test
    void failedConnectReturnsToDisconnectedWithKindInCause() {
        SessionStateReducer.Result r = reducer.apply(CONNECTING,
                new SessionEvent.ConnectFailed(ConnectionException.Kind.AUTH));
        assertEquals(DISCONNECTED, r.newState());
        assertEquals("connect-failed:AUTH", r.cause());
    }

    @Test
    void heartbeatDegradesAndRestores() {
        assertEquals(DEGRADED, next(CONNECTED, new SessionEvent.HeartbeatMissed()));
        assertEquals(CONNECTED, next(DEGRADED, new SessionEvent.HeartbeatRestored()));
    }

    @Test
    void transportLossDisconnectsEveryLiveState() {
        for (SessionState s : new SessionState[] {CONNECTING, CONNECTED, DEGRADED}) {
            assertEquals(DISCONNECTED, next(s, new SessionEvent.TransportLost("reset")), s.name());
        }
        assertFalse(reducer.apply(DISCONNECTED, new SessionEvent.TransportLost("late"))
                .changed(DISCONNECTED));
    }

    @Test
    void disconnectRequestAlwaysEndsDisconnected() {
        for (SessionState s : SessionState.values()) {
            assertEquals(DISCONNECTED, next(s, new SessionEvent.DisconnectRequested()), s.name());
        }
    }

    @Test
    void lateCallbacksDoNotResurrectASession() {
        assertEquals(DISCONNECTED, next(DISCONNECTED, new SessionEvent.ConnectSucceeded()));
        assertEquals(DISCONNECTED, next(DISCONNECTED, new SessionEvent.HeartbeatRestored()));
        assertEquals(DISCONNECTED, next(DISCONNECTED, new SessionEvent.HeartbeatMissed()));
        assertEquals(CONNECTED, next(CONNECTED, new SessionEvent.ConnectRequested()));
        assertEquals(CONNECTED, next(CONNECTED, new SessionEvent.ConnectFailed(ConnectionException.Kind.TIMEOUT)));
        assertEquals(CONNECTING, next(CONNECTING, new SessionEvent.HeartbeatMissed()));
    }

    @Test
    void ignoredEventsAreNotChanges() {
        SessionStateReducer.Result r = reducer.apply(DEGRADED, new SessionEvent.HeartbeatMissed());
        assertFalse(r.changed(DEGRADED));
        assertEquals("ignored", r.cause());
    }
}

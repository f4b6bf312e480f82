package com.questrail.fleet.connection;

/**
 * Inputs to {@link SessionStateReducer}.
 */
public sealed interface SessionEvent
{
    record ConnectRequested() implements SessionEvent {}

    record ConnectSucceeded() implements SessionEvent {}

    record ConnectFailed(ConnectionException.Kind kind) implements SessionEvent {}

    record HeartbeatMissed() implements SessionEvent {}

    record HeartbeatRestored() implements SessionEvent {}

    /** The session dropped without being asked to. */
    record TransportLost(String cause) implements SessionEvent {}

    record DisconnectRequested() implements SessionEvent {}
}

package com.questrail.fleet.observability;

/**
 * A no-op implementation of FleetObservabilitySink.
 */
public final class NullFleetObservabilitySink implements FleetObservabilitySink {
    public static final NullFleetObservabilitySink INSTANCE = new NullFleetObservabilitySink();

    private NullFleetObservabilitySink() {}

    @Override public void onSessionTransition(SessionTransitionEvent event) {}
    @Override public void onHealthStatus(HealthStatusEvent event) {}
    @Override public void onProtocolDrop(ProtocolDropEvent event) {}
    @Override public void onMissionEvent(MissionEvent event) {}
    @Override public void onError(FleetErrorEvent event) {}
}

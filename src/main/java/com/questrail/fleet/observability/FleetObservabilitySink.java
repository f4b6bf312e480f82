package com.questrail.fleet.observability;

/**
 * Receives lifecycle events from the fleet link.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the thread that produced the event (the network event
 * loop, the health timer or a dispatching caller) and must not block.</p>
 */
public interface FleetObservabilitySink {
    /**
     * Called when the broker session changes state.
     * @param event the transition details
     */
    void onSessionTransition(SessionTransitionEvent event);

    /**
     * Called when the health monitor publishes a new status.
     * @param event the status change
     */
    void onHealthStatus(HealthStatusEvent event);

    /**
     * Called for every inbound message dropped by the decode pipeline.
     * @param event the drop details
     */
    void onProtocolDrop(ProtocolDropEvent event);

    /**
     * Called when a mission order changes acknowledgement state.
     * @param event the mission outcome
     */
    void onMissionEvent(MissionEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(FleetErrorEvent event);
}

package com.questrail.fleet.observability;

import com.questrail.fleet.api.AckState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of FleetObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jFleetObservabilitySink implements FleetObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jFleetObservabilitySink.class);

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        log.info("Broker session: {} -> {} ({})", event.from(), event.to(), event.cause());
    }

    @Override
    public void onHealthStatus(HealthStatusEvent event) {
        if (event.reconnectAttempt() > 0) {
            log.info("Fleet link health: {} -> {} after attempt {} ({})",
                event.from(), event.to(), event.reconnectAttempt(), event.detail());
        } else {
            log.info("Fleet link health: {} -> {} ({})", event.from(), event.to(), event.detail());
        }
    }

    @Override
    public void onProtocolDrop(ProtocolDropEvent event) {
        log.debug("Dropped message on {}: {} {}", event.topic(), event.reason(), event.detail());
    }

    @Override
    public void onMissionEvent(MissionEvent event) {
        if (event.state() == AckState.TIMEOUT || event.state() == AckState.FAILED) {
            log.warn("Order {}#{} for {}: {}",
                event.orderId(), event.orderUpdateId(), event.vehicle(), event.state());
        } else {
            log.info("Order {}#{} for {}: {}",
                event.orderId(), event.orderUpdateId(), event.vehicle(), event.state());
        }
    }

    @Override
    public void onError(FleetErrorEvent event) {
        log.error("Fleet link error: {}", event.message(), event.cause());
    }
}

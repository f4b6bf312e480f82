package com.questrail.fleet.protocol.vda5050.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A VDA5050 action attached to a node, an edge, or sent as an instant action.
 *
 * @param actionType   e.g. {@code pick}, {@code cancelOrder}
 * @param actionId     unique id of this action instance
 * @param blockingType how the action interacts with driving
 * @param parameters   {@code key -> value} action parameters, insertion ordered
 */
public record Action(String actionType, String actionId, BlockingType blockingType, Map<String, String> parameters) {
    public Action {
        Objects.requireNonNull(actionType, "actionType");
        Objects.requireNonNull(actionId, "actionId");
        Objects.requireNonNull(blockingType, "blockingType");
        parameters = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(parameters, "parameters")));
    }

    public static Action of(String actionType, String actionId, BlockingType blockingType) {
        return new Action(actionType, actionId, blockingType, Map.of());
    }
}

package com.questrail.fleet.mission;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A named, reusable node list kept in the {@link RouteLibrary}.
 *
 * @param createdBy operator that saved the route; only they may delete it
 */
public record SavedRoute(
        long id,
        String name,
        String description,
        List<ParsedNode> nodes,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public SavedRoute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(createdBy, "createdBy");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
    }
}

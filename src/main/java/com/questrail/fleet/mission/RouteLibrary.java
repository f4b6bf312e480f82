package com.questrail.fleet.mission;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.fleet.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * RouteLibrary
 * =============================================================================
 * Operator-saved node lists, persisted as one JSON document.
 *
 * <p>Names are unique per owner. Listing and search return the most recently
 * updated route first. Only the operator who saved a route may delete it.</p>
 *
 * <p>The whole library is rewritten on every change (temporary file, then a
 * move over the target). Routes are few and small.</p>
 */
public final class RouteLibrary
{
    private static final Logger log = LoggerFactory.getLogger(RouteLibrary.class);

    private static final Comparator<SavedRoute> NEWEST_FIRST =
            Comparator.comparing(SavedRoute::updatedAt).reversed()
                    .thenComparing(Comparator.comparingLong(SavedRoute::id).reversed());

    private final Path file;
    private final ObjectMapper mapper;
    private final WallClock clock;

    private final Map<Long, SavedRoute> routes = new LinkedHashMap<>();
    private long nextId = 1;

    public RouteLibrary(Path file, ObjectMapper mapper, WallClock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        loadFile();
    }

    /**
     * Save a new route.
     *
     * @return the stored route with its assigned id
     * @throws MissionException INVALID_ROUTE for a blank name, an empty node
     *                          list or a name the owner already uses
     */
    public synchronized SavedRoute save(String name, String description, List<ParsedNode> nodes, String createdBy) {
        Objects.requireNonNull(createdBy, "createdBy");
        if (name == null || name.isBlank()) {
            throw new MissionException(MissionException.Reason.INVALID_ROUTE, "route name cannot be empty");
        }
        if (nodes == null || nodes.isEmpty()) {
            throw new MissionException(MissionException.Reason.INVALID_ROUTE, "route must contain at least one node");
        }
        String trimmed = name.strip();
        boolean taken = routes.values().stream()
                .anyMatch(r -> r.createdBy().equals(createdBy) && r.name().equals(trimmed));
        if (taken) {
            throw new MissionException(MissionException.Reason.INVALID_ROUTE,
                    "route '" + trimmed + "' already exists for " + createdBy);
        }

        Instant now = clock.now();
        SavedRoute route = new SavedRoute(nextId++, trimmed, description == null ? "" : description.strip(),
                nodes, createdBy, now, now);
        routes.put(route.id(), route);
        persist();
        log.info("Saved route '{}' ({} nodes) for {}", trimmed, nodes.size(), createdBy);
        return route;
    }

    public synchronized Optional<SavedRoute> load(long id) {
        return Optional.ofNullable(routes.get(id));
    }

    /**
     * @param createdBy owner filter; empty lists every route
     */
    public synchronized List<SavedRoute> list(Optional<String> createdBy) {
        return select(r -> createdBy.map(r.createdBy()::equals).orElse(true));
    }

    /**
     * Delete a route owned by {@code createdBy}.
     *
     * @return false if no such route exists or another operator owns it
     */
    public synchronized boolean delete(long id, String createdBy) {
        SavedRoute route = routes.get(id);
        if (route == null || !route.createdBy().equals(createdBy)) {
            log.warn("Route {} not found or not owned by {}", id, createdBy);
            return false;
        }
        routes.remove(id);
        persist();
        log.info("Route {} deleted by {}", id, createdBy);
        return true;
    }

    /**
     * Case-insensitive substring match on name or description.
     */
    public synchronized List<SavedRoute> search(String query, Optional<String> createdBy) {
        String needle = query.strip().toLowerCase(Locale.ROOT);
        return select(r -> createdBy.map(r.createdBy()::equals).orElse(true)
                && (r.name().toLowerCase(Locale.ROOT).contains(needle)
                    || r.description().toLowerCase(Locale.ROOT).contains(needle)));
    }

    private List<SavedRoute> select(Predicate<SavedRoute> filter) {
        List<SavedRoute> out = new ArrayList<>();
        for (SavedRoute r : routes.values()) {
            if (filter.test(r)) {
                out.add(r);
            }
        }
        out.sort(NEWEST_FIRST);
        return List.copyOf(out);
    }

    // ---------------------------------------------------------------------
    // JSON file
    // ---------------------------------------------------------------------

    private void loadFile() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            JsonNode root = mapper.readTree(file.toFile());
            nextId = root.path("nextId").asLong(1);
            for (JsonNode r : root.path("routes")) {
                SavedRoute route = fromJson(r);
                routes.put(route.id(), route);
                nextId = Math.max(nextId, route.id() + 1);
            }
        } catch (IOException | RuntimeException e) {
            throw new MissionException(MissionException.Reason.STORAGE, "cannot read route library " + file, e);
        }
    }

    private void persist() {
        ObjectNode root = mapper.createObjectNode();
        root.put("nextId", nextId);
        ArrayNode array = root.putArray("routes");
        for (SavedRoute r : routes.values()) {
            array.add(toJson(r));
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new MissionException(MissionException.Reason.STORAGE, "cannot write route library " + file, e);
        }
    }

    private ObjectNode toJson(SavedRoute r) {
        ObjectNode n = mapper.createObjectNode();
        n.put("id", r.id());
        n.put("name", r.name());
        n.put("description", r.description());
        n.put("createdBy", r.createdBy());
        n.put("createdAt", r.createdAt().toString());
        n.put("updatedAt", r.updatedAt().toString());
        ArrayNode nodes = n.putArray("nodes");
        for (ParsedNode p : r.nodes()) {
            ObjectNode pn = nodes.addObject();
            pn.put("nodeId", p.nodeId());
            pn.put("x", p.x());
            pn.put("y", p.y());
            pn.put("theta", p.theta());
            pn.put("line", p.lineNumber());
        }
        return n;
    }

    private static SavedRoute fromJson(JsonNode n) {
        List<ParsedNode> nodes = new ArrayList<>();
        for (JsonNode pn : n.path("nodes")) {
            nodes.add(new ParsedNode(pn.path("nodeId").asText(), pn.path("x").asDouble(),
                    pn.path("y").asDouble(), pn.path("theta").asDouble(), pn.path("line").asInt()));
        }
        return new SavedRoute(
                n.path("id").asLong(),
                n.path("name").asText(),
                n.path("description").asText(""),
                nodes,
                n.path("createdBy").asText(),
                Instant.parse(n.path("createdAt").asText()),
                Instant.parse(n.path("updatedAt").asText()));
    }
}

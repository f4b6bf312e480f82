package com.questrail.fleet.mission;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fleet.time.MutableWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RouteLibraryTest
 * -----------------------------------------------------------------------------
 * Saved routes: ownership, ordering, search and persistence across instances.
 */
class RouteLibraryTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableWallClock clock = new MutableWallClock(Instant.parse("2024-05-01T08:00:00Z"));
    private final List<ParsedNode> nodes = NodeListParser.parse("dock,0,0,0\nline_4,12.5,3,1.57");

    private Path file;
    private RouteLibrary library;

    @BeforeEach
    void setUp() {
        file = dir.resolve("routes").resolve("library.json");
        library = new RouteLibrary(file, mapper, clock);
    }

    @Test
    void saveAssignsIdsAndTrimsName() {
        SavedRoute r = library.save("  Morning tour ", "dock to line 4", nodes, "alice");

        assertEquals(1, r.id());
        assertEquals("Morning tour", r.name());
        assertEquals(clock.now(), r.createdAt());
        assertEquals(Optional.of(r), library.load(1));
        assertTrue(Files.exists(file));
    }

    @Test
    void namesAreUniquePerOwner() {
        library.save("Tour", "", nodes, "alice");

        MissionException e = assertThrows(MissionException.class, () -> library.save("Tour", "", nodes, "alice"));
        assertEquals(MissionException.Reason.INVALID_ROUTE, e.reason());
        assertDoesNotThrow(() -> library.save("Tour", "", nodes, "bob"));
    }

    @Test
    void rejectsBlankNameAndEmptyRoute() {
        assertThrows(MissionException.class, () -> library.save(" ", "", nodes, "alice"));
        assertThrows(MissionException.class, () -> library.save("Empty", "", List.of(), "alice"));
    }

    @Test
    void listAndSearchAreNewestFirst() {
        library.save("Dock run", "", nodes, "alice");
        clock.advance(Duration.ofMinutes(1));
        library.save("Line feed", "supplies DOCK 2", nodes, "bob");
        clock.advance(Duration.ofMinutes(1));
        library.save("Charging", "", nodes, "alice");

        assertEquals(List.of("Charging", "Line feed", "Dock run"),
                library.list(Optional.empty()).stream().map(SavedRoute::name).toList());
        assertEquals(List.of("Charging", "Dock run"),
                library.list(Optional.of("alice")).stream().map(SavedRoute::name).toList());
        assertEquals(List.of("Line feed", "Dock run"),
                library.search("dock", Optional.empty()).stream().map(SavedRoute::name).toList());
        assertEquals(List.of("Dock run"),
                library.search("dock", Optional.of("alice")).stream().map(SavedRoute::name).toList());
    }

    @Test
    void onlyOwnerMayDelete() {
        SavedRoute r = library.save("Tour", "", nodes, "alice");

        assertFalse(library.delete(r.id(), "bob"));
        assertFalse(library.delete(99, "alice"));
        assertTrue(library.delete(r.id(), "alice"));
        assertTrue(library.load(r.id()).isEmpty());
    }

    @Test
    void routesSurviveReopen() {
        library.save("Tour", "first", nodes, "alice");
        SavedRoute second = library.save("Other", "", nodes, "alice");
        library.delete(1, "alice");

        RouteLibrary reopened = new RouteLibrary(file, mapper, clock);

        assertEquals(List.of(second), reopened.list(Optional.empty()));
        assertEquals(3, reopened.save("Third", "", nodes, "alice").id(), "ids are never reused");
    }

    @Test
    void corruptFileIsAStorageError() throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, "{ not json".getBytes(StandardCharsets.UTF_8));

        MissionException e = assertThrows(MissionException.class, () -> new RouteLibrary(file, mapper, clock));
        assertEquals(MissionException.Reason.STORAGE, e.reason());
    }
}

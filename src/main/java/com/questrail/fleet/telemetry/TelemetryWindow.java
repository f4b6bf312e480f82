package com.questrail.fleet.telemetry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * TelemetryWindow
 * -----------------------------------------------------------------------------
 * A first-in-first-out window holding at most {@code capacity} recent events.
 *
 * <p>The contents live in an immutable list behind an {@link AtomicReference}.
 * An append builds the next list and swaps it in, so {@link #snapshot()} is a
 * single read that always returns a complete, arrival-ordered view. Memory is
 * bounded by {@code capacity} no matter how long the fleet runs.</p>
 *
 * @param <E> event type
 */
public final class TelemetryWindow<E>
{
    private final int capacity;
    private final AtomicReference<List<E>> events = new AtomicReference<>(List.of());

    public TelemetryWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Append an event, evicting the oldest entry when the window is full.
     */
    public void append(E event) {
        Objects.requireNonNull(event, "event");
        events.updateAndGet(current -> {
            int keepFrom = current.size() >= capacity ? current.size() - capacity + 1 : 0;
            List<E> next = new ArrayList<>(Math.min(current.size() + 1, capacity));
            next.addAll(current.subList(keepFrom, current.size()));
            next.add(event);
            return Collections.unmodifiableList(next);
        });
    }

    /**
     * Oldest first.
     */
    public List<E> snapshot() {
        return events.get();
    }

    public int size() {
        return events.get().size();
    }
}

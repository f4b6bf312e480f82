package com.questrail.fleet.api;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * ObservableValue
 * -----------------------------------------------------------------------------
 * A shared cell holding the latest value of some status, plus change listeners.
 *
 * <p>This is the seam between the fleet link and whatever renders it: the
 * dashboard reads {@link #get()} (a single volatile read) or subscribes, and is
 * never involved in producing the value. Listeners run on the thread that
 * performed the change and must not block.</p>
 *
 * @param <T> value type
 */
public final class ObservableValue<T>
{
    private final AtomicReference<T> value;
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    public ObservableValue(T initial) {
        this.value = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public T get() {
        return value.get();
    }

    /**
     * Replace the value, notifying listeners if it changed.
     *
     * @return the previous value
     */
    public T set(T next) {
        Objects.requireNonNull(next, "next");
        T previous = value.getAndSet(next);
        if (!previous.equals(next)) {
            for (Consumer<? super T> l : listeners) {
                l.accept(next);
            }
        }
        return previous;
    }

    /**
     * Atomically replace the value only if it currently is {@code expected}.
     * Comparison is by identity, which is exact for the enum statuses held here.
     */
    public boolean compareAndSet(T expected, T next) {
        Objects.requireNonNull(next, "next");
        if (!value.compareAndSet(expected, next)) {
            return false;
        }
        if (!expected.equals(next)) {
            for (Consumer<? super T> l : listeners) {
                l.accept(next);
            }
        }
        return true;
    }

    /**
     * Register a listener.
     *
     * @return a handle that unregisters the listener when run
     */
    public Runnable subscribe(Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }
}

package com.questrail.fleet.protocol.vda5050.codec;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Assigns strictly increasing {@code orderUpdateId}s per {@code orderId}.
 *
 * <p>The first update of an order keeps the id requested by the caller
 * (normally 0). Every later update gets {@code max(last + 1, requested)}, so an
 * id handed out once is never handed out again for the same order.</p>
 */
public final class OrderUpdateSequencer {

    private final ConcurrentMap<String, Long> lastAssigned = new ConcurrentHashMap<>();

    public long next(String orderId, long requested) {
        Objects.requireNonNull(orderId, "orderId");
        if (requested < 0) {
            throw new IllegalArgumentException("requested orderUpdateId must be >= 0");
        }
        return lastAssigned.merge(orderId, requested, (last, req) -> Math.max(last + 1, req));
    }

    public long lastAssigned(String orderId) {
        return lastAssigned.getOrDefault(orderId, -1L);
    }

    /**
     * Drop the counter for an order that left mission history.
     */
    public void forget(String orderId) {
        lastAssigned.remove(orderId);
    }
}

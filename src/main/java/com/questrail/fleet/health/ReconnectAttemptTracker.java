package com.questrail.fleet.health;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Number of reconnect attempts made in the current outage. The backoff and
 * the attempt budget live in {@link BackoffPolicy}; this only counts.
 */
final class ReconnectAttemptTracker {

    private final AtomicInteger count = new AtomicInteger();

    int recordAttempt() {
        return count.incrementAndGet();
    }

    /** Session established, or an operator asked for a fresh cycle. */
    void reset() {
        count.set(0);
    }

    int attempts() {
        return count.get();
    }
}

package com.questrail.fleet.time;

import com.questrail.fleet.internal.time.MonotonicClock;

import java.time.Duration;

/**
 * Monotonic clock that only moves when a test moves it. Reads start at zero.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private volatile long now;

    @Override
    public long nowNanos() {
        return now;
    }

    public synchronized void advance(Duration step) {
        if (step.isNegative()) {
            throw new IllegalArgumentException("monotonic time cannot go back: " + step);
        }
        now += step.toNanos();
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}

package com.questrail.fleet.internal.time;

/**
 * Elapsed-time source for the fleet link.
 *
 * <p>Telemetry staleness, ack deadlines, probe cadence and reconnect backoff
 * are all measured against this clock. Timestamps carried in vehicle messages
 * are shown to operators but never decide liveness.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    /** Nanosecond tick; only differences between readings mean anything. */
    long nowNanos();
}

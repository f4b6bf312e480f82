package com.questrail.fleet.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * Timer port for everything in the fleet link that waits: the health probe,
 * reconnect backoff, mission ack deadlines and the idle teardown of the
 * connection service.
 *
 * <p>Deadlines are monotonic nanoseconds from a {@link MonotonicClock}; an
 * operator changing the system time must not fire or postpone any of them.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} once, no earlier than {@code deadlineNanos}.
     * A deadline already in the past runs as soon as possible.
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Run {@code task} once, {@code delay} after the current reading of
     * {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        if (Objects.requireNonNull(delay, "delay").isNegative()) {
            throw new IllegalArgumentException("negative delay: " + delay);
        }
        long deadline = Objects.requireNonNull(clock, "clock").nowNanos() + delay.toNanos();
        return scheduleAtNanos(deadline, Objects.requireNonNull(task, "task"));
    }
}

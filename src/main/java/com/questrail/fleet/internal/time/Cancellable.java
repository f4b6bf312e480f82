package com.questrail.fleet.internal.time;

/** Handle returned by {@link MonotonicScheduler}. */
public interface Cancellable
{
    /** @return {@code false} when the task already ran or was cancelled */
    boolean cancel();
}

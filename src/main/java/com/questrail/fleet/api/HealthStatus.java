package com.questrail.fleet.api;

/**
 * HealthStatus
 * -----------------------------------------------------------------------------
 * Operator-facing summary produced by the health monitor.
 *
 * <p>{@link #FAILED} is the only terminal value: it is reached after the
 * configured number of reconnect attempts has been exhausted and is left only
 * by an explicit manual reconnect.</p>
 */
public enum HealthStatus
{
    HEALTHY,
    RECONNECTING,
    DEGRADED,
    FAILED
}

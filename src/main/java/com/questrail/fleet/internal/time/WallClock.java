package com.questrail.fleet.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used for timestamps that leave the process: outbound
 * VDA5050 headers, persisted credential metadata and observability events.
 *
 * <p>It MUST NOT be used for staleness, timeout or backoff decisions.</p>
 */
public interface WallClock
{
    Instant now();
}

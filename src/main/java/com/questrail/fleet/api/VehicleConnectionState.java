package com.questrail.fleet.api;

/**
 * VehicleConnectionState
 * -----------------------------------------------------------------------------
 * Liveness of a vehicle as judged by the fleet link from message arrival times.
 *
 * <p>This is <b>not</b> the VDA5050 {@code connectionState} field reported by the
 * vehicle itself. It is derived purely from how long ago the last valid message
 * for the vehicle was accepted.</p>
 */
public enum VehicleConnectionState
{
    /** A message was accepted within the idle threshold. */
    ONLINE,

    /** No message within the idle threshold; the cached state may be outdated. */
    STALE,

    /**
     * No message within the offline threshold, or the vehicle announced
     * OFFLINE / CONNECTIONBROKEN. The record is kept for mission history.
     */
    OFFLINE
}

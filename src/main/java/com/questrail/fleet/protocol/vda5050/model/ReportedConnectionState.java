package com.questrail.fleet.protocol.vda5050.model;

/**
 * {@code connectionState} as reported by the vehicle (or by its last will).
 */
public enum ReportedConnectionState {
    ONLINE,
    OFFLINE,
    CONNECTIONBROKEN
}

package com.questrail.fleet.protocol.vda5050.model;

/**
 * VDA5050 {@code operatingMode} values.
 */
public enum OperatingMode {
    AUTOMATIC,
    SEMIAUTOMATIC,
    MANUAL,
    SERVICE,
    TEACHIN
}

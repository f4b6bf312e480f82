package com.questrail.fleet.protocol.vda5050.model;

public enum BlockingType {
    NONE,
    SOFT,
    HARD
}

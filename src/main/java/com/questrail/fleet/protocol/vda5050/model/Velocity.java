package com.questrail.fleet.protocol.vda5050.model;

/**
 * Vehicle velocity in its own frame (m/s, rad/s).
 */
public record Velocity(double vx, double vy, double omega) {
}

package com.questrail.fleet.protocol.vda5050.model;

/**
 * @param batteryCharge state of charge in percent, 0..100
 * @param charging      whether the vehicle is currently charging
 */
public record BatteryState(double batteryCharge, boolean charging) {
    public BatteryState {
        if (Double.isNaN(batteryCharge) || batteryCharge < 0.0 || batteryCharge > 100.0) {
            throw new IllegalArgumentException("batteryCharge must be within 0..100: " + batteryCharge);
        }
    }
}

package com.questrail.fleet.protocol.vda5050;

import com.questrail.fleet.api.VehicleId;

/**
 * Hand-written vehicle-side JSON payloads, as a real AGV would send them.
 */
public final class Vda5050Payloads {

    public static final String INTERFACE = "uagv/v2";
    public static final String TIMESTAMP = "2024-05-01T10:15:30.000Z";

    private Vda5050Payloads() {
    }

    public static String topic(VehicleId vehicle, String segment) {
        return INTERFACE + "/" + vehicle.manufacturer() + "/" + vehicle.serialNumber() + "/" + segment;
    }

    public static String header(VehicleId vehicle, long headerId) {
        return "\"headerId\":" + headerId
                + ",\"timestamp\":\"" + TIMESTAMP + "\""
                + ",\"version\":\"2.0.0\""
                + ",\"manufacturer\":\"" + vehicle.manufacturer() + "\""
                + ",\"serialNumber\":\"" + vehicle.serialNumber() + "\"";
    }

    public static String state(VehicleId vehicle, long headerId, double battery) {
        return stateWithOrder(vehicle, headerId, battery, "", 0);
    }

    public static String stateWithOrder(VehicleId vehicle, long headerId, double battery,
                                        String orderId, long orderUpdateId) {
        return "{" + header(vehicle, headerId)
                + ",\"orderId\":\"" + orderId + "\""
                + ",\"orderUpdateId\":" + orderUpdateId
                + ",\"lastNodeId\":\"\""
                + ",\"lastNodeSequenceId\":0"
                + ",\"driving\":false"
                + ",\"operatingMode\":\"AUTOMATIC\""
                + ",\"batteryState\":{\"batteryCharge\":" + battery + ",\"charging\":false}"
                + ",\"agvPosition\":{\"x\":1.5,\"y\":2.5,\"theta\":0.0,\"mapId\":\"floor1\",\"positionInitialized\":true}"
                + ",\"errors\":[]}";
    }

    public static String stateWithOrderError(VehicleId vehicle, long headerId, String errorType, String orderId) {
        return "{" + header(vehicle, headerId)
                + ",\"orderId\":\"\""
                + ",\"orderUpdateId\":0"
                + ",\"lastNodeId\":\"\""
                + ",\"operatingMode\":\"AUTOMATIC\""
                + ",\"batteryState\":{\"batteryCharge\":50.0}"
                + ",\"errors\":[{\"errorType\":\"" + errorType + "\",\"errorLevel\":\"WARNING\""
                + ",\"errorDescription\":\"rejected\""
                + ",\"errorReferences\":[{\"referenceKey\":\"orderId\",\"referenceValue\":\"" + orderId + "\"}]}]}";
    }

    public static String connection(VehicleId vehicle, long headerId, String state) {
        return "{" + header(vehicle, headerId) + ",\"connectionState\":\"" + state + "\"}";
    }

    public static String visualization(VehicleId vehicle, long headerId, double x, double y) {
        return "{" + header(vehicle, headerId)
                + ",\"agvPosition\":{\"x\":" + x + ",\"y\":" + y + ",\"theta\":0.5,\"mapId\":\"floor1\"}"
                + ",\"velocity\":{\"vx\":0.4,\"vy\":0.0,\"omega\":0.1}}";
    }
}

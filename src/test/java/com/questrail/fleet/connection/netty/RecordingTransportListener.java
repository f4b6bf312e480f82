package com.questrail.fleet.connection.netty;

import com.questrail.fleet.connection.BrokerTransportListener;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Listener that records every transport callback as a short string.
 */
final class RecordingTransportListener implements BrokerTransportListener {

    final List<String> events = new ArrayList<>();
    final List<Throwable> downCauses = new ArrayList<>();

    @Override
    public synchronized void onMessage(String topic, byte[] payload) {
        events.add("message " + topic + " " + new String(payload, StandardCharsets.UTF_8));
    }

    @Override
    public synchronized void onHeartbeatMissed() {
        events.add("missed");
    }

    @Override
    public synchronized void onHeartbeatRestored() {
        events.add("restored");
    }

    @Override
    public synchronized void onTransportDown(Throwable cause) {
        events.add("down");
        downCauses.add(cause);
    }

    synchronized List<String> events() {
        return List.copyOf(events);
    }
}

package com.questrail.fleet.protocol.vda5050.codec;

import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.protocol.vda5050.model.ConnectionMessage;
import com.questrail.fleet.protocol.vda5050.model.ReportedConnectionState;
import com.questrail.fleet.protocol.vda5050.model.SequencedMessage;
import com.questrail.fleet.protocol.vda5050.model.Vda5050Topic;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * HeaderSequenceGuard
 * -----------------------------------------------------------------------------
 * Rejects duplicate and out-of-order replays by {@code headerId}.
 *
 * <p>A message is accepted only if its headerId is strictly greater than the
 * last accepted headerId for the same (vehicle, topic). Anything else is a
 * broker redelivery or a late arrival and must not overwrite newer state.</p>
 *
 * <h2>Baseline reset</h2>
 * Vehicles restart their header counters when they reboot. A message that
 * requests a full resync ({@code fullResync: true} on state or connection), or
 * a connection message announcing {@code ONLINE}, clears every baseline held
 * for that vehicle and becomes the new baseline for its own topic.
 *
 * <p>Designed for the single decode thread; the map is concurrent so snapshot
 * readers (diagnostics) never see a torn entry.</p>
 */
public final class HeaderSequenceGuard {

    public enum Verdict {
        ACCEPTED,
        RESYNCED,
        DUPLICATE;

        public boolean isAccepted() {
            return this != DUPLICATE;
        }
    }

    private record Key(VehicleId vehicle, Vda5050Topic topic) {}

    private final ConcurrentMap<Key, Long> lastAccepted = new ConcurrentHashMap<>();

    public Verdict check(SequencedMessage message) {
        Objects.requireNonNull(message, "message");
        Key key = new Key(message.vehicle(), message.topic());
        long headerId = message.header().headerId();

        if (requestsResync(message)) {
            lastAccepted.keySet().removeIf(k -> k.vehicle().equals(message.vehicle()));
            lastAccepted.put(key, headerId);
            return Verdict.RESYNCED;
        }

        boolean[] accepted = new boolean[1];
        lastAccepted.compute(key, (k, last) -> {
            if (last == null || headerId > last) {
                accepted[0] = true;
                return headerId;
            }
            return last;
        });
        return accepted[0] ? Verdict.ACCEPTED : Verdict.DUPLICATE;
    }

    public OptionalLong lastAccepted(VehicleId vehicle, Vda5050Topic topic) {
        Long last = lastAccepted.get(new Key(vehicle, topic));
        return last == null ? OptionalLong.empty() : OptionalLong.of(last);
    }

    private static boolean requestsResync(SequencedMessage message) {
        if (message.fullResync()) {
            return true;
        }
        return message instanceof ConnectionMessage c
                && c.connectionState() == ReportedConnectionState.ONLINE;
    }
}

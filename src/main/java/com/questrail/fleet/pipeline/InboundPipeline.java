package com.questrail.fleet.pipeline;

import com.questrail.fleet.connection.InboundMessageListener;
import com.questrail.fleet.internal.time.MonotonicClock;
import com.questrail.fleet.internal.time.WallClock;
import com.questrail.fleet.observability.FleetErrorEvent;
import com.questrail.fleet.observability.FleetObservabilitySink;
import com.questrail.fleet.observability.ProtocolDropEvent;
import com.questrail.fleet.protocol.vda5050.codec.HeaderSequenceGuard;
import com.questrail.fleet.protocol.vda5050.codec.ProtocolException;
import com.questrail.fleet.protocol.vda5050.codec.Vda5050MessageDecoder;
import com.questrail.fleet.protocol.vda5050.model.SequencedMessage;
import com.questrail.fleet.protocol.vda5050.model.UnknownMessage;
import com.questrail.fleet.protocol.vda5050.model.Vda5050Message;
import com.questrail.fleet.telemetry.TelemetryEvent;
import com.questrail.fleet.telemetry.TelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * InboundPipeline
 * =============================================================================
 * The decode path from raw broker frames to telemetry.
 *
 * <pre>
 *   (topic, byte[])
 *      → decode           ProtocolException  → drop (reason)
 *      → unknown segment                     → drop UNSUPPORTED_TOPIC
 *      → header sequence  not newer          → drop DUPLICATE
 *      → TelemetryStore.upsert + appendEvent
 *      → accepted-message listeners (acknowledgement matching)
 * </pre>
 *
 * <h2>Failure isolation</h2>
 * {@link #onMessage(String, byte[])} never throws. Every failure is a counted
 * drop of that one message; other vehicles' state is untouched. A failing
 * listener is reported and does not stop the remaining listeners.
 *
 * <p>Arrival time is read once per frame, before decoding, from both clocks.
 * Liveness uses the monotonic reading; the wall reading is for display.</p>
 */
public final class InboundPipeline implements InboundMessageListener
{
    private static final Logger log = LoggerFactory.getLogger(InboundPipeline.class);

    private final Vda5050MessageDecoder decoder;
    private final HeaderSequenceGuard sequenceGuard;
    private final TelemetryStore telemetry;
    private final MonotonicClock monotonicClock;
    private final WallClock wallClock;
    private final FleetObservabilitySink sink;

    private final DecodeStatistics statistics = new DecodeStatistics();
    private final List<AcceptedMessageListener> listeners = new CopyOnWriteArrayList<>();

    public InboundPipeline(Vda5050MessageDecoder decoder,
                           HeaderSequenceGuard sequenceGuard,
                           TelemetryStore telemetry,
                           MonotonicClock monotonicClock,
                           WallClock wallClock,
                           FleetObservabilitySink sink) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sequenceGuard = Objects.requireNonNull(sequenceGuard, "sequenceGuard");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void addListener(AcceptedMessageListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public DecodeStatistics.Snapshot statistics() {
        return statistics.snapshot();
    }

    @Override
    public void onMessage(String topic, byte[] payload) {
        try {
            process(topic, payload);
        } catch (RuntimeException e) {
            drop(topic, DropReason.INTERNAL_ERROR, e.toString());
            sink.onError(new FleetErrorEvent(wallClock.now(), "inbound processing failed for " + topic, e));
        }
    }

    private void process(String topic, byte[] payload) {
        long arrivedNanos = monotonicClock.nowNanos();
        Instant arrivedAt = wallClock.now();

        Vda5050Message decoded;
        try {
            decoded = decoder.decode(topic, payload);
        } catch (ProtocolException e) {
            drop(topic, DropReason.of(e.reason()), e.getMessage());
            return;
        }

        if (decoded instanceof UnknownMessage u) {
            drop(topic, DropReason.UNSUPPORTED_TOPIC, "segment " + u.segment());
            return;
        }

        SequencedMessage message = (SequencedMessage) decoded;
        HeaderSequenceGuard.Verdict verdict = sequenceGuard.check(message);
        if (!verdict.isAccepted()) {
            drop(topic, DropReason.DUPLICATE, "headerId " + message.header().headerId());
            return;
        }
        if (verdict == HeaderSequenceGuard.Verdict.RESYNCED) {
            log.debug("Sequence baseline reset for {}", message.vehicle());
        }

        telemetry.upsert(message, arrivedAt, arrivedNanos);
        telemetry.appendEvent(message.vehicle(), new TelemetryEvent(arrivedAt, message));
        statistics.recordAccepted();

        for (AcceptedMessageListener l : listeners) {
            try {
                l.onAccepted(message);
            } catch (RuntimeException e) {
                log.error("Listener failed on {} from {}", message.topic(), message.vehicle(), e);
                sink.onError(new FleetErrorEvent(wallClock.now(),
                        "accepted-message listener failed for " + message.vehicle(), e));
            }
        }
    }

    private void drop(String topic, DropReason reason, String detail) {
        statistics.recordDrop(reason);
        sink.onProtocolDrop(new ProtocolDropEvent(wallClock.now(), topic, reason.name(), detail == null ? "" : detail));
    }
}

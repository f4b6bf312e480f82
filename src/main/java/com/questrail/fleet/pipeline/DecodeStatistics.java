package com.questrail.fleet.pipeline;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for the inbound pipeline: accepted messages and drops by reason.
 */
public final class DecodeStatistics
{
    /**
     * Immutable view of the counters at one instant.
     */
    public record Snapshot(long accepted, Map<DropReason, Long> drops) {
        public Snapshot {
            drops = Collections.unmodifiableMap(new EnumMap<>(drops));
        }

        public long dropped(DropReason reason) {
            return drops.getOrDefault(reason, 0L);
        }

        public long totalDropped() {
            return drops.values().stream().mapToLong(Long::longValue).sum();
        }
    }

    private final LongAdder accepted = new LongAdder();
    private final Map<DropReason, LongAdder> drops = new EnumMap<>(DropReason.class);

    public DecodeStatistics() {
        for (DropReason r : DropReason.values()) {
            drops.put(r, new LongAdder());
        }
    }

    void recordAccepted() {
        accepted.increment();
    }

    void recordDrop(DropReason reason) {
        drops.get(reason).increment();
    }

    public Snapshot snapshot() {
        Map<DropReason, Long> out = new EnumMap<>(DropReason.class);
        for (Map.Entry<DropReason, LongAdder> e : drops.entrySet()) {
            long n = e.getValue().sum();
            if (n > 0) {
                out.put(e.getKey(), n);
            }
        }
        return new Snapshot(accepted.sum(), out);
    }
}

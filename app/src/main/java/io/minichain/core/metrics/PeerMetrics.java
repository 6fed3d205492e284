package io.minichain.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

public final class PeerMetrics {
    private static final MeterRegistry REGISTRY = BlockMetrics.registry();
    private static final Counter chainReplacements;
    private static final Counter candidatesRejected;

    static {
        chainReplacements = Counter.builder("consensus.chain.replacements")
                .description("Local chain swapped for a longer valid peer chain")
                .register(REGISTRY);
        candidatesRejected = Counter.builder("consensus.candidates.rejected")
                .description("Peer chains that were longer but failed validation")
                .register(REGISTRY);
    }

    private PeerMetrics() {}

    public static void recordDelivery(String event, boolean delivered) {
        Counter.builder("peer.deliveries")
                .tag("event", event)
                .tag("outcome", delivered ? "ok" : "failed")
                .register(REGISTRY)
                .increment();
    }

    public static void recordFetch(boolean fetched) {
        Counter.builder("peer.chain.fetches")
                .tag("outcome", fetched ? "ok" : "failed")
                .register(REGISTRY)
                .increment();
    }

    public static void recordReplacement() {
        chainReplacements.increment();
    }

    public static void recordRejectedCandidate() {
        candidatesRejected.increment();
    }
}

package io.minichain.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class BlockMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksMined = registry.counter("blocks.mined");
    private static final Counter miningCancelled = registry.counter("blocks.mining.cancelled");
    private static final Counter transactionsAccepted = registry.counter("transactions.accepted");
    private static final Counter transactionsRejected = registry.counter("transactions.rejected");
    private static final Timer miningTime = registry.timer("block.mining.time");

    public static <T> T recordMining(Supplier<T> search) {
        return miningTime.record(search);
    }

    public static void incrementBlocks() {
        blocksMined.increment();
    }

    public static void incrementCancelled() {
        miningCancelled.increment();
    }

    public static void recordSubmission(boolean accepted) {
        if (accepted) {
            transactionsAccepted.increment();
        } else {
            transactionsRejected.increment();
        }
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}

package io.minichain.core.p2p;

import java.util.List;

/** Per-peer outcome of one broadcast. */
public record BroadcastReport(String event, List<Delivery> deliveries) {

    public record Delivery(String peer, boolean delivered, String error) {
        static Delivery ok(String peer) {
            return new Delivery(peer, true, null);
        }

        static Delivery failed(String peer, String error) {
            return new Delivery(peer, false, error);
        }
    }

    public BroadcastReport {
        deliveries = List.copyOf(deliveries);
    }

    public long deliveredCount() {
        return deliveries.stream().filter(Delivery::delivered).count();
    }

    public long failedCount() {
        return deliveries.size() - deliveredCount();
    }

    public boolean allDelivered() {
        return failedCount() == 0;
    }
}

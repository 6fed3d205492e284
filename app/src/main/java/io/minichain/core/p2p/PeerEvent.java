package io.minichain.core.p2p;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.ChainCodec;
import io.minichain.core.protocol.Transaction;
import io.minichain.core.protocol.TransactionRecord;

import java.util.List;
import java.util.Objects;

/** Broadcast envelope posted to every peer: {@code {event, payload}}. */
public record PeerEvent(String event, JsonNode payload) {
    public static final String CHAIN_UPDATE = "chain_update";
    public static final String NEW_TRANSACTION = "new_transaction";

    public PeerEvent {
        Objects.requireNonNull(event, "event");
        if (event.isBlank() || !event.matches("[A-Za-z0-9_\\-]+")) {
            throw new IllegalArgumentException("Invalid event name: " + event);
        }
        payload = payload == null ? NullNode.getInstance() : payload;
    }

    public static PeerEvent chainUpdate(List<Block> blocks) {
        return new PeerEvent(CHAIN_UPDATE, ChainCodec.toTree(blocks));
    }

    public static PeerEvent newTransaction(Transaction tx) {
        return new PeerEvent(NEW_TRANSACTION, ChainCodec.mapper().valueToTree(TransactionRecord.of(tx)));
    }
}

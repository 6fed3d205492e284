package io.minichain.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire form of a block, as exchanged with peers and returned by {@code GET /chain}.
 */
public record BlockRecord(
        @JsonProperty("index") long index,
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("transactions") List<TransactionRecord> transactions,
        @JsonProperty("previous_hash") String previousHash,
        @JsonProperty("nonce") long nonce,
        @JsonProperty("hash") String hash
) {
    public BlockRecord {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public static BlockRecord of(Block block) {
        List<TransactionRecord> txs = new ArrayList<>(block.transactions().size());
        for (Transaction tx : block.transactions()) {
            txs.add(TransactionRecord.of(tx));
        }
        return new BlockRecord(
                block.index(),
                block.timestamp(),
                txs,
                block.previousHash().hex(),
                block.nonce(),
                block.hash().hex()
        );
    }

    /** Rebuilds the block keeping the recorded hash; see {@link Block#restore}. */
    public Block toBlock() {
        List<Transaction> txs = new ArrayList<>(transactions.size());
        for (TransactionRecord tx : transactions) {
            txs.add(tx.toTransaction());
        }
        return Block.restore(index, txs, Hash.fromHex(previousHash), timestamp, nonce, Hash.fromHex(hash));
    }
}

package io.minichain.core.protocol;

import io.minichain.core.consensus.CancellationToken;
import io.minichain.core.consensus.ProofOfWork;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * Block = index + ordered transactions + link to the predecessor + PoW nonce.
 *
 * Blocks are immutable: proof-of-work produces a new instance per nonce (see {@link #withNonce(long)}).
 * The stored hash is computed on construction, except for blocks rebuilt from a peer or from
 * storage via {@link #restore}, which keep the hash they were sent with so that
 * chain validation can detect tampering.
 */
public final class Block {
    private final long index;
    private final List<Transaction> transactions;
    private final Hash previousHash;
    private final long timestamp;
    private final long nonce;
    private final Hash hash;

    public Block(long index, List<Transaction> transactions, Hash previousHash) {
        this(index, transactions, previousHash, System.currentTimeMillis());
    }

    public Block(long index, List<Transaction> transactions, Hash previousHash, long timestamp) {
        this(index, transactions, previousHash, timestamp, 0L, null);
    }

    private Block(long index, List<Transaction> txs, Hash previousHash, long timestamp, long nonce, Hash storedHash) {
        this.index = index;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        this.previousHash = previousHash;
        this.timestamp = timestamp;
        this.nonce = nonce;
        basicValidate();
        this.hash = storedHash != null ? storedHash : computeHash();
    }

    /** Rebuild a block from its recorded fields, trusting nothing: the stored hash is kept as-is. */
    public static Block restore(long index, List<Transaction> txs, Hash previousHash,
                                long timestamp, long nonce, Hash storedHash) {
        if (storedHash == null) throw new IllegalArgumentException("missing hash");
        return new Block(index, txs, previousHash, timestamp, nonce, storedHash);
    }

    public long index() { return index; }
    public List<Transaction> transactions() { return transactions; }
    public Hash previousHash() { return previousHash; }
    public long timestamp() { return timestamp; }
    public long nonce() { return nonce; }
    public Hash hash() { return hash; }

    /** Same block body with another nonce; the hash is recomputed. */
    public Block withNonce(long nonce) {
        return new Block(index, transactions, previousHash, timestamp, nonce, null);
    }

    /**
     * Deterministic hash input: index || count || (len || tx)* || previousHash || timestamp || nonce.
     * The block's own hash is never part of it.
     */
    public byte[] serializeForHash() {
        int size = 8 + 4 + Hash.LENGTH + 8 + 8;
        byte[][] encoded = new byte[transactions.size()][];
        for (int i = 0; i < encoded.length; i++) {
            encoded[i] = transactions.get(i).serialize();
            size += 4 + encoded[i].length;
        }

        ByteBuffer buf = ByteBuffer.allocate(size);
        buf.putLong(index);
        buf.putInt(encoded.length);
        for (byte[] tx : encoded) {
            buf.putInt(tx.length);
            buf.put(tx);
        }
        buf.put(previousHash.bytes());
        buf.putLong(timestamp);
        buf.putLong(nonce);
        return buf.array();
    }

    public Hash computeHash() {
        return Hashes.digest(serializeForHash());
    }

    /** True if the stored hash matches a fresh recomputation. */
    public boolean hasIntactHash() {
        return hash.equals(computeHash());
    }

    public boolean isGenesisShaped() {
        return index == 0 && previousHash.isZero() && transactions.isEmpty();
    }

    /** Runs an uncancellable proof-of-work search and returns the sealed block. */
    public Block mine(int difficulty) {
        return new ProofOfWork().mine(this, difficulty, CancellationToken.never())
                .orElseThrow(() -> new IllegalStateException("uncancellable search stopped"));
    }

    public void basicValidate() {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (previousHash == null) throw new IllegalArgumentException("missing previousHash");
        if (timestamp < 0) throw new IllegalArgumentException("timestamp must be >= 0");
        if (nonce < 0) throw new IllegalArgumentException("nonce must be >= 0");
        if (index == 0 && !(previousHash.isZero() && transactions.isEmpty())) {
            throw new IllegalArgumentException("index 0 is reserved for the genesis block");
        }
        if (transactions.size() > ProtocolLimits.MAX_TXS_PER_BLOCK) throw new IllegalArgumentException("too many txs");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        Block other = (Block) o;
        return index == other.index
                && timestamp == other.timestamp
                && nonce == other.nonce
                && hash.equals(other.hash)
                && previousHash.equals(other.previousHash)
                && transactions.equals(other.transactions);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override public String toString() {
        return "Block{index=" + index + ", txs=" + transactions.size() + ", hash=" + hash.hex() + "}";
    }
}

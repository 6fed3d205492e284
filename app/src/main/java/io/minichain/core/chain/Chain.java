package io.minichain.core.chain;

import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.Hash;
import io.minichain.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only block sequence starting at a genesis block.
 *
 * A chain built from {@link #genesis()} only grows through {@link #append}, which enforces linkage.
 * Chains wrapped with {@link #of} (peer candidates, stored blocks) are not checked on construction;
 * call {@link #validate()} before trusting them.
 */
public final class Chain {

    private final List<Block> blocks;

    private Chain(List<Block> blocks) {
        this.blocks = blocks;
    }

    public static Chain genesis() {
        List<Block> list = new ArrayList<>();
        list.add(GenesisBuilder.buildGenesis());
        return new Chain(list);
    }

    public static Chain of(List<Block> blocks) {
        if (blocks == null || blocks.isEmpty()) {
            throw new IllegalArgumentException("A chain needs at least a genesis block");
        }
        return new Chain(new ArrayList<>(blocks));
    }

    /** Appends a block that extends the tip, or throws {@link ChainLinkageException}. */
    public synchronized void append(Block block) {
        if (block == null) throw new IllegalArgumentException("block required");
        Block tip = latest();
        if (!block.previousHash().equals(tip.hash())) {
            throw new ChainLinkageException("Block " + block.index() + " does not link to tip "
                    + tip.hash().hex() + " (previous_hash=" + block.previousHash().hex() + ")");
        }
        if (block.index() != tip.index() + 1) {
            throw new ChainLinkageException("Bad block index: expected " + (tip.index() + 1) + ", got " + block.index());
        }
        blocks.add(block);
    }

    /** True only if every block from genesis to tip has an intact hash and a valid link. */
    public boolean validate() {
        return validationError().isEmpty();
    }

    /** First problem found walking from genesis to tip, if any. */
    public synchronized Optional<String> validationError() {
        Block genesis = blocks.get(0);
        if (!genesis.isGenesisShaped()) {
            return Optional.of("block 0 is not a genesis block");
        }
        if (!genesis.hasIntactHash()) {
            return Optional.of("block 0 hash mismatch");
        }
        for (int i = 1; i < blocks.size(); i++) {
            Block current = blocks.get(i);
            Block previous = blocks.get(i - 1);
            if (current.index() != i) {
                return Optional.of("block " + i + " has index " + current.index());
            }
            if (!current.hasIntactHash()) {
                return Optional.of("block " + i + " hash mismatch");
            }
            if (!current.previousHash().equals(previous.hash())) {
                return Optional.of("block " + i + " does not link to block " + (i - 1));
            }
        }
        return Optional.empty();
    }

    /** Net amount received by {@code address} over every block of this chain. */
    public synchronized long balanceOf(String address) {
        long balance = 0;
        for (Block block : blocks) {
            for (Transaction tx : block.transactions()) {
                if (tx.recipient().equals(address)) {
                    balance += tx.amount();
                }
                if (tx.sender().equals(address)) {
                    balance -= tx.amount();
                }
            }
        }
        return balance;
    }

    public synchronized Block latest() {
        return blocks.get(blocks.size() - 1);
    }

    public synchronized int length() {
        return blocks.size();
    }

    public synchronized Hash genesisHash() {
        return blocks.get(0).hash();
    }

    /** Immutable snapshot of the blocks, genesis first. */
    public synchronized List<Block> blocks() {
        return List.copyOf(blocks);
    }

    public Chain copy() {
        return new Chain(new ArrayList<>(blocks()));
    }

    /** Same length and same tip hash. Linked chains with equal tips are identical. */
    public boolean sameAs(Chain other) {
        if (other == null) return false;
        if (other == this) return true;
        return length() == other.length() && latest().hash().equals(other.latest().hash());
    }

    @Override public String toString() {
        return "Chain{length=" + length() + ", tip=" + latest().hash().hex() + "}";
    }
}

package io.minichain.core.storage;

import io.minichain.core.protocol.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Simple, fast in-memory chain store.
 * Good for tests and throwaway local nodes.
 */
public final class InMemoryChainStore implements ChainStore {

    private final List<Block> blocks = new ArrayList<>();

    @Override
    public synchronized Optional<List<Block>> load() {
        if (blocks.isEmpty()) return Optional.empty();
        return Optional.of(List.copyOf(blocks));
    }

    @Override
    public synchronized void append(Block block) {
        if (block == null) return;
        if (block.index() != blocks.size()) {
            throw new IllegalArgumentException("Expected block " + blocks.size() + ", got " + block.index());
        }
        blocks.add(block);
    }

    @Override
    public synchronized void replace(List<Block> replacement) {
        blocks.clear();
        blocks.addAll(replacement);
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }
}

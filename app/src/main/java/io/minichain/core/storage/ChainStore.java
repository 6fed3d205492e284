package io.minichain.core.storage;

import io.minichain.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/**
 * Minimal chain persistence API.
 * Blocks are stored by index; a chain swap rewrites the whole sequence in one step.
 */
public interface ChainStore extends AutoCloseable {

    /** Stored blocks, genesis first, or empty if nothing was ever saved. */
    Optional<List<Block>> load();

    /** Persist one block appended at the tip. */
    void append(Block block);

    /** Replace everything stored with {@code blocks} (used after fork-choice). */
    void replace(List<Block> blocks);

    /** Number of blocks stored. */
    long size();

    @Override
    default void close() {}
}

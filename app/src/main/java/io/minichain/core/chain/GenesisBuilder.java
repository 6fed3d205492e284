package io.minichain.core.chain;

import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.Hash;

import java.util.Collections;

/**
 * Creates the genesis block.
 * - index = 0
 * - previousHash = 32 zero bytes
 * - no transactions
 * - timestamp = 0 and nonce = 0, so every node derives the same genesis hash
 */
public final class GenesisBuilder {
    public static final long GENESIS_TIMESTAMP = 0L;

    private GenesisBuilder(){}

    public static Block buildGenesis() {
        return new Block(0L, Collections.emptyList(), Hash.ZERO, GENESIS_TIMESTAMP);
    }
}

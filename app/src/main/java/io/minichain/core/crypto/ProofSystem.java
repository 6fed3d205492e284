package io.minichain.core.crypto;

import io.minichain.core.protocol.Block;

/**
 * Extra per-block check applied to chains received from peers, on top of hash linkage and PoW.
 */
@FunctionalInterface
public interface ProofSystem {

    ProofSystem NONE = block -> true;

    boolean verify(Block block);
}

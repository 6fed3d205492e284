package io.minichain.core.consensus;

import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.Hash;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Minimal Proof-of-Work:
 * - difficulty = required leading zero NIBBLES (hex digits) of the block hash.
 * - Equivalently the hash, read as a big-endian integer, must be below 2^(256 - 4 * difficulty).
 *
 * Example:
 *   difficulty = 4  -> hash hex starts with "0000".
 *
 * Notes:
 * - Blocks are immutable, so mining creates a NEW block per nonce tried.
 * - The search has no upper bound on attempts; callers bound it with a CancellationToken.
 */
public class ProofOfWork {

    public static final int MAX_DIFFICULTY = Hash.LENGTH * 2;

    /** Quick check: does this block's stored hash meet the difficulty? */
    public boolean meetsTarget(Block block, int difficulty) {
        return meetsTarget(block.hash(), difficulty);
    }

    public static boolean meetsTarget(Hash hash, int difficulty) {
        return hash.leadingZeroNibbles() >= clamp(difficulty);
    }

    /**
     * Search nonces upward from the template's nonce until the hash meets the difficulty.
     * Returns Optional.empty() once the token is cancelled; the template is left untouched.
     */
    public Optional<Block> mine(Block template, int difficulty, CancellationToken token) {
        if (template == null) throw new IllegalArgumentException("template required");
        int required = clamp(difficulty);
        CancellationToken stop = token == null ? CancellationToken.never() : token;

        Block candidate = template;
        long nonce = template.nonce();
        while (true) {
            if (stop.isCancelled()) {
                return Optional.empty();
            }
            if (candidate.hash().leadingZeroNibbles() >= required) {
                return Optional.of(candidate);
            }
            if (nonce == Long.MAX_VALUE) {
                throw new IllegalStateException("Nonce space exhausted for block " + template.index());
            }
            nonce++;
            candidate = template.withNonce(nonce);
        }
    }

    // ---------- helpers ----------

    /** Upper bound (exclusive) on the hash value for a given difficulty. */
    public static BigInteger target(int difficulty) {
        return BigInteger.ONE.shiftLeft(256 - 4 * clamp(difficulty));
    }

    /** Clamp difficulty to 0..64 nibbles. */
    private static int clamp(int difficulty) {
        if (difficulty < 0) return 0;
        return Math.min(difficulty, MAX_DIFFICULTY);
    }
}

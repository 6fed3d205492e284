package io.minichain.core.consensus;

import io.minichain.core.chain.Chain;
import io.minichain.core.crypto.ProofSystem;
import io.minichain.core.metrics.PeerMetrics;
import io.minichain.core.protocol.Block;

import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

/**
 * Longest-valid-chain fork choice.
 *
 * Single pass over the candidates: a candidate is considered only when it is strictly longer
 * than the best chain so far (the local chain to begin with), so an equal-length fork never
 * displaces the current chain. A considered candidate must then pass full validation.
 * The engine holds no state between calls and never mutates the chains it is given.
 */
public final class ConsensusEngine {
    private static final Logger LOG = Logger.getLogger(ConsensusEngine.class.getName());

    private final int difficulty;
    private final ProofSystem proofSystem;

    public ConsensusEngine(int difficulty, ProofSystem proofSystem) {
        this.difficulty = Math.max(0, difficulty);
        this.proofSystem = proofSystem == null ? ProofSystem.NONE : proofSystem;
    }

    public ConsensusEngine(int difficulty) {
        this(difficulty, ProofSystem.NONE);
    }

    public ForkChoice resolve(Chain local, Collection<Chain> candidates) {
        if (local == null) throw new IllegalArgumentException("local chain required");
        if (candidates == null || candidates.isEmpty()) {
            return ForkChoice.keep(local);
        }

        Chain best = local;
        int bestLength = local.length();
        for (Chain candidate : candidates) {
            if (candidate == null) {
                continue;
            }
            int length = candidate.length();
            if (length <= bestLength) {
                int current = bestLength;
                LOG.fine(() -> "Ignoring candidate of length " + length + " (best " + current + ")");
                continue;
            }
            try {
                checkCandidate(local, candidate);
            } catch (InvalidChainCandidateException e) {
                PeerMetrics.recordRejectedCandidate();
                LOG.warning(() -> "Discarding candidate chain of length " + length + ": " + e.getMessage());
                continue;
            }
            best = candidate;
            bestLength = length;
        }

        if (best != local && best.length() > local.length() && !best.sameAs(local)) {
            LOG.info("Adopting chain of length " + best.length() + " (local " + local.length() + ")");
            return ForkChoice.replaceWith(best);
        }
        return ForkChoice.keep(local);
    }

    public ForkChoice resolve(Chain local, Chain candidate) {
        return resolve(local, List.of(candidate));
    }

    /**
     * Full re-validation of a peer chain: hashes and links, same genesis as ours,
     * proof-of-work on every non-genesis block, and the proof-system hook.
     */
    public void checkCandidate(Chain local, Chain candidate) throws InvalidChainCandidateException {
        candidate.validationError().ifPresent(reason -> {
            throw new InvalidChainCandidateException(reason);
        });
        if (!candidate.genesisHash().equals(local.genesisHash())) {
            throw new InvalidChainCandidateException("genesis mismatch: " + candidate.genesisHash().hex());
        }
        List<Block> blocks = candidate.blocks();
        for (int i = 1; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (!ProofOfWork.meetsTarget(block.hash(), difficulty)) {
                throw new InvalidChainCandidateException("block " + i + " does not meet difficulty " + difficulty);
            }
            if (!proofSystem.verify(block)) {
                throw new InvalidChainCandidateException("block " + i + " rejected by proof system");
            }
        }
    }

    public int difficulty() {
        return difficulty;
    }
}

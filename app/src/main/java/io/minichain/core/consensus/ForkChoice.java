package io.minichain.core.consensus;

import io.minichain.core.chain.Chain;

/**
 * Outcome of a fork-choice pass: the chain to keep and whether it differs from the local one.
 */
public record ForkChoice(boolean changed, Chain chain) {

    public static ForkChoice keep(Chain local) {
        return new ForkChoice(false, local);
    }

    public static ForkChoice replaceWith(Chain candidate) {
        return new ForkChoice(true, candidate);
    }
}

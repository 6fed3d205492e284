package io.minichain.core.chain;

/**
 * An append that would break hash linkage or index continuity.
 * Only the owning node appends, so this indicates a local bug or a lost race with a chain swap.
 */
public class ChainLinkageException extends IllegalStateException {
    public ChainLinkageException(String message) {
        super(message);
    }
}

package io.minichain.core.consensus;

/**
 * A chain received from a peer that cannot be adopted. Consensus catches it and drops the
 * candidate; it never reaches the caller of a reconciliation.
 */
public class InvalidChainCandidateException extends IllegalArgumentException {
    public InvalidChainCandidateException(String message) {
        super(message);
    }

    public InvalidChainCandidateException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.minichain.core.consensus;

/** The proof-of-work search was stopped before a nonce was found. */
public class MiningCancelledException extends IllegalStateException {
    public MiningCancelledException(String message) {
        super(message);
    }
}

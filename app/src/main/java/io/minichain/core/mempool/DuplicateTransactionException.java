package io.minichain.core.mempool;

import io.minichain.core.protocol.Hash;

/** A transaction with the same identity hash is already pending. */
public class DuplicateTransactionException extends IllegalArgumentException {
    private final Hash identityHash;

    public DuplicateTransactionException(Hash identityHash) {
        super("Transaction already pending: " + identityHash.hex());
        this.identityHash = identityHash;
    }

    public Hash identityHash() { return identityHash; }
}

package io.minichain.core.crypto;

import io.minichain.core.protocol.Transaction;

/**
 * Signing capability for transactions submitted to a node.
 * The node only calls {@link #verify}; wallets call {@link #sign}.
 */
public interface Signer {

    /** Accepts every transaction and produces empty signatures. */
    Signer NOOP = new Signer() {
        @Override
        public byte[] sign(Transaction tx) {
            return new byte[0];
        }

        @Override
        public boolean verify(Transaction tx, byte[] signature) {
            return true;
        }
    };

    byte[] sign(Transaction tx);

    boolean verify(Transaction tx, byte[] signature);
}

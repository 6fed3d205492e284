package io.minichain.core.crypto;

/** The configured {@link Signer} refused a submitted transaction. */
public class RejectedSignatureException extends IllegalArgumentException {
    public RejectedSignatureException(String message) {
        super(message);
    }
}

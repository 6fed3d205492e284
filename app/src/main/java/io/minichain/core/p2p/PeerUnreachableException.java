package io.minichain.core.p2p;

/** One peer could not be reached or answered with an error. Never escapes {@link PeerNetwork}. */
public class PeerUnreachableException extends Exception {
    private final String peer;

    public PeerUnreachableException(String peer, String message) {
        super(peer + ": " + message);
        this.peer = peer;
    }

    public PeerUnreachableException(String peer, String message, Throwable cause) {
        super(peer + ": " + message, cause);
        this.peer = peer;
    }

    public String peer() { return peer; }
}

package io.minichain.core.p2p;

import io.minichain.core.protocol.Block;

import java.util.List;

/**
 * Moves events and chains between this node and one peer.
 * Implementations block the calling thread; {@link PeerNetwork} fans calls out and bounds them.
 */
public interface PeerTransport {

    void deliver(String peer, PeerEvent event) throws PeerUnreachableException;

    /** The peer's chain as sent, not validated. */
    List<Block> fetchChain(String peer) throws PeerUnreachableException;
}

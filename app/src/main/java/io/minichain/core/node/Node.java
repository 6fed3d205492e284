package io.minichain.core.node;

import io.minichain.core.chain.Chain;
import io.minichain.core.chain.ChainLinkageException;
import io.minichain.core.consensus.CancellationToken;
import io.minichain.core.consensus.ConsensusEngine;
import io.minichain.core.consensus.ForkChoice;
import io.minichain.core.consensus.MiningCancelledException;
import io.minichain.core.consensus.ProofOfWork;
import io.minichain.core.crypto.ProofSystem;
import io.minichain.core.crypto.RejectedSignatureException;
import io.minichain.core.crypto.Signer;
import io.minichain.core.mempool.Mempool;
import io.minichain.core.metrics.BlockMetrics;
import io.minichain.core.metrics.PeerMetrics;
import io.minichain.core.p2p.BroadcastReport;
import io.minichain.core.p2p.PeerEvent;
import io.minichain.core.p2p.PeerNetwork;
import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.Hash;
import io.minichain.core.protocol.Transaction;
import io.minichain.core.storage.ChainStore;
import io.minichain.core.storage.InMemoryChainStore;
import io.minichain.core.storage.RocksDBChainStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires chain, mempool, consensus, storage and the peer network.
 *
 * All state changes go through one lock. Proof-of-work runs outside it: {@link #mine} snapshots
 * the mempool and tip under the lock, searches unlocked, then re-locks to append. A chain swap
 * from consensus cancels any search in progress, since its block could no longer link.
 * A transaction is either pending here or sealed in a block of the current chain, never both.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final NodeConfig config;
    private final ChainStore store;
    private final PeerNetwork network;
    private final Signer signer;
    private final ConsensusEngine consensus;
    private final Mempool mempool = new Mempool();
    private final ProofOfWork pow;

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<CancellationToken> activeSearches = ConcurrentHashMap.newKeySet();

    private volatile Chain chain = Chain.genesis();
    private boolean started;
    // set when a block made it into the chain but not into the store
    private boolean storeBehind;

    public Node(NodeConfig config, ChainStore store, PeerNetwork network, Signer signer, ProofSystem proofSystem) {
        this(config, store, network, signer, proofSystem, new ProofOfWork());
    }

    Node(NodeConfig config, ChainStore store, PeerNetwork network, Signer signer, ProofSystem proofSystem,
         ProofOfWork pow) {
        this.config = config;
        this.pow = pow;
        this.store = store;
        this.network = network;
        this.signer = signer == null ? Signer.NOOP : signer;
        this.consensus = new ConsensusEngine(config.difficulty, proofSystem);
    }

    /** Convenience factory for an in-memory node talking HTTP to its peers. */
    public static Node inMemory(NodeConfig config) {
        return new Node(config, new InMemoryChainStore(), PeerNetwork.http(config.peerTimeoutMillis),
                Signer.NOOP, ProofSystem.NONE);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, String dataDir) {
        return new Node(config, RocksDBChainStore.open(dataDir), PeerNetwork.http(config.peerTimeoutMillis),
                Signer.NOOP, ProofSystem.NONE);
    }

    /** Load a stored chain or create genesis. Safe to call multiple times. */
    public void start() {
        lock.lock();
        try {
            if (started) {
                return;
            }
            Optional<List<Block>> stored = store.load();
            if (stored.isPresent()) {
                Chain loaded = Chain.of(stored.get());
                Optional<String> problem = loaded.validationError();
                if (problem.isEmpty() && loaded.genesisHash().equals(chain.genesisHash())) {
                    chain = loaded;
                    LOG.info(() -> "Loaded stored chain of length " + loaded.length());
                } else {
                    LOG.warning(() -> "Stored chain rejected (" + problem.orElse("genesis mismatch") + "), starting from genesis");
                    store.replace(chain.blocks());
                }
            } else {
                store.replace(chain.blocks());
            }
            started = true;
        } finally {
            lock.unlock();
        }
    }

    /** Validate a transfer and queue it for the next block. */
    public Transaction submitTransaction(String sender, String recipient, long amount) {
        return submitTransaction(sender, recipient, amount, new byte[0]);
    }

    public Transaction submitTransaction(String sender, String recipient, long amount, byte[] signature) {
        Transaction tx;
        try {
            tx = new Transaction(sender, recipient, amount);
        } catch (IllegalArgumentException e) {
            BlockMetrics.recordSubmission(false);
            throw e;
        }
        submitTransaction(tx, signature);
        return tx;
    }

    public void submitTransaction(Transaction tx, byte[] signature) {
        lock.lock();
        try {
            if (!signer.verify(tx, signature)) {
                throw new RejectedSignatureException("Signature rejected for " + tx.identityHash().hex());
            }
            mempool.add(tx);
            BlockMetrics.recordSubmission(true);
        } catch (IllegalArgumentException e) {
            BlockMetrics.recordSubmission(false);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /** Submit locally, then relay the transaction to every peer. */
    public Transaction broadcastTransaction(String sender, String recipient, long amount) {
        Transaction tx = submitTransaction(sender, recipient, amount);
        BroadcastReport report = network.broadcast(PeerEvent.newTransaction(tx));
        if (!report.allDelivered()) {
            LOG.info(() -> "new_transaction reached " + report.deliveredCount() + "/" + report.deliveries().size() + " peers");
        }
        return tx;
    }

    /**
     * A transaction relayed by a peer. Already-pending identities are ignored rather than
     * rejected, and nothing is re-broadcast.
     */
    public boolean receiveTransaction(Transaction tx) {
        lock.lock();
        try {
            if (mempool.contains(tx.identityHash())) {
                return false;
            }
            mempool.add(tx);
            BlockMetrics.recordSubmission(true);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Mine pending transactions, crediting this node's own address. */
    public Block mine() {
        return mine(config.address);
    }

    /**
     * Drain the mempool into a new block, search a nonce, append, queue the reward and announce
     * the new chain to peers. On cancellation or a linkage failure the drained transactions go
     * back to the mempool and the exception propagates.
     */
    public Block mine(String rewardAddress) {
        Transaction reward = new Transaction(NodeConfig.REWARD_SENDER, rewardAddress, config.rewardAmount);
        start();

        List<Transaction> txs;
        List<Block> before;
        CancellationToken token = CancellationToken.withTimeout(config.miningTimeoutMillis);
        lock.lock();
        try {
            txs = mempool.drain();
            before = chain.blocks();
            activeSearches.add(token);
        } finally {
            lock.unlock();
        }

        Block tip = before.get(before.size() - 1);
        Block template = new Block(tip.index() + 1, txs, tip.hash());
        Optional<Block> sealed;
        try {
            sealed = BlockMetrics.recordMining(() -> pow.mine(template, config.difficulty, token));
        } catch (RuntimeException e) {
            restore(txs, before);
            throw e;
        } finally {
            activeSearches.remove(token);
        }
        if (sealed.isEmpty()) {
            restore(txs, before);
            BlockMetrics.incrementCancelled();
            throw new MiningCancelledException("Mining of block " + template.index() + " was cancelled");
        }

        Block block = sealed.get();
        List<Block> snapshot;
        lock.lock();
        try {
            try {
                chain.append(block);
            } catch (ChainLinkageException e) {
                restore(txs, before);
                throw e;
            }
            persist(block);
            if (!mempool.contains(reward.identityHash())) {
                mempool.add(reward);
            }
            snapshot = chain.blocks();
        } finally {
            lock.unlock();
        }

        BlockMetrics.incrementBlocks();
        LOG.info(() -> "Mined block " + block.index() + " with " + block.transactions().size()
                + " txs, nonce=" + block.nonce() + ", hash=" + block.hash().hex());
        BroadcastReport report = network.broadcast(PeerEvent.chainUpdate(snapshot));
        if (!report.allDelivered()) {
            LOG.info(() -> "chain_update reached " + report.deliveredCount() + "/" + report.deliveries().size() + " peers");
        }
        return block;
    }

    /** Fetch every peer's chain and adopt the longest valid one if it beats ours. */
    public boolean resolveConflicts() {
        start();
        List<Chain> candidates = network.fetchChains();
        return adopt(candidates);
    }

    /** A chain pushed by a peer: same decision as {@link #resolveConflicts()} for one candidate. */
    public boolean receiveChain(Chain candidate) {
        start();
        return adopt(List.of(candidate));
    }

    private boolean adopt(Collection<Chain> candidates) {
        lock.lock();
        try {
            ForkChoice choice = consensus.resolve(chain, candidates);
            if (!choice.changed()) {
                return false;
            }
            Chain adopted = choice.chain().copy();
            List<Block> before = chain.blocks();
            store.replace(adopted.blocks());
            storeBehind = false;
            chain = adopted;
            int dropped = mempool.removeAll(sealedSince(before, adopted.blocks()));
            if (dropped > 0) {
                LOG.fine(() -> "Dropped " + dropped + " pending txs sealed by the adopted chain");
            }
            PeerMetrics.recordReplacement();
            cancelSearches();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void cancelSearches() {
        for (CancellationToken token : activeSearches) {
            token.cancel();
        }
    }

    /**
     * Put back the transactions of an abandoned block, minus any that blocks added to the chain
     * since {@code before} already seal.
     */
    private void restore(List<Transaction> txs, List<Block> before) {
        lock.lock();
        try {
            Set<Hash> sealed = sealedSince(before, chain.blocks());
            List<Transaction> back = new ArrayList<>(txs.size());
            for (Transaction tx : txs) {
                if (!sealed.contains(tx.identityHash())) {
                    back.add(tx);
                }
            }
            mempool.restore(back);
        } finally {
            lock.unlock();
        }
    }

    /** Identities sealed by the blocks of {@code after} past its common prefix with {@code before}. */
    static Set<Hash> sealedSince(List<Block> before, List<Block> after) {
        int common = 0;
        int limit = Math.min(before.size(), after.size());
        while (common < limit && before.get(common).hash().equals(after.get(common).hash())) {
            common++;
        }
        Set<Hash> sealed = new HashSet<>();
        for (Block block : after.subList(common, after.size())) {
            for (Transaction tx : block.transactions()) {
                sealed.add(tx.identityHash());
            }
        }
        return sealed;
    }

    // Caller holds the lock. A failed write leaves the chain ahead of the store until the
    // next successful full rewrite.
    private void persist(Block block) {
        try {
            if (storeBehind) {
                store.replace(chain.blocks());
                storeBehind = false;
            } else {
                store.append(block);
            }
        } catch (RuntimeException e) {
            storeBehind = true;
            LOG.log(Level.WARNING, "Could not persist block " + block.index() + ", store will be rewritten on the next block", e);
        }
    }

    /** Register a {@code host:port} peer. */
    public boolean registerPeer(String address) {
        return network.register(address);
    }

    /** Balance of {@code address} over mined blocks only. */
    public long balanceOf(String address) {
        return chain.balanceOf(address);
    }

    /** Snapshot of the chain, genesis first. */
    public List<Block> getChain() {
        return chain.blocks();
    }

    public Chain chain() { return chain; }
    public Mempool mempool() { return mempool; }
    public PeerNetwork network() { return network; }
    public NodeConfig config() { return config; }
    public String address() { return config.address; }

    /** Close the peer pool and the store. */
    @Override
    public void close() {
        cancelSearches();
        network.close();
        store.close();
    }
}

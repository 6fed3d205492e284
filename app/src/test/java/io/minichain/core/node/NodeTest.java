package io.minichain.core.node;

import io.minichain.core.chain.Chain;
import io.minichain.core.consensus.CancellationToken;
import io.minichain.core.consensus.MiningCancelledException;
import io.minichain.core.consensus.ProofOfWork;
import io.minichain.core.crypto.ProofSystem;
import io.minichain.core.crypto.RejectedSignatureException;
import io.minichain.core.crypto.Signer;
import io.minichain.core.mempool.DuplicateTransactionException;
import io.minichain.core.p2p.PeerEvent;
import io.minichain.core.p2p.PeerNetwork;
import io.minichain.core.p2p.PeerTransport;
import io.minichain.core.p2p.PeerUnreachableException;
import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.ChainCodec;
import io.minichain.core.protocol.InvalidAmountException;
import io.minichain.core.protocol.Transaction;
import io.minichain.core.protocol.TransactionRecord;
import io.minichain.core.storage.ChainStore;
import io.minichain.core.storage.InMemoryChainStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    private static final int DIFFICULTY = 2;

    /** In-process wire: peers are other Node instances looked up by name. */
    private final Map<String, Node> directory = new ConcurrentHashMap<>();
    private final List<Node> created = new ArrayList<>();

    private final PeerTransport loopback = new PeerTransport() {
        @Override
        public void deliver(String peer, PeerEvent event) throws PeerUnreachableException {
            Node target = lookup(peer);
            if (PeerEvent.NEW_TRANSACTION.equals(event.event())) {
                TransactionRecord record = ChainCodec.mapper().convertValue(event.payload(), TransactionRecord.class);
                target.receiveTransaction(record.toTransaction());
            } else {
                target.receiveChain(Chain.of(ChainCodec.fromTree(event.payload())));
            }
        }

        @Override
        public List<Block> fetchChain(String peer) throws PeerUnreachableException {
            return ChainCodec.fromJson(ChainCodec.toJson(lookup(peer).getChain()));
        }

        private Node lookup(String peer) throws PeerUnreachableException {
            Node node = directory.get(peer);
            if (node == null) {
                throw new PeerUnreachableException(peer, "unknown peer");
            }
            return node;
        }
    };

    private Node node(String name, int port) {
        return node(name, port, NodeConfig.defaultLocal(name).withDifficulty(DIFFICULTY), new InMemoryChainStore(), Signer.NOOP);
    }

    private Node node(String name, int port, NodeConfig config, ChainStore store, Signer signer) {
        Node node = new Node(config, store, new PeerNetwork(loopback, 2_000), signer, ProofSystem.NONE);
        node.start();
        directory.put(name + ":" + port, node);
        created.add(node);
        return node;
    }

    private Node gatedNode(String name, int port, GatedProofOfWork gate) {
        Node node = new Node(NodeConfig.defaultLocal(name).withDifficulty(DIFFICULTY), new InMemoryChainStore(),
                new PeerNetwork(loopback, 2_000), Signer.NOOP, ProofSystem.NONE, gate);
        node.start();
        directory.put(name + ":" + port, node);
        created.add(node);
        return node;
    }

    /** Holds every search until released, so a test can act while proof-of-work is in flight. */
    static final class GatedProofOfWork extends ProofOfWork {
        final CountDownLatch searching = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        @Override
        public Optional<Block> mine(Block template, int difficulty, CancellationToken token) {
            searching.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("search was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return super.mine(template, difficulty, token);
        }
    }

    /** Store whose first append fails, as a full disk would. */
    static final class FailingOnceStore implements ChainStore {
        private final InMemoryChainStore delegate = new InMemoryChainStore();
        private boolean failed;

        @Override
        public Optional<List<Block>> load() {
            return delegate.load();
        }

        @Override
        public void append(Block block) {
            if (!failed) {
                failed = true;
                throw new IllegalStateException("disk full");
            }
            delegate.append(block);
        }

        @Override
        public void replace(List<Block> blocks) {
            delegate.replace(blocks);
        }

        @Override
        public long size() {
            return delegate.size();
        }
    }

    @AfterEach
    void tearDown() {
        created.forEach(Node::close);
    }

    @Test
    void freshNodeHoldsOnlyGenesis() {
        Node n = node("n", 1);
        assertEquals(1, n.getChain().size());
        assertTrue(n.getChain().get(0).isGenesisShaped());
        assertEquals(0, n.mempool().size());
    }

    @Test
    void mineSealsPendingTransactionsAndQueuesReward() {
        Node n = node("n", 1);
        Transaction transfer = n.submitTransaction("alice", "bob", 10);

        Block block = n.mine();

        assertEquals(2, n.getChain().size());
        assertEquals(block, n.chain().latest());
        assertEquals(List.of(transfer), block.transactions());
        assertTrue(block.hash().hex().startsWith("00"));
        assertTrue(n.chain().validate());
        assertEquals(List.of(new Transaction(NodeConfig.REWARD_SENDER, "n", 1)), n.mempool().pending());
    }

    @Test
    void rewardIsSealedByTheNextBlock() {
        Node n = node("n", 1);
        n.mine();
        Block second = n.mine("miner-x");

        assertEquals(List.of(new Transaction(NodeConfig.REWARD_SENDER, "n", 1)), second.transactions());
        assertEquals(List.of(new Transaction(NodeConfig.REWARD_SENDER, "miner-x", 1)), n.mempool().pending());
        assertEquals(3, n.getChain().size());
    }

    @Test
    void invalidAmountLeavesMempoolUntouched() {
        Node n = node("n", 1);
        n.submitTransaction("alice", "bob", 10);

        assertThrows(InvalidAmountException.class, () -> n.submitTransaction("eve", "mallory", -5));
        assertEquals(1, n.mempool().size());
    }

    @Test
    void duplicatePendingTransactionIsRejected() {
        Node n = node("n", 1);
        n.submitTransaction("alice", "bob", 10);
        assertThrows(DuplicateTransactionException.class, () -> n.submitTransaction("alice", "bob", 10));
        assertEquals(1, n.mempool().size());
    }

    @Test
    void signerCanRejectSubmissions() {
        Signer rejectAll = new Signer() {
            @Override
            public byte[] sign(Transaction tx) {
                return new byte[0];
            }

            @Override
            public boolean verify(Transaction tx, byte[] signature) {
                return false;
            }
        };
        Node n = node("n", 1, NodeConfig.defaultLocal("n").withDifficulty(DIFFICULTY), new InMemoryChainStore(), rejectAll);

        assertThrows(RejectedSignatureException.class, () -> n.submitTransaction("alice", "bob", 10));
        assertEquals(0, n.mempool().size());
    }

    @Test
    void cancelledMiningRestoresDrainedTransactions() {
        NodeConfig hopeless = NodeConfig.defaultLocal("n").withDifficulty(64).withMiningTimeout(50);
        Node n = node("n", 1, hopeless, new InMemoryChainStore(), Signer.NOOP);
        Transaction transfer = n.submitTransaction("alice", "bob", 10);

        assertThrows(MiningCancelledException.class, n::mine);

        assertEquals(1, n.getChain().size());
        assertEquals(List.of(transfer), n.mempool().pending());
    }

    @Test
    void resolveAdoptsLongerPeerChain() {
        Node a = node("a", 1);
        Node b = node("b", 2);
        a.mine();
        a.mine();
        b.registerPeer("a:1");

        assertTrue(b.resolveConflicts());
        assertEquals(3, b.getChain().size());
        assertTrue(b.chain().sameAs(a.chain()));

        assertFalse(b.resolveConflicts());
    }

    @Test
    void resolveKeepsLocalChainWhenPeersAreNotLonger() {
        Node a = node("a", 1);
        Node b = node("b", 2);
        a.mine();
        b.mine();
        b.registerPeer("a:1");
        b.registerPeer("ghost:9");

        Block tipBefore = b.chain().latest();
        assertFalse(b.resolveConflicts());
        assertEquals(tipBefore, b.chain().latest());
    }

    @Test
    void minedBlockIsPushedToPeers() {
        Node a = node("a", 1);
        Node b = node("b", 2);
        a.registerPeer("b:2");

        a.mine();

        assertEquals(2, b.getChain().size());
        assertTrue(b.chain().sameAs(a.chain()));
    }

    @Test
    void receiveChainIgnoresInvalidCandidate() {
        Node a = node("a", 1);
        Node b = node("b", 2);
        a.mine();
        a.mine();

        List<Block> blocks = new ArrayList<>(a.getChain());
        Block last = blocks.get(2);
        blocks.set(2, Block.restore(last.index(), List.of(new Transaction("mallory", "mallory", 99)),
                last.previousHash(), last.timestamp(), last.nonce(), last.hash()));

        assertFalse(b.receiveChain(Chain.of(blocks)));
        assertEquals(1, b.getChain().size());
    }

    @Test
    void restartReloadsPersistedChain() {
        InMemoryChainStore store = new InMemoryChainStore();
        NodeConfig config = NodeConfig.defaultLocal("n").withDifficulty(DIFFICULTY);
        Node first = node("n", 1, config, store, Signer.NOOP);
        first.mine();
        first.mine();
        assertEquals(3, store.size());

        Node second = new Node(config, store, new PeerNetwork(loopback, 2_000), Signer.NOOP, ProofSystem.NONE);
        created.add(second);
        second.start();
        assertTrue(second.chain().sameAs(first.chain()));
    }

    @Test
    void adoptedChainIsPersisted() {
        InMemoryChainStore store = new InMemoryChainStore();
        Node a = node("a", 1);
        Node b = node("b", 2, NodeConfig.defaultLocal("b").withDifficulty(DIFFICULTY), store, Signer.NOOP);
        a.mine();
        a.mine();
        a.mine();

        assertTrue(b.receiveChain(a.chain().copy()));
        assertEquals(4, store.size());
        assertEquals(a.getChain(), store.load().orElseThrow());
    }

    @Test
    void broadcastTransactionReachesPeerMempools() {
        Node a = node("a", 1);
        Node b = node("b", 2);
        a.registerPeer("b:2");

        Transaction tx = a.broadcastTransaction("alice", "bob", 15);

        assertEquals(List.of(tx), a.mempool().pending());
        assertEquals(List.of(tx), b.mempool().pending());
        assertFalse(b.receiveTransaction(tx));
        assertEquals(1, b.mempool().size());
    }

    @Test
    void balancesCountMinedBlocksOnly() {
        Node n = node("n", 1);
        n.submitTransaction("alice", "bob", 10);
        assertEquals(0, n.balanceOf("bob"));

        n.mine();
        assertEquals(10, n.balanceOf("bob"));
        assertEquals(-10, n.balanceOf("alice"));
        assertEquals(0, n.balanceOf("n"));

        n.mine();
        assertEquals(1, n.balanceOf("n"));
    }

    @Test
    void adoptedChainDropsPendingCopiesOfItsTransactions() {
        Node a = node("a", 1);
        Node b = node("b", 2);
        a.registerPeer("b:2");

        Transaction tx = a.broadcastTransaction("alice", "bob", 15);
        assertEquals(List.of(tx), b.mempool().pending());

        a.mine();
        assertTrue(b.chain().sameAs(a.chain()));
        assertTrue(b.mempool().pending().isEmpty());

        b.mine();
        long copies = b.getChain().stream()
                .flatMap(block -> block.transactions().stream())
                .filter(tx::equals)
                .count();
        assertEquals(1, copies);
        assertEquals(15, b.balanceOf("bob"));
    }

    @Test
    void chainSwapCancelsSearchAndRestoresOnlyUnsealedTransactions() throws Exception {
        Node a = node("a", 1);
        Transaction shared = new Transaction("alice", "bob", 10);
        a.submitTransaction(shared, new byte[0]);
        a.mine();

        GatedProofOfWork gate = new GatedProofOfWork();
        Node n = gatedNode("n", 3, gate);
        n.submitTransaction(shared, new byte[0]);
        Transaction local = n.submitTransaction("carol", "dave", 5);

        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            Future<Block> mining = worker.submit(() -> n.mine());
            assertTrue(gate.searching.await(5, TimeUnit.SECONDS));
            assertTrue(n.mempool().pending().isEmpty());

            assertTrue(n.receiveChain(a.chain().copy()));
            gate.release.countDown();

            ExecutionException e = assertThrows(ExecutionException.class, () -> mining.get(5, TimeUnit.SECONDS));
            assertInstanceOf(MiningCancelledException.class, e.getCause());
        } finally {
            worker.shutdownNow();
        }

        assertTrue(n.chain().sameAs(a.chain()));
        assertEquals(List.of(local), n.mempool().pending());
    }

    @Test
    void submissionDuringSearchStaysPendingForTheNextBlock() throws Exception {
        GatedProofOfWork gate = new GatedProofOfWork();
        Node n = gatedNode("n", 1, gate);
        Transaction first = n.submitTransaction("alice", "bob", 10);

        ExecutorService worker = Executors.newSingleThreadExecutor();
        Block block;
        Transaction late;
        try {
            Future<Block> mining = worker.submit(() -> n.mine());
            assertTrue(gate.searching.await(5, TimeUnit.SECONDS));
            late = n.submitTransaction("carol", "dave", 5);
            gate.release.countDown();
            block = mining.get(5, TimeUnit.SECONDS);
        } finally {
            worker.shutdownNow();
        }

        assertEquals(List.of(first), block.transactions());
        assertEquals(List.of(late, new Transaction(NodeConfig.REWARD_SENDER, "n", 1)), n.mempool().pending());
    }

    @Test
    void failedPersistKeepsBlockAndRewardThenCatchesStoreUp() {
        FailingOnceStore store = new FailingOnceStore();
        Node n = node("n", 1, NodeConfig.defaultLocal("n").withDifficulty(DIFFICULTY), store, Signer.NOOP);
        assertEquals(1, store.size());

        n.mine();
        assertEquals(2, n.getChain().size());
        assertEquals(1, store.size());
        assertEquals(List.of(new Transaction(NodeConfig.REWARD_SENDER, "n", 1)), n.mempool().pending());

        n.mine();
        assertEquals(3, store.size());
        assertEquals(n.getChain(), store.load().orElseThrow());
    }
}

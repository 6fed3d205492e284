package io.minichain.core.p2p;

import io.minichain.core.chain.Chain;
import io.minichain.core.protocol.Block;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class PeerNetworkTest {

    /** Scripted transport: healthy peers record deliveries, "down" peers fail, "slow" peers hang. */
    private static final class FakeTransport implements PeerTransport {
        final Map<String, PeerEvent> delivered = new ConcurrentHashMap<>();
        final Map<String, List<Block>> chains = new ConcurrentHashMap<>();

        @Override
        public void deliver(String peer, PeerEvent event) throws PeerUnreachableException {
            behave(peer);
            delivered.put(peer, event);
        }

        @Override
        public List<Block> fetchChain(String peer) throws PeerUnreachableException {
            behave(peer);
            List<Block> chain = chains.get(peer);
            if (chain == null) {
                throw new PeerUnreachableException(peer, "no chain");
            }
            return chain;
        }

        private void behave(String peer) throws PeerUnreachableException {
            if (peer.startsWith("down")) {
                throw new PeerUnreachableException(peer, "connection refused");
            }
            if (peer.startsWith("slow")) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PeerUnreachableException(peer, "interrupted", e);
                }
            }
        }
    }

    private final FakeTransport transport = new FakeTransport();
    private final PeerNetwork network = new PeerNetwork(transport, 200);

    @AfterEach
    void tearDown() {
        network.close();
    }

    @Test
    void registerIsIdempotentAndNormalizes() {
        assertTrue(network.register("10.0.0.1:5000"));
        assertFalse(network.register("http://10.0.0.1:5000/"));
        assertEquals(List.of("10.0.0.1:5000"), network.peers());
    }

    @Test
    void registerRejectsMalformedAddresses() {
        assertThrows(IllegalArgumentException.class, () -> network.register("no-port"));
        assertThrows(IllegalArgumentException.class, () -> network.register("host:99999"));
        assertThrows(IllegalArgumentException.class, () -> network.register(" "));
    }

    @Test
    void unregisterRemovesPeer() {
        network.register("a:1");
        assertTrue(network.unregister("a:1"));
        assertTrue(network.peers().isEmpty());
    }

    @Test
    void broadcastReachesHealthyPeersDespiteFailures() {
        network.register("up-1:5000");
        network.register("down-1:5000");
        network.register("up-2:5000");

        PeerEvent event = PeerEvent.chainUpdate(Chain.genesis().blocks());
        BroadcastReport report = network.broadcast(event);

        assertEquals(PeerEvent.CHAIN_UPDATE, report.event());
        assertEquals(2, report.deliveredCount());
        assertEquals(1, report.failedCount());
        assertFalse(report.allDelivered());
        assertEquals(event, transport.delivered.get("up-1:5000"));
        assertEquals(event, transport.delivered.get("up-2:5000"));
    }

    @Test
    void slowPeerTimesOutWithoutBlockingOthers() {
        network.register("slow-1:5000");
        network.register("up-1:5000");

        long started = System.nanoTime();
        BroadcastReport report = network.broadcast(PeerEvent.chainUpdate(Chain.genesis().blocks()));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;

        assertTrue(elapsedMillis < 3_000, "broadcast waited " + elapsedMillis + "ms");
        assertEquals(1, report.deliveredCount());
        BroadcastReport.Delivery slow = report.deliveries().get(0);
        assertFalse(slow.delivered());
        assertEquals("timed out", slow.error());
    }

    @Test
    void broadcastWithNoPeersIsEmpty() {
        BroadcastReport report = network.broadcast(PeerEvent.chainUpdate(Chain.genesis().blocks()));
        assertTrue(report.deliveries().isEmpty());
        assertTrue(report.allDelivered());
    }

    @Test
    void fetchChainsSkipsFailedPeers() {
        network.register("up-1:5000");
        network.register("down-1:5000");
        network.register("slow-1:5000");
        transport.chains.put("up-1:5000", Chain.genesis().blocks());

        List<Chain> chains = network.fetchChains();
        assertEquals(1, chains.size());
        assertTrue(chains.get(0).sameAs(Chain.genesis()));
    }

    @Test
    void eventNamesAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new PeerEvent("../chain", null));
    }
}

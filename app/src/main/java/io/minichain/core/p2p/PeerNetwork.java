package io.minichain.core.p2p;

import com.fasterxml.jackson.databind.JsonNode;
import io.minichain.core.chain.Chain;
import io.minichain.core.metrics.PeerMetrics;
import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.ProtocolLimits;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of known peers plus best-effort fan-out to them.
 *
 * Every peer is contacted on its own task with its own timeout, so one slow or dead peer
 * neither delays nor fails the others. Failures are logged and reported, never thrown.
 */
public final class PeerNetwork implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeerNetwork.class.getName());

    public static final long DEFAULT_TIMEOUT_MS = 3_000L;

    private final Set<String> peers = new LinkedHashSet<>();
    private final PeerTransport transport;
    private final long timeoutMillis;
    private final ExecutorService executor;

    public PeerNetwork(PeerTransport transport, long timeoutMillis) {
        this.transport = transport;
        this.timeoutMillis = Math.max(1L, timeoutMillis);
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "peer-io-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** HTTP transport whose request timeout matches the per-peer bound. */
    public static PeerNetwork http(long timeoutMillis) {
        return new PeerNetwork(new HttpPeerTransport(Duration.ofMillis(timeoutMillis)), timeoutMillis);
    }

    /** Add a {@code host:port} peer. Returns false if it was already known. */
    public boolean register(String address) {
        String normalized = normalize(address);
        synchronized (peers) {
            boolean added = peers.add(normalized);
            if (added) {
                LOG.info(() -> "Registered peer " + normalized);
            }
            return added;
        }
    }

    public boolean unregister(String address) {
        String normalized = normalize(address);
        synchronized (peers) {
            return peers.remove(normalized);
        }
    }

    public List<String> peers() {
        synchronized (peers) {
            return List.copyOf(peers);
        }
    }

    /** Deliver {@code {event, payload}} to every peer independently. */
    public BroadcastReport broadcast(String eventName, JsonNode payload) {
        return broadcast(new PeerEvent(eventName, payload));
    }

    public BroadcastReport broadcast(PeerEvent event) {
        Map<String, CompletableFuture<Void>> inFlight = new LinkedHashMap<>();
        for (String peer : peers()) {
            inFlight.put(peer, CompletableFuture.runAsync(() -> {
                try {
                    transport.deliver(peer, event);
                } catch (PeerUnreachableException e) {
                    throw new CompletionException(e);
                }
            }, executor).orTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        }

        List<BroadcastReport.Delivery> deliveries = new ArrayList<>(inFlight.size());
        for (Map.Entry<String, CompletableFuture<Void>> e : inFlight.entrySet()) {
            String peer = e.getKey();
            try {
                e.getValue().get();
                deliveries.add(BroadcastReport.Delivery.ok(peer));
                PeerMetrics.recordDelivery(event.event(), true);
            } catch (ExecutionException ex) {
                String reason = describe(ex.getCause());
                LOG.log(Level.WARNING, "Failed to deliver " + event.event() + " to " + peer + ": " + reason);
                deliveries.add(BroadcastReport.Delivery.failed(peer, reason));
                PeerMetrics.recordDelivery(event.event(), false);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                deliveries.add(BroadcastReport.Delivery.failed(peer, "interrupted"));
                PeerMetrics.recordDelivery(event.event(), false);
            }
        }
        return new BroadcastReport(event.event(), deliveries);
    }

    /** Chains of every peer that answered in time; failed peers are simply absent. */
    public List<Chain> fetchChains() {
        Map<String, CompletableFuture<List<Block>>> inFlight = new LinkedHashMap<>();
        for (String peer : peers()) {
            inFlight.put(peer, CompletableFuture.supplyAsync(() -> {
                try {
                    return transport.fetchChain(peer);
                } catch (PeerUnreachableException e) {
                    throw new CompletionException(e);
                }
            }, executor).orTimeout(timeoutMillis, TimeUnit.MILLISECONDS));
        }

        List<Chain> chains = new ArrayList<>(inFlight.size());
        for (Map.Entry<String, CompletableFuture<List<Block>>> e : inFlight.entrySet()) {
            String peer = e.getKey();
            try {
                chains.add(Chain.of(e.getValue().get()));
                PeerMetrics.recordFetch(true);
            } catch (ExecutionException | IllegalArgumentException ex) {
                Throwable cause = ex instanceof ExecutionException ? ex.getCause() : ex;
                LOG.warning(() -> "Failed to get chain from " + peer + ": " + describe(cause));
                PeerMetrics.recordFetch(false);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                PeerMetrics.recordFetch(false);
                break;
            }
        }
        return chains;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Peer address required");
        }
        String trimmed = address.trim();
        if (trimmed.startsWith("http://")) {
            trimmed = trimmed.substring("http://".length());
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.length() > ProtocolLimits.MAX_ADDRESS_LEN) {
            throw new IllegalArgumentException("Peer address too long");
        }
        int colon = trimmed.lastIndexOf(':');
        if (colon <= 0 || colon == trimmed.length() - 1) {
            throw new IllegalArgumentException("Invalid peer endpoint (expected host:port): " + address);
        }
        String host = trimmed.substring(0, colon);
        if (host.contains("/") || host.contains(" ")) {
            throw new IllegalArgumentException("Invalid peer host: " + address);
        }
        try {
            int port = Integer.parseInt(trimmed.substring(colon + 1));
            if (port <= 0 || port > 65_535) {
                throw new NumberFormatException();
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid peer port in endpoint: " + address);
        }
        return trimmed;
    }

    private static String describe(Throwable t) {
        if (t instanceof TimeoutException) {
            return "timed out";
        }
        if (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        String message = t.getMessage();
        return message == null ? t.getClass().getSimpleName() : message;
    }
}

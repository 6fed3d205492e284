package io.minichain.core.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.minichain.core.chain.Chain;
import io.minichain.core.chain.ChainLinkageException;
import io.minichain.core.consensus.MiningCancelledException;
import io.minichain.core.crypto.RejectedSignatureException;
import io.minichain.core.mempool.DuplicateTransactionException;
import io.minichain.core.metrics.HttpMetrics;
import io.minichain.core.node.Node;
import io.minichain.core.p2p.PeerEvent;
import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.BlockRecord;
import io.minichain.core.protocol.ChainCodec;
import io.minichain.core.protocol.InvalidAmountException;
import io.minichain.core.protocol.Transaction;
import io.minichain.core.protocol.TransactionRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front door of a node. Serves clients (submit, mine, resolve, register) and peers
 * ({@code GET /chain}, {@code POST /chain_update}).
 */
public class NodeApiServer {
    private static final Logger LOG = Logger.getLogger(NodeApiServer.class.getName());
    private static final int WORKER_THREADS = 8;

    private final Node node;
    private final String bindHost;
    private final int port;
    private final ObjectMapper mapper;
    private HttpServer httpServer;
    private ExecutorService executor;

    public NodeApiServer(Node node, int port) {
        this(node, "0.0.0.0", port);
    }

    public NodeApiServer(Node node, String bindHost, int port) {
        this.node = node;
        this.bindHost = bindHost;
        this.port = port;
        this.mapper = ChainCodec.mapper().copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(bindHost, port), 0);
        httpServer.createContext("/transactions/new", new SubmitTransactionHandler());
        httpServer.createContext("/chain", new ChainHandler());
        httpServer.createContext("/balance", new BalanceHandler());
        httpServer.createContext("/mine", new MineHandler());
        httpServer.createContext("/resolve", new ResolveHandler());
        httpServer.createContext("/nodes/register", new RegisterNodesHandler());
        httpServer.createContext("/" + PeerEvent.CHAIN_UPDATE, new ChainUpdateHandler());
        httpServer.createContext("/" + PeerEvent.NEW_TRANSACTION, new NewTransactionHandler());
        httpServer.createContext("/metrics", new MetricsHandler());

        // mining blocks a worker, so peers must still be served meanwhile
        AtomicInteger threads = new AtomicInteger();
        executor = Executors.newFixedThreadPool(WORKER_THREADS, r -> {
            Thread t = new Thread(r, "api-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        httpServer.setExecutor(executor);
        httpServer.start();
        LOG.info("Node API listening on " + bindHost + ":" + boundPort());
    }

    /** Actual listening port, useful when started on port 0. */
    public int boundPort() {
        return httpServer == null ? port : httpServer.getAddress().getPort();
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /** Common plumbing: method check, timing, and a 500 for anything unexpected. */
    private abstract class Route implements HttpHandler {
        private final String allowedMethod;

        Route(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = serve(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, method + " " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int serve(HttpExchange exchange) throws IOException;
    }

    class SubmitTransactionHandler extends Route {
        SubmitTransactionHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            TransactionRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), TransactionRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse transaction request");
            }
            if (req == null || req.sender == null || req.recipient == null || req.amount == null) {
                return sendError(exchange, 400, "missing_fields", "Fields 'sender', 'recipient' and 'amount' are required");
            }
            try {
                byte[] signature = req.signature == null ? new byte[0] : req.signature;
                Transaction tx = node.submitTransaction(req.sender, req.recipient, req.amount, signature);
                if (req.relay) {
                    node.network().broadcast(PeerEvent.newTransaction(tx));
                }
                ObjectNode resp = mapper.createObjectNode()
                        .put("status", "ok")
                        .put("id", tx.identityHash().hex());
                return sendJson(exchange, 201, resp);
            } catch (InvalidAmountException e) {
                return sendError(exchange, 400, "invalid_amount", e.getMessage());
            } catch (DuplicateTransactionException e) {
                return sendError(exchange, 409, "duplicate_transaction", e.getMessage());
            } catch (RejectedSignatureException e) {
                return sendError(exchange, 403, "rejected_signature", e.getMessage());
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_transaction",
                        Optional.ofNullable(e.getMessage()).orElse("Rejected transaction"));
            }
        }
    }

    class ChainHandler extends Route {
        ChainHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, ChainCodec.toJson(node.getChain()));
        }
    }

    class BalanceHandler extends Route {
        BalanceHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String address = queryParam(exchange, "address");
            if (address == null || address.isBlank()) {
                return sendError(exchange, 400, "missing_address", "Query parameter 'address' is required");
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("address", address)
                    .put("balance", node.balanceOf(address));
            return sendJson(exchange, 200, resp);
        }
    }

    class MineHandler extends Route {
        MineHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String minerAddress = node.address();
            byte[] body = readBody(exchange.getRequestBody());
            if (body.length > 0) {
                MineRequest req;
                try {
                    req = mapper.readValue(body, MineRequest.class);
                } catch (JsonProcessingException e) {
                    return sendError(exchange, 400, "invalid_json", "Failed to parse mine request");
                }
                if (req != null && req.minerAddress != null && !req.minerAddress.isBlank()) {
                    minerAddress = req.minerAddress;
                }
            }
            try {
                Block block = node.mine(minerAddress);
                return sendJson(exchange, 200, BlockRecord.of(block));
            } catch (MiningCancelledException e) {
                return sendError(exchange, 409, "mining_cancelled", e.getMessage());
            } catch (ChainLinkageException e) {
                return sendError(exchange, 500, "chain_linkage", e.getMessage());
            }
        }
    }

    class ResolveHandler extends Route {
        ResolveHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            boolean changed = node.resolveConflicts();
            ObjectNode resp = mapper.createObjectNode()
                    .put("changed", changed)
                    .put("length", node.chain().length());
            return sendJson(exchange, 200, resp);
        }
    }

    class RegisterNodesHandler extends Route {
        RegisterNodesHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            RegisterRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), RegisterRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse register request");
            }
            if (req == null || req.nodes == null || req.nodes.isEmpty()) {
                return sendError(exchange, 400, "missing_nodes", "Field 'nodes' must list at least one host:port");
            }
            try {
                for (String address : req.nodes) {
                    node.registerPeer(address);
                }
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_peer", e.getMessage());
            }
            ObjectNode resp = mapper.createObjectNode();
            ArrayNode peers = resp.putArray("peers");
            node.network().peers().forEach(peers::add);
            return sendJson(exchange, 200, resp);
        }
    }

    /** Target of peers' {@code chain_update} broadcasts. */
    class ChainUpdateHandler extends Route {
        ChainUpdateHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            Chain candidate;
            try {
                JsonNode envelope = mapper.readTree(exchange.getRequestBody());
                if (envelope == null || !envelope.isObject()) {
                    return sendError(exchange, 400, "invalid_event", "Expected {event, payload}");
                }
                String event = envelope.path("event").asText(PeerEvent.CHAIN_UPDATE);
                if (!PeerEvent.CHAIN_UPDATE.equals(event)) {
                    return sendError(exchange, 400, "invalid_event", "Unexpected event " + event);
                }
                candidate = Chain.of(ChainCodec.fromTree(envelope.get("payload")));
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse event");
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_chain", e.getMessage());
            }
            boolean changed = node.receiveChain(candidate);
            ObjectNode resp = mapper.createObjectNode()
                    .put("changed", changed)
                    .put("length", node.chain().length());
            return sendJson(exchange, 202, resp);
        }
    }

    /** Target of peers' {@code new_transaction} relays. */
    class NewTransactionHandler extends Route {
        NewTransactionHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            Transaction tx;
            try {
                JsonNode envelope = mapper.readTree(exchange.getRequestBody());
                if (envelope == null || !envelope.isObject() || !envelope.path("payload").isObject()) {
                    return sendError(exchange, 400, "invalid_event", "Expected {event, payload}");
                }
                tx = mapper.treeToValue(envelope.get("payload"), TransactionRecord.class).toTransaction();
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse event");
            } catch (InvalidAmountException e) {
                return sendError(exchange, 400, "invalid_amount", e.getMessage());
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_transaction", e.getMessage());
            }
            boolean accepted = node.receiveTransaction(tx);
            return sendJson(exchange, 202, mapper.createObjectNode().put("accepted", accepted));
        }
    }

    public static class TransactionRequest {
        public String sender;
        public String recipient;
        public Long amount;
        public byte[] signature;
        public boolean relay;
    }

    public static class MineRequest {
        @JsonProperty("miner_address")
        public String minerAddress;
    }

    public static class RegisterRequest {
        public List<String> nodes = new ArrayList<>();
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        return sendJson(exchange, status, mapper.writeValueAsBytes(body));
    }

    private int sendJson(HttpExchange exchange, int status, byte[] payload) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode err = mapper.createObjectNode();
        err.put("error", code);
        err.put("message", message);
        return sendJson(exchange, status, err);
    }

    private static String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2 && key.equals(URLDecoder.decode(kv[0], StandardCharsets.UTF_8))) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static byte[] readBody(InputStream in) throws IOException {
        byte[] body = in.readAllBytes();
        return new String(body, StandardCharsets.UTF_8).isBlank() ? new byte[0] : body;
    }
}

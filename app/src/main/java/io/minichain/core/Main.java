package io.minichain.core;

import io.minichain.core.api.NodeApiServer;
import io.minichain.core.consensus.MiningCancelledException;
import io.minichain.core.metrics.BlockMetrics;
import io.minichain.core.node.Node;
import io.minichain.core.node.NodeConfig;
import io.minichain.core.protocol.Block;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = NodeConfig.defaultLocal(options.address())
                .withDifficulty(options.difficulty())
                .withReward(options.reward())
                .withPeerTimeout(options.peerTimeoutMillis());
        Node node = options.dataDir() == null
                ? Node.inMemory(config)
                : Node.rocks(config, options.dataDir().toAbsolutePath().normalize().toString());

        NodeApiServer apiServer = null;
        ScheduledExecutorService background = null;
        try {
            node.start();
            for (String peer : options.peers()) {
                node.registerPeer(peer);
            }
            LOG.info("Node " + config.address + " difficulty=" + config.difficulty + " reward=" + config.rewardAmount
                    + " peers=" + node.network().peers());

            apiServer = new NodeApiServer(node, options.bind(), options.port());
            apiServer.start();

            CountDownLatch shutdownLatch = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "minichain-shutdown"));
            background = startBackgroundTasks(node, options);

            LOG.info("Node running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            if (background != null) {
                background.shutdownNow();
            }
            if (apiServer != null) {
                apiServer.stop();
            }
            node.close();
            LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }
    }

    private static ScheduledExecutorService startBackgroundTasks(Node node, CliOptions options) {
        AtomicInteger threads = new AtomicInteger();
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "minichain-background-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        if (options.mineIntervalMillis() > 0) {
            Runnable mine = () -> {
                try {
                    Block block = node.mine();
                    LOG.fine(() -> "Background miner sealed block " + block.index());
                } catch (MiningCancelledException e) {
                    LOG.info("Background mining cancelled: " + e.getMessage());
                } catch (Exception e) {
                    LOG.log(Level.WARNING, "Background mining failed", e);
                }
            };
            executor.scheduleWithFixedDelay(mine, options.mineIntervalMillis(), options.mineIntervalMillis(), TimeUnit.MILLISECONDS);
        }
        if (options.resolveIntervalMillis() > 0) {
            Runnable resolve = () -> {
                try {
                    if (node.resolveConflicts()) {
                        LOG.info("Adopted a longer chain, length now " + node.chain().length());
                    }
                } catch (Exception e) {
                    LOG.log(Level.WARNING, "Background resolve failed", e);
                }
            };
            executor.scheduleWithFixedDelay(resolve, options.resolveIntervalMillis(), options.resolveIntervalMillis(), TimeUnit.MILLISECONDS);
        }
        return executor;
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            String address,
            String bind,
            int port,
            int difficulty,
            long reward,
            List<String> peers,
            long peerTimeoutMillis,
            Path dataDir,
            long mineIntervalMillis,
            long resolveIntervalMillis
    ) {
        static CliOptions parse(String[] args) {
            int port = 5000;
            String address = null;
            String bind = "0.0.0.0";
            int difficulty = 4;
            long reward = 1L;
            long peerTimeoutMillis = 3_000L;
            Path dataDir = null;
            long mineIntervalMillis = 0L;
            long resolveIntervalMillis = 0L;
            List<String> peers = new ArrayList<>();
            boolean showHelp = false;
            String error = null;

            try {
                port = envPort("MINICHAIN_PORT", port);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }
            address = envOrDefault("MINICHAIN_ADDRESS", null);
            String peersEnv = System.getenv("MINICHAIN_PEERS");
            if (peersEnv != null && !peersEnv.isBlank()) {
                for (String endpoint : peersEnv.split(",")) {
                    if (!endpoint.isBlank()) {
                        peers.add(endpoint.trim());
                    }
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--address=")) {
                            address = arg.substring("--address=".length()).trim();
                        } else if (arg.startsWith("--port=")) {
                            port = parsePort(arg.substring("--port=".length()), "--port");
                        } else if (arg.startsWith("--bind=")) {
                            bind = arg.substring("--bind=".length());
                        } else if (arg.startsWith("--difficulty=")) {
                            difficulty = (int) parseLong(arg.substring("--difficulty=".length()), "--difficulty", 0, 64);
                        } else if (arg.startsWith("--reward=")) {
                            reward = parseLong(arg.substring("--reward=".length()), "--reward", 1, Long.MAX_VALUE);
                        } else if (arg.startsWith("--peer=")) {
                            peers.add(arg.substring("--peer=".length()).trim());
                        } else if (arg.startsWith("--peer-timeout-ms=")) {
                            peerTimeoutMillis = parseLong(arg.substring("--peer-timeout-ms=".length()), "--peer-timeout-ms", 1, Long.MAX_VALUE);
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.startsWith("--mine-interval-ms=")) {
                            mineIntervalMillis = parseLong(arg.substring("--mine-interval-ms=".length()), "--mine-interval-ms", 0, Long.MAX_VALUE);
                        } else if (arg.startsWith("--resolve-interval-ms=")) {
                            resolveIntervalMillis = parseLong(arg.substring("--resolve-interval-ms=".length()), "--resolve-interval-ms", 0, Long.MAX_VALUE);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        error = ex.getMessage();
                    }
                }
            }

            if (address == null || address.isBlank()) {
                address = "node-" + port;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    address,
                    bind,
                    port,
                    difficulty,
                    reward,
                    List.copyOf(peers),
                    peerTimeoutMillis,
                    dataDir,
                    mineIntervalMillis,
                    resolveIntervalMillis
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: minichain [options]

Options:
  --help, -h                  Show this help message and exit
  --address=<name>            Node address, credited with mining rewards (default node-<port>)
  --port=<port>               HTTP port (default 5000)
  --bind=<host>               Bind address (default 0.0.0.0)
  --difficulty=<n>            Leading zero hex digits required of a block hash (default 4)
  --reward=<n>                Mining reward amount (default 1)
  --peer=<host:port>          Register a peer (repeatable)
  --peer-timeout-ms=<ms>      Per-peer network timeout (default 3000)
  --data-dir=<path>           Persist the chain in RocksDB at this path (in-memory when absent)
  --mine-interval-ms=<ms>     Mine in the background at this interval (off by default)
  --resolve-interval-ms=<ms>  Resolve conflicts in the background at this interval (off by default)

Environment overrides:
  MINICHAIN_ADDRESS           Default for --address
  MINICHAIN_PORT              Default for --port
  MINICHAIN_PEERS             Comma-separated peers (host:port)
""");
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parseLong(String value, String flag, long min, long max) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < min || parsed > max) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}

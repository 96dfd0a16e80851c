package io.blockstore.core;

import io.blockstore.core.config.StoreConfig;
import io.blockstore.core.engine.BlockStoreEngine;
import io.blockstore.core.engine.StoreStats;
import io.blockstore.core.metrics.StoreMetrics;
import io.blockstore.core.net.BlockStoreSocketServer;
import io.blockstore.core.protocol.ContentHasher;
import io.blockstore.core.rpc.RequestHandler;
import io.blockstore.core.rpc.RpcServer;
import io.blockstore.core.storage.KeyValueStore;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final String STDIN_TRANSPORT = "stdin";

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        StoreConfig config = options.toStoreConfig();
        if (config.backend == StoreConfig.Backend.ROCKSDB) {
            Files.createDirectories(config.dataDir);
        }
        BlockStoreEngine engine = openEngine(BlockStoreEngine.openBackend(config), config, options.resetStore());

        RpcServer rpcServer = null;
        BlockStoreSocketServer socketServer = null;
        try {
            StoreStats stats = engine.stats();
            LOG.info("Opened " + config + " with " + stats.blocks() + " blocks and " + stats.transactions() + " transactions");
            RequestHandler handler = new RequestHandler(engine);

            if (options.enableRpc()) {
                rpcServer = new RpcServer(engine, options.rpcBind(), options.rpcPort(), options.rpcToken());
                rpcServer.start();
            }
            if (options.enableSocket()) {
                socketServer = new BlockStoreSocketServer(handler, options.socketBind(), options.socketPort());
                socketServer.start();
            }

            if (options.stdin()) {
                BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                long handled = runJsonLines(handler, in, System.out);
                LOG.info("stdin closed after " + handled + " requests");
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "block-store-shutdown"));
                LOG.info("Block store running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (rpcServer != null) {
                rpcServer.stop();
            }
            if (socketServer != null) {
                socketServer.stop();
            }
            engine.close();
            LOG.fine(() -> "=== Metrics ===\n" + StoreMetrics.scrapeMetrics());
        }
    }

    /** Optionally clears the backend, then builds the engine over it. The backend is closed if either step fails. */
    static BlockStoreEngine openEngine(KeyValueStore backend, StoreConfig config, boolean resetStore) {
        try {
            if (resetStore) {
                backend.reset();
                LOG.info("Cleared block store data" + (config.dataDir != null ? " under " + config.dataDir : ""));
            }
            return new BlockStoreEngine(backend, config, ContentHasher.sha256());
        } catch (RuntimeException e) {
            backend.close();
            throw e;
        }
    }

    /**
     * One JSON request per input line, one JSON response or error object per
     * output line. Blank lines are skipped. Returns the number of requests handled.
     */
    static long runJsonLines(RequestHandler handler, BufferedReader in, PrintStream out) throws IOException {
        long handled = 0;
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            byte[] reply = handler.handleJson(line.getBytes(StandardCharsets.UTF_8), STDIN_TRANSPORT);
            out.println(new String(reply, StandardCharsets.UTF_8));
            out.flush();
            handled++;
        }
        return handled;
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            StoreConfig.Backend backend,
            Path configFile,
            boolean resetStore,
            boolean verifyDigests,
            boolean keepAlive,
            boolean stdin,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken,
            boolean enableSocket,
            String socketBind,
            int socketPort
    ) {
        static CliOptions parse(String[] args) {
            return parse(args, System.getenv());
        }

        static CliOptions parse(String[] args, Map<String, String> env) {
            boolean showHelp = false;
            String error = null;

            Path dataDir = envPath(env, "BLOCK_STORE_DATA_DIR", Path.of("./data/block-store"));
            StoreConfig.Backend backend = null;
            String backendEnv = envOrDefault(env, "BLOCK_STORE_BACKEND", null);
            if (backendEnv != null) {
                try {
                    backend = StoreConfig.parseBackend(backendEnv);
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }
            Path configFile = envPath(env, "BLOCK_STORE_CONFIG", null);
            boolean reset = false;
            boolean verifyDigests = !"false".equalsIgnoreCase(env.get("BLOCK_STORE_VERIFY_DIGESTS"));
            boolean keepAlive = false;
            boolean stdin = false;
            boolean enableRpc = "true".equalsIgnoreCase(env.get("BLOCK_STORE_ENABLE_RPC"));
            String rpcBind = envOrDefault(env, "BLOCK_STORE_RPC_BIND", "127.0.0.1");
            int rpcPort = 9090;
            String rpcToken = envOrDefault(env, "BLOCK_STORE_RPC_TOKEN", null);
            boolean enableSocket = "true".equalsIgnoreCase(env.get("BLOCK_STORE_ENABLE_SOCKET"));
            String socketBind = envOrDefault(env, "BLOCK_STORE_SOCKET_BIND", "127.0.0.1");
            int socketPort = 9100;
            try {
                rpcPort = envPort(env, "BLOCK_STORE_RPC_PORT", rpcPort);
                socketPort = envPort(env, "BLOCK_STORE_SOCKET_PORT", socketPort);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--backend=")) {
                        try {
                            backend = StoreConfig.parseBackend(arg.substring("--backend=".length()));
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.equals("--reset-store")) {
                        reset = true;
                    } else if (arg.equals("--no-verify-digests")) {
                        verifyDigests = false;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--stdin")) {
                        stdin = true;
                    } else if (arg.equals("--enable-rpc")) {
                        enableRpc = true;
                    } else if (arg.startsWith("--rpc-bind=")) {
                        rpcBind = arg.substring("--rpc-bind=".length());
                    } else if (arg.startsWith("--rpc-port=")) {
                        try {
                            rpcPort = parsePort(arg.substring("--rpc-port=".length()), "--rpc-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--rpc-token=")) {
                        rpcToken = arg.substring("--rpc-token=".length());
                    } else if (arg.equals("--enable-socket")) {
                        enableSocket = true;
                    } else if (arg.startsWith("--socket-bind=")) {
                        socketBind = arg.substring("--socket-bind=".length());
                    } else if (arg.startsWith("--socket-port=")) {
                        try {
                            socketPort = parsePort(arg.substring("--socket-port=".length()), "--socket-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (rpcToken != null && rpcToken.isBlank()) {
                rpcToken = null;
            }

            // Servers keep the process up unless stdin mode drives its lifetime.
            keepAlive = keepAlive
                    || (!stdin && (enableRpc || enableSocket))
                    || "true".equalsIgnoreCase(env.get("BLOCK_STORE_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    backend,
                    configFile,
                    reset,
                    verifyDigests,
                    keepAlive,
                    stdin,
                    enableRpc,
                    rpcBind,
                    rpcPort,
                    rpcToken,
                    enableSocket,
                    socketBind,
                    socketPort
            );
        }

        /** Defaults, then the config file if any, then backend and digest flags from the command line. */
        StoreConfig toStoreConfig() {
            StoreConfig config = StoreConfig.rocks(dataDir);
            if (configFile != null) {
                config = config.overlay(configFile);
            }
            if (backend != null) {
                config = config.withBackend(backend, config.dataDir);
            }
            if (!verifyDigests) {
                config = config.withVerifyDigests(false);
            }
            return config;
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: block-store [options] [data-dir]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for block store data (default ./data/block-store)
  --backend=<memory|rocksdb> Storage backend (default rocksdb)
  --config=<file>            JSON store config applied over the defaults
  --reset-store              Delete all stored blocks, receipts and transactions on startup
  --no-verify-digests        Accept ids that are not the SHA2-256 multihash of their blob
  --stdin                    Serve JSON requests from stdin, one per line, until EOF
  --keep-alive               Keep the process running until interrupted
  --enable-rpc               Start the HTTP RPC server (default bind 127.0.0.1:9090)
  --rpc-bind=<host>          Bind address for the RPC server
  --rpc-port=<port>          Port for the RPC server (default 9090)
  --rpc-token=<token>        Require Bearer/X-API-Key token for the RPC server
  --enable-socket            Start the framed TCP server (default bind 127.0.0.1:9100)
  --socket-bind=<host>       Bind address for the TCP server
  --socket-port=<port>       Port for the TCP server (default 9100)

Environment overrides:
  BLOCK_STORE_DATA_DIR       Override --data-dir
  BLOCK_STORE_BACKEND        memory or rocksdb
  BLOCK_STORE_CONFIG         Path of a JSON store config
  BLOCK_STORE_VERIFY_DIGESTS Set to "false" to skip digest checks
  BLOCK_STORE_ENABLE_RPC     Set to "true" to enable RPC without CLI flag
  BLOCK_STORE_RPC_BIND       Bind address for the RPC server
  BLOCK_STORE_RPC_PORT       Port for the RPC server
  BLOCK_STORE_RPC_TOKEN      Token for RPC auth (if --rpc-token not supplied)
  BLOCK_STORE_ENABLE_SOCKET  Set to "true" to enable the TCP server without CLI flag
  BLOCK_STORE_SOCKET_BIND    Bind address for the TCP server
  BLOCK_STORE_SOCKET_PORT    Port for the TCP server
  BLOCK_STORE_KEEP_ALIVE     Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(Map<String, String> env, String key, Path fallback) {
            String value = env.get(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(Map<String, String> env, String key, String fallback) {
            String value = env.get(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(Map<String, String> env, String key, int fallback) {
            String value = env.get(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}

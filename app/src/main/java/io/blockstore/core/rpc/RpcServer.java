package io.blockstore.core.rpc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.blockstore.core.engine.BlockStoreEngine;
import io.blockstore.core.engine.StoreStats;
import io.blockstore.core.metrics.RequestMetrics;
import io.blockstore.core.metrics.StoreMetrics;
import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.messages.BlockStoreRequest;
import io.blockstore.core.protocol.messages.BlockStoreResponse;
import io.blockstore.core.protocol.messages.ErrorReply;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());
    private static final String TRANSPORT = "http";
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Block Store RPC API",
    "version": "1.0.0"
  },
  "paths": {
    "/block_store": {
      "post": {
        "summary": "Execute one block store request",
        "requestBody": {
          "required": true,
          "content": {
            "application/json": {
              "schema": { "$ref": "#/components/schemas/BlockStoreRequest" }
            }
          }
        },
        "responses": {
          "200": { "description": "Response variant matching the request type" },
          "400": { "description": "Malformed request, invalid range, digest mismatch or unknown type" },
          "401": { "description": "Auth required" },
          "404": { "description": "Head or previous block not found" },
          "409": { "description": "Id already stored with different content" },
          "500": { "description": "Storage failure" }
        }
      }
    },
    "/status": {
      "get": {
        "summary": "Store configuration and record counts",
        "responses": { "200": { "description": "Status response" }, "401": { "description": "Auth required" } }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics scrape",
        "responses": { "200": { "description": "Metrics as plain text" }, "401": { "description": "Auth required" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "OpenAPI description of this RPC API",
        "responses": { "200": { "description": "OpenAPI specification" }, "401": { "description": "Auth required" } }
      }
    }
  },
  "components": {
    "schemas": {
      "BlockStoreRequest": {
        "type": "object",
        "required": ["type"],
        "properties": {
          "type": {
            "type": "string",
            "enum": [
              "reserved_req",
              "get_blocks_by_id_req",
              "get_blocks_by_height_req",
              "add_block_req",
              "add_transaction_req",
              "get_transactions_by_id_req"
            ]
          }
        },
        "additionalProperties": true
      },
      "BlockItem": {
        "type": "object",
        "properties": {
          "block_id": { "type": "string", "description": "hex multihash" },
          "block_height": { "type": "integer", "format": "int64" },
          "block_blob": { "type": "string", "format": "byte" },
          "block_receipt_blob": { "type": "string", "format": "byte" }
        }
      },
      "Error": {
        "type": "object",
        "properties": {
          "error": { "type": "string" },
          "message": { "type": "string" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final BlockStoreEngine engine;
    private final RequestHandler handler;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(BlockStoreEngine engine, String bindAddress, int port, String authToken) {
        this.engine = engine;
        this.handler = new RequestHandler(engine);
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/block_store", new BlockStoreHandler());
        server.createContext("/status", new StatusHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + port() + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int port() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    /** Shared method check, auth and timing around one endpoint body. */
    private abstract class Endpoint implements HttpHandler {
        private final String allowedMethod;

        Endpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        abstract int serve(HttpExchange exchange) throws IOException;

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = RequestMetrics.start();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = serve(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Handler for " + path + " failed", e);
                status = sendError(exchange, 500, ErrorReply.INTERNAL_ERROR, "Unexpected server error");
            } finally {
                RequestMetrics.stopHttp(sample, method, path, status);
                exchange.close();
            }
        }
    }

    final class BlockStoreHandler extends Endpoint {
        BlockStoreHandler() {
            super("POST");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            try {
                BlockStoreRequest request = handler.decode(exchange.getRequestBody());
                BlockStoreResponse response = handler.handle(request, TRANSPORT);
                return sendJson(exchange, 200, handler.encode(response));
            } catch (BlockStoreException e) {
                LOG.fine(() -> "Request rejected: " + e);
                return sendJson(exchange, e.code().httpStatus(), handler.encode(ErrorReply.of(e)));
            }
        }
    }

    final class StatusHandler extends Endpoint {
        StatusHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            StoreStats stats = engine.stats();
            ObjectNode resp = handler.mapper().createObjectNode();
            resp.put("backend", engine.config().backend.name().toLowerCase(Locale.ROOT));
            resp.put("blocks", stats.blocks());
            resp.put("block_blobs", stats.blockBlobs());
            resp.put("receipt_blobs", stats.receiptBlobs());
            resp.put("transactions", stats.transactions());
            resp.put("verify_digests", engine.config().verifyDigests);
            return sendJson(exchange, 200, handler.encode(resp));
        }
    }

    final class MetricsHandler extends Endpoint {
        MetricsHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] payload = StoreMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends Endpoint {
        OpenApiHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
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
        return sendJson(exchange, status, handler.encode(new ErrorReply(code, message)));
    }
}

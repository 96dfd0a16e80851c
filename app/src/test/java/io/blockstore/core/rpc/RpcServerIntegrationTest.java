package io.blockstore.core.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockstore.core.config.StoreConfig;
import io.blockstore.core.engine.BlockStoreEngine;
import io.blockstore.core.protocol.Digest;
import io.blockstore.core.protocol.Hashes;
import io.blockstore.core.protocol.messages.BlockItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class RpcServerIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();

    private RpcServer server;
    private BlockStoreEngine engine;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (engine != null) {
            engine.close();
        }
    }

    @Test
    void blockStoreEndpointServesRequests() throws Exception {
        int port = startServer("rpc-secret");
        byte[] body = "block zero".getBytes(StandardCharsets.UTF_8);
        Digest id = Hashes.sha256Digest(body);
        engine.addBlock(BlockItem.of(id, body, new byte[0]), Digest.zero());

        String payload = "{\"type\":\"get_blocks_by_id_req\",\"block_id\":[\"" + id.hex() + "\"],\"return_block_blob\":true}";
        HttpResponse<String> response = post(port, payload, "Bearer rpc-secret");
        assertEquals(200, response.statusCode());
        JsonNode json = mapper.readTree(response.body());
        assertEquals("get_blocks_by_id_resp", json.get("type").asText());
        assertArrayEquals(body, Base64.getDecoder().decode(json.get("block_items").get(0).get("block_blob").asText()));
    }

    @Test
    void errorCodesMapToHttpStatus() throws Exception {
        int port = startServer("rpc-secret");
        byte[] body = "child".getBytes(StandardCharsets.UTF_8);
        String orphan = "{\"type\":\"add_block_req\",\"block_to_add\":{\"block_id\":\"" + Hashes.sha256Digest(body).hex()
                + "\",\"block_blob\":\"" + Base64.getEncoder().encodeToString(body) + "\"},"
                + "\"previous_block_id\":\"" + Hashes.sha256Digest(new byte[] {9}).hex() + "\"}";
        HttpResponse<String> missingParent = post(port, orphan, "Bearer rpc-secret");
        assertEquals(404, missingParent.statusCode());
        assertEquals("parent_not_found", mapper.readTree(missingParent.body()).get("error").asText());

        HttpResponse<String> unknown = post(port, "{\"type\":\"nope\"}", "Bearer rpc-secret");
        assertEquals(400, unknown.statusCode());
        assertEquals("unknown_request", mapper.readTree(unknown.body()).get("error").asText());
    }

    @Test
    void tokenIsRequiredWhenConfigured() throws Exception {
        int port = startServer("rpc-secret");
        HttpResponse<String> anonymous = post(port, "{\"type\":\"reserved_req\"}", null);
        assertEquals(401, anonymous.statusCode());

        HttpRequest withApiKey = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + "/status"))
                .header("X-API-Key", "rpc-secret")
                .GET()
                .build();
        HttpResponse<String> status = http.send(withApiKey, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, status.statusCode());
        JsonNode json = mapper.readTree(status.body());
        assertEquals("memory", json.get("backend").asText());
        assertEquals(0, json.get("blocks").asLong());
    }

    @Test
    void metricsAndOpenApiAreServed() throws Exception {
        int port = startServer(null);
        post(port, "{\"type\":\"reserved_req\"}", null);

        HttpResponse<String> metrics = get(port, "/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("blockstore.requests"));

        HttpResponse<String> openapi = get(port, "/openapi.json");
        assertEquals(200, openapi.statusCode());
        assertTrue(mapper.readTree(openapi.body()).get("paths").has("/block_store"));

        HttpResponse<String> wrongMethod = get(port, "/block_store");
        assertEquals(405, wrongMethod.statusCode());
    }

    private int startServer(String token) throws Exception {
        int port = freePort();
        engine = BlockStoreEngine.open(StoreConfig.defaults());
        server = new RpcServer(engine, "127.0.0.1", port, token);
        server.start();
        return port;
    }

    private HttpResponse<String> post(int port, String payload, String auth) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + "/block_store"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8));
        if (auth != null) {
            builder.header("Authorization", auth);
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(int port, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + path))
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}

package io.blockstore.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.blockstore.core.protocol.ProtocolLimits;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.logging.Logger;

/** Simple config holder for one block store instance. */
public final class StoreConfig {
    private static final Logger LOG = Logger.getLogger(StoreConfig.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    public enum Backend { MEMORY, ROCKSDB }

    public final Backend backend;
    public final Path dataDir;
    public final boolean syncWrites;
    public final boolean verifyDigests;
    public final boolean skipPointers;
    public final int maxIdsPerRequest;
    public final int maxBlocksPerRequest;
    public final int maxBlobBytes;

    public StoreConfig(Backend backend,
                       Path dataDir,
                       boolean syncWrites,
                       boolean verifyDigests,
                       boolean skipPointers,
                       int maxIdsPerRequest,
                       int maxBlocksPerRequest,
                       int maxBlobBytes) {
        if (backend == null) {
            throw new IllegalArgumentException("backend required");
        }
        if (backend == Backend.ROCKSDB && dataDir == null) {
            throw new IllegalArgumentException("RocksDB backend needs a data directory");
        }
        if (maxIdsPerRequest < 1 || maxBlocksPerRequest < 1 || maxBlobBytes < 1) {
            throw new IllegalArgumentException("request limits must be positive");
        }
        this.backend = backend;
        this.dataDir = dataDir;
        this.syncWrites = syncWrites;
        this.verifyDigests = verifyDigests;
        this.skipPointers = skipPointers;
        this.maxIdsPerRequest = maxIdsPerRequest;
        this.maxBlocksPerRequest = maxBlocksPerRequest;
        this.maxBlobBytes = maxBlobBytes;
    }

    /** Ephemeral in-memory store with digest checks and skip pointers on. */
    public static StoreConfig defaults() {
        return new StoreConfig(
                Backend.MEMORY,
                null,
                false,
                true,
                true,
                ProtocolLimits.MAX_IDS_PER_REQUEST,
                ProtocolLimits.MAX_BLOCKS_PER_REQUEST,
                ProtocolLimits.MAX_BLOB_BYTES
        );
    }

    public static StoreConfig rocks(Path dataDir) {
        return defaults().withBackend(Backend.ROCKSDB, dataDir).withSyncWrites(true);
    }

    public StoreConfig withBackend(Backend backend, Path dataDir) {
        return new StoreConfig(backend, dataDir, syncWrites, verifyDigests, skipPointers,
                maxIdsPerRequest, maxBlocksPerRequest, maxBlobBytes);
    }

    public StoreConfig withSyncWrites(boolean syncWrites) {
        return new StoreConfig(backend, dataDir, syncWrites, verifyDigests, skipPointers,
                maxIdsPerRequest, maxBlocksPerRequest, maxBlobBytes);
    }

    public StoreConfig withVerifyDigests(boolean verifyDigests) {
        return new StoreConfig(backend, dataDir, syncWrites, verifyDigests, skipPointers,
                maxIdsPerRequest, maxBlocksPerRequest, maxBlobBytes);
    }

    public StoreConfig withSkipPointers(boolean skipPointers) {
        return new StoreConfig(backend, dataDir, syncWrites, verifyDigests, skipPointers,
                maxIdsPerRequest, maxBlocksPerRequest, maxBlobBytes);
    }

    public StoreConfig withLimits(int maxIdsPerRequest, int maxBlocksPerRequest, int maxBlobBytes) {
        return new StoreConfig(backend, dataDir, syncWrites, verifyDigests, skipPointers,
                maxIdsPerRequest, maxBlocksPerRequest, maxBlobBytes);
    }

    /**
     * Overlay the keys present in a JSON object file on this config, e.g.
     * {@code {"backend":"rocksdb","dataDir":"/var/lib/bstore","verifyDigests":false}}.
     * Unknown keys are logged and ignored.
     */
    public StoreConfig overlay(Path jsonFile) {
        JsonNode root;
        try {
            root = JSON.readTree(Files.readAllBytes(jsonFile));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read store config from " + jsonFile, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Store config " + jsonFile + " must be a JSON object");
        }
        Backend b = backend;
        Path dir = dataDir;
        boolean sync = syncWrites;
        boolean verify = verifyDigests;
        boolean skips = skipPointers;
        int maxIds = maxIdsPerRequest;
        int maxBlocks = maxBlocksPerRequest;
        int maxBlob = maxBlobBytes;
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String key = it.next();
            JsonNode value = root.get(key);
            switch (key) {
                case "backend" -> b = parseBackend(value.asText());
                case "dataDir" -> dir = Path.of(value.asText());
                case "syncWrites" -> sync = value.asBoolean();
                case "verifyDigests" -> verify = value.asBoolean();
                case "skipPointers" -> skips = value.asBoolean();
                case "maxIdsPerRequest" -> maxIds = value.asInt();
                case "maxBlocksPerRequest" -> maxBlocks = value.asInt();
                case "maxBlobBytes" -> maxBlob = value.asInt();
                default -> LOG.warning(() -> "Ignoring unknown store config key '" + key + "' in " + jsonFile);
            }
        }
        return new StoreConfig(b, dir, sync, verify, skips, maxIds, maxBlocks, maxBlob);
    }

    public static Backend parseBackend(String value) {
        if (value == null) {
            throw new IllegalArgumentException("backend required");
        }
        try {
            return Backend.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown backend: " + value + " (expected memory or rocksdb)");
        }
    }

    @Override
    public String toString() {
        return "StoreConfig{backend=" + backend
                + ", dataDir=" + dataDir
                + ", syncWrites=" + syncWrites
                + ", verifyDigests=" + verifyDigests
                + ", skipPointers=" + skipPointers + '}';
    }
}

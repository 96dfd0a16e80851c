package io.blockstore.core.config;

import io.blockstore.core.protocol.ProtocolLimits;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StoreConfigTest {

    @Test
    void defaultsAreInMemoryWithChecksOn() {
        StoreConfig config = StoreConfig.defaults();
        assertEquals(StoreConfig.Backend.MEMORY, config.backend);
        assertNull(config.dataDir);
        assertTrue(config.verifyDigests);
        assertTrue(config.skipPointers);
        assertEquals(ProtocolLimits.MAX_IDS_PER_REQUEST, config.maxIdsPerRequest);
        assertEquals(ProtocolLimits.MAX_BLOB_BYTES, config.maxBlobBytes);
    }

    @Test
    void copiesOnlyChangeTheirField(@TempDir Path dir) {
        StoreConfig rocks = StoreConfig.rocks(dir);
        assertEquals(StoreConfig.Backend.ROCKSDB, rocks.backend);
        assertTrue(rocks.syncWrites);

        StoreConfig relaxed = rocks.withVerifyDigests(false).withSkipPointers(false).withLimits(1, 2, 3);
        assertFalse(relaxed.verifyDigests);
        assertFalse(relaxed.skipPointers);
        assertEquals(dir, relaxed.dataDir);
        assertEquals(2, relaxed.maxBlocksPerRequest);
        assertTrue(rocks.verifyDigests);
    }

    @Test
    void rejectsInvalidCombinations() {
        assertThrows(IllegalArgumentException.class,
                () -> StoreConfig.defaults().withBackend(StoreConfig.Backend.ROCKSDB, null));
        assertThrows(IllegalArgumentException.class,
                () -> StoreConfig.defaults().withLimits(0, 1, 1));
    }

    @Test
    void overlayAppliesKnownKeysAndIgnoresOthers(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("store.json");
        Files.writeString(file, """
                {"backend":"RocksDB","dataDir":"%s","verifyDigests":false,
                 "maxBlocksPerRequest":50,"colour":"blue"}
                """.formatted(dir.resolve("db").toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);

        StoreConfig config = StoreConfig.defaults().overlay(file);
        assertEquals(StoreConfig.Backend.ROCKSDB, config.backend);
        assertEquals(dir.resolve("db"), config.dataDir);
        assertFalse(config.verifyDigests);
        assertEquals(50, config.maxBlocksPerRequest);
        assertTrue(config.skipPointers);
    }

    @Test
    void overlayRejectsBadFiles(@TempDir Path dir) throws Exception {
        Path array = dir.resolve("array.json");
        Files.writeString(array, "[1,2]", StandardCharsets.UTF_8);
        assertThrows(IllegalArgumentException.class, () -> StoreConfig.defaults().overlay(array));
        assertThrows(IllegalStateException.class, () -> StoreConfig.defaults().overlay(dir.resolve("missing.json")));
    }

    @Test
    void parsesBackendNames() {
        assertEquals(StoreConfig.Backend.MEMORY, StoreConfig.parseBackend(" memory "));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> StoreConfig.parseBackend("leveldb"));
        assertTrue(ex.getMessage().contains("leveldb"));
    }
}

package io.blockstore.core.storage;

import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.Digest;
import io.blockstore.core.protocol.ErrorCode;
import io.blockstore.core.protocol.Hashes;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BlobStoreTest {

    private final InMemoryKeyValueStore backend = new InMemoryKeyValueStore();
    private final BlobStore blobs = new BlobStore(backend, Column.BLOCK_BLOBS);

    @Test
    void putThenGetReturnsBytes() {
        Digest id = id("a");
        assertEquals(BlobStore.PutResult.STORED, blobs.put(id, bytes("body-a")));
        assertArrayEquals(bytes("body-a"), blobs.get(id).orElseThrow());
        assertEquals(1, blobs.size());
    }

    @Test
    void identicalRePutIsDuplicate() {
        Digest id = id("a");
        blobs.put(id, bytes("body-a"));
        assertEquals(BlobStore.PutResult.DUPLICATE, blobs.put(id, bytes("body-a")));
        assertEquals(1, blobs.size());
    }

    @Test
    void differentBytesUnderSameIdConflictAndKeepOriginal() {
        Digest id = id("a");
        blobs.put(id, bytes("body-a"));
        BlockStoreException ex = assertThrows(BlockStoreException.class, () -> blobs.put(id, bytes("other")));
        assertEquals(ErrorCode.CONFLICT, ex.code());
        assertArrayEquals(bytes("body-a"), blobs.get(id).orElseThrow());
    }

    @Test
    void missingIdIsEmpty() {
        assertTrue(blobs.get(id("nope")).isEmpty());
        assertTrue(blobs.get(null).isEmpty());
    }

    @Test
    void columnsAreIndependent() {
        BlobStore receipts = new BlobStore(backend, Column.RECEIPT_BLOBS);
        Digest id = id("a");
        blobs.put(id, bytes("body"));
        receipts.put(id, bytes("receipt"));
        assertArrayEquals(bytes("body"), blobs.get(id).orElseThrow());
        assertArrayEquals(bytes("receipt"), receipts.get(id).orElseThrow());
    }

    @Test
    void concurrentWritersOfSameIdStoreExactlyOnce() throws Exception {
        Digest id = id("race");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BlobStore.PutResult>> results = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return blobs.put(id, bytes("same"));
            }));
        }
        start.countDown();
        int stored = 0;
        for (Future<BlobStore.PutResult> f : results) {
            if (f.get(5, TimeUnit.SECONDS) == BlobStore.PutResult.STORED) {
                stored++;
            }
        }
        pool.shutdownNow();
        assertEquals(1, stored);
    }

    private static Digest id(String label) {
        return Hashes.sha256Digest(bytes(label));
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}

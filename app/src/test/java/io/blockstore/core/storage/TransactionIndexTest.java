package io.blockstore.core.storage;

import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.Digest;
import io.blockstore.core.protocol.ErrorCode;
import io.blockstore.core.protocol.Hashes;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransactionIndexTest {

    @Test
    void lookupsKeepInputOrderAndReportMisses() {
        TransactionIndex index = new TransactionIndex(new InMemoryKeyValueStore());
        byte[] a = "tx a".getBytes(StandardCharsets.UTF_8);
        byte[] b = "tx b".getBytes(StandardCharsets.UTF_8);
        Digest idA = Hashes.sha256Digest(a);
        Digest idB = Hashes.sha256Digest(b);
        Digest missing = Hashes.sha256Digest(new byte[] {1});

        assertEquals(BlobStore.PutResult.STORED, index.add(idA, a));
        assertEquals(BlobStore.PutResult.STORED, index.add(idB, b));
        assertEquals(BlobStore.PutResult.DUPLICATE, index.add(idA, a));

        List<Optional<byte[]>> found = index.getMany(List.of(idB, missing, idA));
        assertArrayEquals(b, found.get(0).orElseThrow());
        assertTrue(found.get(1).isEmpty());
        assertArrayEquals(a, found.get(2).orElseThrow());
        assertEquals(2, index.size());
    }

    @Test
    void differentBodyUnderSameIdConflicts() {
        TransactionIndex index = new TransactionIndex(new InMemoryKeyValueStore());
        Digest id = Hashes.sha256Digest(new byte[] {7});
        index.add(id, new byte[] {7});
        BlockStoreException ex = assertThrows(BlockStoreException.class, () -> index.add(id, new byte[] {8}));
        assertEquals(ErrorCode.CONFLICT, ex.code());
        assertArrayEquals(new byte[] {7}, index.get(id).orElseThrow());
    }
}

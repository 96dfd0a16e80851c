package io.blockstore.core.storage;

import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.Digest;
import io.blockstore.core.protocol.ErrorCode;
import io.blockstore.core.protocol.Hashes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BlockIndexTest {

    // Each row continues from its first element; 0 stands for "no previous block".
    private static final long[][] FORK_TREE = {
            {0, 101, 102, 103, 104, 105, 106, 107, 108, 109, 110, 111, 112, 113, 114, 115, 116, 117, 118, 119, 120},
            {103, 204, 205, 206, 207, 208, 209, 210, 211},
            {103, 304, 305, 306, 307},
            {106, 407, 408, 409, 410, 411, 412, 413, 414, 415, 416, 417, 418, 419},
            {109, 510, 511},
            {112, 613, 614},
    };

    private final InMemoryKeyValueStore backend = new InMemoryKeyValueStore();

    @Test
    void genesisIsHeightZeroAndChildrenCountUp() {
        BlockIndex index = new BlockIndex(backend, true);
        List<Digest> chain = linearChain(index, 10);
        for (int i = 0; i < chain.size(); i++) {
            assertEquals(i, index.get(chain.get(i)).orElseThrow().height());
        }
        assertTrue(index.get(chain.get(0)).orElseThrow().isGenesis());
        assertEquals(10, index.size());
    }

    @Test
    void ancestryReturnsRequestedWindowAscending() {
        BlockIndex index = new BlockIndex(backend, true);
        List<Digest> chain = linearChain(index, 10);

        List<Digest> window = ids(index.getAncestry(chain.get(9), 3, 4));
        assertEquals(chain.subList(3, 7), window);

        List<Digest> all = ids(index.getAncestry(chain.get(9), 0, 10));
        assertEquals(chain, all);
    }

    @Test
    void windowPastHeadIsTruncatedNotAnError() {
        BlockIndex index = new BlockIndex(backend, true);
        List<Digest> chain = linearChain(index, 5);
        assertEquals(chain.subList(2, 5), ids(index.getAncestry(chain.get(4), 2, 100)));
        assertEquals(List.of(chain.get(4)), ids(index.getAncestry(chain.get(4), 4, 1)));
    }

    @Test
    void ancestryRejectsBadRanges() {
        BlockIndex index = new BlockIndex(backend, true);
        List<Digest> chain = linearChain(index, 3);

        BlockStoreException above = assertThrows(BlockStoreException.class,
                () -> index.getAncestry(chain.get(2), 3, 1));
        assertEquals(ErrorCode.INVALID_RANGE, above.code());

        BlockStoreException zero = assertThrows(BlockStoreException.class,
                () -> index.getAncestry(chain.get(2), 0, 0));
        assertEquals(ErrorCode.INVALID_RANGE, zero.code());

        BlockStoreException missing = assertThrows(BlockStoreException.class,
                () -> index.getAncestry(id(999), 0, 1));
        assertEquals(ErrorCode.NOT_FOUND, missing.code());
    }

    @Test
    void unknownParentIsRejectedWithoutVisibleState() {
        BlockIndex index = new BlockIndex(backend, true);
        BlockStoreException ex = assertThrows(BlockStoreException.class, () -> index.insert(id(2), id(1)));
        assertEquals(ErrorCode.PARENT_NOT_FOUND, ex.code());
        assertTrue(index.get(id(2)).isEmpty());
        assertEquals(0, backend.count(Column.BLOCK_INDEX));
    }

    @Test
    void reinsertUnderSameParentIsDuplicateAndOtherParentConflicts() {
        BlockIndex index = new BlockIndex(backend, true);
        index.insert(id(1), Digest.zero());
        index.insert(id(2), id(1));
        index.insert(id(3), id(2));

        BlockIndex.Insertion again = index.insert(id(3), id(2));
        assertTrue(again.duplicate());
        assertEquals(2, again.record().height());

        BlockStoreException ex = assertThrows(BlockStoreException.class, () -> index.insert(id(3), id(1)));
        assertEquals(ErrorCode.CONFLICT, ex.code());
        assertEquals(3, index.size());

        assertTrue(index.insert(id(1), null).duplicate());
    }

    @Test
    void siblingsAreReportedAsForks() {
        BlockIndex index = new BlockIndex(backend, true);
        index.insert(id(1), Digest.zero());
        assertFalse(index.insert(id(2), id(1)).forked());
        assertTrue(index.insert(id(3), id(1)).forked());
        assertEquals(List.of(id(2), id(3)), index.children(id(1)));
        assertTrue(index.children(id(3)).isEmpty());
    }

    @Test
    void ancestorAtFollowsCanonicalChainOfTheGivenBlock() {
        BlockIndex index = new BlockIndex(backend, true);
        Map<Long, Long> parents = buildForkTree(index);
        assertEquals(id(103), index.ancestorAt(id(211), 2).orElseThrow().id());
        assertEquals(id(205), index.ancestorAt(id(211), 4).orElseThrow().id());
        assertEquals(id(101), index.ancestorAt(id(419), 0).orElseThrow().id());
        assertTrue(index.ancestorAt(id(511), 20).isEmpty());
        assertEquals(parents.size(), index.size());
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void forkTreeAncestryMatchesNaiveParentWalk(boolean skipPointers) {
        BlockIndex index = new BlockIndex(backend, skipPointers);
        Map<Long, Long> parents = buildForkTree(index);

        for (long head : parents.keySet()) {
            List<Digest> expectedChain = naiveChain(parents, head);
            long headHeight = expectedChain.size() - 1;
            assertEquals(headHeight, index.get(id(head)).orElseThrow().height(), "height of " + head);
            for (long start = 0; start <= headHeight; start++) {
                for (int count = 1; count <= headHeight - start + 2; count++) {
                    int end = (int) Math.min(start + count, headHeight + 1);
                    List<Digest> expected = expectedChain.subList((int) start, end);
                    List<Digest> actual = ids(index.getAncestry(id(head), start, count));
                    assertEquals(expected, actual, "head=" + head + " start=" + start + " count=" + count);
                }
            }
        }
    }

    @Test
    void indexIsRebuiltFromBackend() {
        BlockIndex first = new BlockIndex(backend, true);
        Map<Long, Long> parents = buildForkTree(first);

        BlockIndex reloaded = new BlockIndex(backend, true);
        assertEquals(parents.size(), reloaded.size());
        assertEquals(ids(first.getAncestry(id(419), 0, 30)), ids(reloaded.getAncestry(id(419), 0, 30)));
        assertEquals(Set.copyOf(first.children(id(103))), Set.copyOf(reloaded.children(id(103))));
        assertEquals(3, reloaded.children(id(103)).size());
        assertTrue(reloaded.insert(id(120), id(119)).duplicate());
    }

    @Test
    void danglingRecordSurfacesAsStorageFailure() {
        BlockRecord orphan = new BlockRecord(id(7), 1, List.of(id(6)), List.of(id(6)));
        backend.put(Column.BLOCK_INDEX, orphan.id().encode(), BlockRecordCodec.encode(orphan));

        BlockIndex index = new BlockIndex(backend, true);
        BlockStoreException ex = assertThrows(BlockStoreException.class, () -> index.getAncestry(id(7), 0, 2));
        assertEquals(ErrorCode.STORAGE_FAILURE, ex.code());
    }

    private static Map<Long, Long> buildForkTree(BlockIndex index) {
        Map<Long, Long> parents = new HashMap<>();
        for (long[] row : FORK_TREE) {
            for (int j = 1; j < row.length; j++) {
                Digest parent = row[j - 1] == 0 ? Digest.zero() : id(row[j - 1]);
                index.insert(id(row[j]), parent);
                parents.put(row[j], row[j - 1]);
            }
        }
        return parents;
    }

    private static List<Digest> naiveChain(Map<Long, Long> parents, long head) {
        List<Digest> chain = new ArrayList<>();
        long cursor = head;
        while (cursor != 0) {
            chain.add(id(cursor));
            cursor = parents.get(cursor);
        }
        Collections.reverse(chain);
        return chain;
    }

    private static List<Digest> linearChain(BlockIndex index, int length) {
        List<Digest> chain = new ArrayList<>();
        Digest previous = Digest.zero();
        for (int i = 0; i < length; i++) {
            Digest id = id(i + 1);
            index.insert(id, previous);
            chain.add(id);
            previous = id;
        }
        return chain;
    }

    private static List<Digest> ids(List<BlockRecord> records) {
        return records.stream().map(BlockRecord::id).collect(Collectors.toList());
    }

    static Digest id(long n) {
        return Hashes.sha256Digest(("block-" + n).getBytes(StandardCharsets.UTF_8));
    }
}

package io.blockstore.core.storage;

import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.Digest;
import io.blockstore.core.protocol.ErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Block id → {@link BlockRecord} map with height bookkeeping and ancestry walks.
 *
 * Records live in a flat table keyed by digest and name their parent by key.
 * The table is rebuilt from the {@link Column#BLOCK_INDEX} column on
 * construction and written through on every insert, before the new record
 * becomes visible. One writer at a time; readers share a read lock.
 *
 * Notes:
 * - Height is computed here (parent height + 1), never taken from callers.
 * - Only the canonical (first) parent drives height and ancestry, so fork
 *   ambiguity is resolved by whichever head the caller walks from.
 */
public final class BlockIndex {

    /** Result of {@link #insert}. {@code forked} is set when the parent already had a child. */
    public record Insertion(BlockRecord record, boolean duplicate, boolean forked) {}

    private static final Logger LOG = Logger.getLogger(BlockIndex.class.getName());

    private final KeyValueStore backend;
    private final boolean useSkipPointers;

    /** Map: blockId -> record */
    private final Map<Digest, BlockRecord> records = new HashMap<>();

    /** Map: parentId -> child ids, insertion order */
    private final Map<Digest, List<Digest>> children = new HashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public BlockIndex(KeyValueStore backend, boolean useSkipPointers) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.useSkipPointers = useSkipPointers;
        load();
    }

    /**
     * Link {@code id} under {@code parentId}; a null or zero parent makes it a
     * genesis block at height 0.
     *
     * @throws BlockStoreException PARENT_NOT_FOUND when the parent is unknown,
     *                             CONFLICT when {@code id} exists under another parent
     */
    public Insertion insert(Digest id, Digest parentId) {
        if (id == null) {
            throw BlockStoreException.invalid("block id required");
        }
        boolean genesis = parentId == null || parentId.isZero();
        lock.writeLock().lock();
        try {
            BlockRecord existing = records.get(id);
            if (existing != null) {
                Optional<Digest> existingParent = existing.canonicalParent();
                boolean sameParent = genesis ? existingParent.isEmpty()
                        : existingParent.isPresent() && existingParent.get().equals(parentId);
                if (sameParent) {
                    return new Insertion(existing, true, false);
                }
                throw new BlockStoreException(ErrorCode.CONFLICT,
                        "Block " + id.hex() + " already stored with a different previous block");
            }

            BlockRecord record;
            if (genesis) {
                record = BlockRecord.genesis(id);
            } else {
                BlockRecord parent = records.get(parentId);
                if (parent == null) {
                    throw new BlockStoreException(ErrorCode.PARENT_NOT_FOUND,
                            "Previous block " + parentId.hex() + " is not in the store");
                }
                long height = Math.addExact(parent.height(), 1L);
                record = new BlockRecord(id, height, List.of(parentId), resolveSkips(parent, height));
            }

            backend.put(Column.BLOCK_INDEX, id.encode(), BlockRecordCodec.encode(record));

            records.put(id, record);
            boolean forked = false;
            if (!genesis) {
                List<Digest> siblings = children.computeIfAbsent(parentId, k -> new ArrayList<>(1));
                siblings.add(id);
                forked = siblings.size() > 1;
                if (forked) {
                    LOG.info(() -> "Fork at height " + record.height() + ": " + siblings.size()
                            + " children under " + parentId);
                }
            }
            return new Insertion(record, false, forked);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<BlockRecord> get(Digest id) {
        if (id == null) return Optional.empty();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(records.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** One element per input id, in input order; misses are empty. */
    public List<Optional<BlockRecord>> getById(List<Digest> ids) {
        List<Optional<BlockRecord>> out = new ArrayList<>(ids.size());
        lock.readLock().lock();
        try {
            for (Digest id : ids) {
                out.add(id == null ? Optional.empty() : Optional.ofNullable(records.get(id)));
            }
        } finally {
            lock.readLock().unlock();
        }
        return out;
    }

    /**
     * Canonical-parent chain ending at {@code headId}, restricted to heights
     * {@code [startHeight, startHeight + count - 1]} and ascending by height.
     * The window is cut at the head, so a short result is not an error.
     *
     * @throws BlockStoreException NOT_FOUND for an unknown head, INVALID_RANGE when
     *                             {@code count < 1} or {@code startHeight} is above the head
     */
    public List<BlockRecord> getAncestry(Digest headId, long startHeight, long count) {
        if (headId == null) {
            throw BlockStoreException.invalid("head block id required");
        }
        if (count < 1) {
            throw new BlockStoreException(ErrorCode.INVALID_RANGE, "num_blocks must be positive");
        }
        if (startHeight < 0) {
            throw new BlockStoreException(ErrorCode.INVALID_RANGE, "negative start height " + startHeight);
        }
        lock.readLock().lock();
        try {
            BlockRecord head = records.get(headId);
            if (head == null) {
                throw new BlockStoreException(ErrorCode.NOT_FOUND, "Head block " + headId.hex() + " is not in the store");
            }
            if (startHeight > head.height()) {
                throw new BlockStoreException(ErrorCode.INVALID_RANGE,
                        "Start height " + startHeight + " is above head height " + head.height());
            }
            long top = (count - 1L) > head.height() - startHeight ? head.height() : startHeight + count - 1L;

            BlockRecord cursor = ancestorAtLocked(head, top);
            List<BlockRecord> out = new ArrayList<>((int) (top - startHeight + 1));
            while (true) {
                out.add(cursor);
                if (cursor.height() == startHeight) {
                    break;
                }
                cursor = parentOf(cursor);
            }
            Collections.reverse(out);
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Ancestor of {@code id} (or the block itself) at the given height. */
    public Optional<BlockRecord> ancestorAt(Digest id, long height) {
        if (id == null || height < 0) return Optional.empty();
        lock.readLock().lock();
        try {
            BlockRecord from = records.get(id);
            if (from == null || height > from.height()) {
                return Optional.empty();
            }
            return Optional.of(ancestorAtLocked(from, height));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Child ids of {@code parentId} in insertion order. */
    public List<Digest> children(Digest parentId) {
        if (parentId == null) {
            return Collections.emptyList();
        }
        lock.readLock().lock();
        try {
            List<Digest> list = children.get(parentId);
            return list == null ? Collections.emptyList() : List.copyOf(list);
        } finally {
            lock.readLock().unlock();
        }
    }

    public long size() {
        lock.readLock().lock();
        try {
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // -------------- helpers ----------------

    private List<Digest> resolveSkips(BlockRecord parent, long height) {
        long[] heights = SkipList.previousHeights(height);
        List<Digest> skips = new ArrayList<>(heights.length);
        for (long h : heights) {
            skips.add(h == parent.height() ? parent.id() : ancestorAtLocked(parent, h).id());
        }
        return skips;
    }

    private BlockRecord ancestorAtLocked(BlockRecord from, long height) {
        BlockRecord cursor = from;
        while (cursor.height() > height) {
            if (useSkipPointers && !cursor.skipIds().isEmpty()) {
                int index = Math.min(SkipList.jumpIndex(cursor.height(), height), cursor.skipIds().size() - 1);
                long expected = SkipList.heightAt(cursor.height(), index);
                BlockRecord next = resolve(cursor.skipIds().get(index), cursor);
                if (next.height() != expected) {
                    throw corrupt("skip entry " + index + " of " + cursor.id() + " has height " + next.height()
                            + ", expected " + expected);
                }
                cursor = next;
            } else {
                cursor = parentOf(cursor);
            }
        }
        return cursor;
    }

    private BlockRecord parentOf(BlockRecord child) {
        Digest parentId = child.canonicalParent()
                .orElseThrow(() -> corrupt("block " + child.id() + " at height " + child.height() + " has no parent"));
        BlockRecord parent = resolve(parentId, child);
        if (parent.height() != child.height() - 1) {
            throw corrupt("parent of " + child.id() + " has height " + parent.height());
        }
        return parent;
    }

    private BlockRecord resolve(Digest id, BlockRecord referrer) {
        BlockRecord record = records.get(id);
        if (record == null) {
            throw corrupt("block " + referrer.id() + " links to missing " + id);
        }
        return record;
    }

    private static BlockStoreException corrupt(String detail) {
        return new BlockStoreException(ErrorCode.STORAGE_FAILURE, "Corrupt block index: " + detail);
    }

    private void load() {
        List<BlockRecord> loaded = new ArrayList<>();
        backend.forEach(Column.BLOCK_INDEX, (key, value) -> loaded.add(BlockRecordCodec.decode(value)));
        loaded.sort(Comparator.comparingLong(BlockRecord::height).thenComparing(BlockRecord::id));
        for (BlockRecord record : loaded) {
            records.put(record.id(), record);
            record.canonicalParent().ifPresent(parent -> {
                if (!records.containsKey(parent)) {
                    LOG.warning(() -> "Index record " + record.id() + " references missing parent " + parent);
                }
                children.computeIfAbsent(parent, k -> new ArrayList<>(1)).add(record.id());
            });
        }
        if (!loaded.isEmpty()) {
            LOG.info(() -> "Loaded " + loaded.size() + " block index records");
        }
    }
}

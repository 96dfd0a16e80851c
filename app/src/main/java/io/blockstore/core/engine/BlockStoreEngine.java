package io.blockstore.core.engine;

import io.blockstore.core.config.StoreConfig;
import io.blockstore.core.metrics.StoreMetrics;
import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.ContentHasher;
import io.blockstore.core.protocol.Digest;
import io.blockstore.core.protocol.ErrorCode;
import io.blockstore.core.protocol.messages.BlockItem;
import io.blockstore.core.protocol.messages.TransactionItem;
import io.blockstore.core.storage.BlobStore;
import io.blockstore.core.storage.BlockIndex;
import io.blockstore.core.storage.BlockRecord;
import io.blockstore.core.storage.Column;
import io.blockstore.core.storage.InMemoryKeyValueStore;
import io.blockstore.core.storage.KeyValueStore;
import io.blockstore.core.storage.RocksDBKeyValueStore;
import io.blockstore.core.storage.TransactionIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Wires the blob stores, block index and transaction index over one backend.
 * Construct once per data directory; all methods are safe to call from
 * transport threads concurrently.
 */
public final class BlockStoreEngine implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(BlockStoreEngine.class.getName());
    private static final byte[] EMPTY = new byte[0];

    private final KeyValueStore backend;
    private final StoreConfig config;
    private final ContentHasher hasher;
    private final BlobStore blockBlobs;
    private final BlobStore receiptBlobs;
    private final BlockIndex index;
    private final TransactionIndex transactions;

    public BlockStoreEngine(KeyValueStore backend, StoreConfig config, ContentHasher hasher) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.config = Objects.requireNonNull(config, "config");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.blockBlobs = new BlobStore(backend, Column.BLOCK_BLOBS);
        this.receiptBlobs = new BlobStore(backend, Column.RECEIPT_BLOBS);
        this.index = new BlockIndex(backend, config.skipPointers);
        this.transactions = new TransactionIndex(backend);
    }

    /** Convenience factory: opens the backend named by {@code config} with SHA2-256 ids. */
    public static BlockStoreEngine open(StoreConfig config) {
        return new BlockStoreEngine(openBackend(config), config, ContentHasher.sha256());
    }

    public static KeyValueStore openBackend(StoreConfig config) {
        if (config.backend == StoreConfig.Backend.ROCKSDB) {
            return RocksDBKeyValueStore.open(config.dataDir, config.syncWrites);
        }
        return new InMemoryKeyValueStore();
    }

    /**
     * Store body and receipt, then link the block under {@code previousBlockId}.
     * A zero or null previous id adds a genesis block.
     */
    public AddBlockResult addBlock(BlockItem item, Digest previousBlockId) {
        if (item == null || item.blockId() == null) {
            throw BlockStoreException.invalid("block_to_add with a block_id is required");
        }
        Digest id = item.blockId();
        checkBlobSize("block_blob", item.blockBlob());
        checkBlobSize("block_receipt_blob", item.blockReceiptBlob());
        if (item.blockBlob().length > 0) {
            verify(id, item.blockBlob());
        }

        try {
            // Blobs go in before the index entry that makes them reachable.
            if (item.blockBlob().length > 0) {
                blockBlobs.put(id, item.blockBlob());
            }
            if (item.blockReceiptBlob().length > 0) {
                receiptBlobs.put(id, item.blockReceiptBlob());
            }
            BlockIndex.Insertion insertion = index.insert(id, previousBlockId);
            StoreMetrics.blockAdded(insertion.duplicate(), insertion.forked());
            if (!insertion.duplicate()) {
                LOG.fine(() -> "Added block " + id + " at height " + insertion.record().height());
            }
            return new AddBlockResult(id, insertion.record().height(), insertion.duplicate());
        } catch (BlockStoreException e) {
            if (e.code() == ErrorCode.CONFLICT) {
                StoreMetrics.conflict();
            }
            throw e;
        }
    }

    /** Unknown ids are left out; found blocks keep input order. */
    public List<BlockItem> getBlocksById(List<Digest> ids, boolean wantBody, boolean wantReceipt) {
        checkBatch(ids, "block_id");
        List<BlockItem> out = new ArrayList<>(ids.size());
        for (Optional<BlockRecord> record : index.getById(ids)) {
            record.ifPresent(r -> out.add(hydrate(r, wantBody, wantReceipt)));
        }
        return out;
    }

    /**
     * Up to {@code numBlocks} ancestors of the head starting at {@code startHeight}, ascending.
     * The window is capped at {@code maxBlocksPerRequest}; like a window running past the
     * head, a capped window just comes back short.
     */
    public List<BlockItem> getBlocksByHeight(Digest headId,
                                             long startHeight,
                                             long numBlocks,
                                             boolean wantBody,
                                             boolean wantReceipt) {
        long window = Math.min(numBlocks, config.maxBlocksPerRequest);
        List<BlockRecord> chain = StoreMetrics.recordAncestry(() -> index.getAncestry(headId, startHeight, window));
        StoreMetrics.ancestryReturned(chain.size());
        List<BlockItem> out = new ArrayList<>(chain.size());
        for (BlockRecord r : chain) {
            out.add(hydrate(r, wantBody, wantReceipt));
        }
        return out;
    }

    public BlobStore.PutResult addTransaction(Digest id, byte[] blob) {
        if (id == null) {
            throw BlockStoreException.invalid("transaction_id required");
        }
        // Stored transaction bodies always hash to their id.
        if (blob == null || blob.length == 0) {
            throw BlockStoreException.invalid("transaction_blob required for " + id.hex());
        }
        checkBlobSize("transaction_blob", blob);
        verify(id, blob);
        try {
            BlobStore.PutResult result = transactions.add(id, blob);
            StoreMetrics.transactionAdded(result == BlobStore.PutResult.DUPLICATE);
            return result;
        } catch (BlockStoreException e) {
            if (e.code() == ErrorCode.CONFLICT) {
                StoreMetrics.conflict();
            }
            throw e;
        }
    }

    /** Unknown ids are left out; each item carries its id. */
    public List<TransactionItem> getTransactionsById(List<Digest> ids) {
        checkBatch(ids, "transaction_ids");
        List<TransactionItem> out = new ArrayList<>(ids.size());
        List<Optional<byte[]>> found = transactions.getMany(ids);
        for (int i = 0; i < ids.size(); i++) {
            Digest id = ids.get(i);
            found.get(i).ifPresent(body -> out.add(new TransactionItem(id, body)));
        }
        return out;
    }

    /** Placeholder variant; intentionally does nothing. */
    public void reserved() {
    }

    public StoreStats stats() {
        return new StoreStats(index.size(), blockBlobs.size(), receiptBlobs.size(), transactions.size());
    }

    public Optional<BlockRecord> record(Digest id) {
        return index.get(id);
    }

    /** Ids of blocks linked directly under {@code parentId}; more than one means a fork. */
    public List<Digest> children(Digest parentId) {
        return index.children(parentId);
    }

    public StoreConfig config() {
        return config;
    }

    @Override
    public void close() {
        backend.close();
    }

    // -------------- helpers ----------------

    private BlockItem hydrate(BlockRecord r, boolean wantBody, boolean wantReceipt) {
        byte[] body = wantBody ? blockBlobs.get(r.id()).orElse(EMPTY) : EMPTY;
        byte[] receipt = wantReceipt ? receiptBlobs.get(r.id()).orElse(EMPTY) : EMPTY;
        return new BlockItem(r.id(), r.height(), body, receipt);
    }

    private void verify(Digest id, byte[] content) {
        if (!config.verifyDigests) {
            return;
        }
        Digest actual = hasher.hash(content);
        if (!actual.equals(id)) {
            throw new BlockStoreException(ErrorCode.DIGEST_MISMATCH,
                    "Id " + id.hex() + " does not match content digest " + actual.hex());
        }
    }

    private void checkBatch(List<Digest> ids, String field) {
        if (ids == null) {
            throw BlockStoreException.invalid(field + " required");
        }
        if (ids.size() > config.maxIdsPerRequest) {
            throw BlockStoreException.invalid(field + " has " + ids.size() + " entries, limit is " + config.maxIdsPerRequest);
        }
    }

    private void checkBlobSize(String field, byte[] blob) {
        if (blob.length > config.maxBlobBytes) {
            throw BlockStoreException.invalid(field + " is " + blob.length + " bytes, limit is " + config.maxBlobBytes);
        }
    }
}

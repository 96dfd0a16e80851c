package io.blockstore.core.storage;

import io.blockstore.core.protocol.Digest;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Transactions by content digest; no relation to blocks. */
public final class TransactionIndex {

    private final BlobStore blobs;

    public TransactionIndex(KeyValueStore backend) {
        this.blobs = new BlobStore(backend, Column.TRANSACTIONS);
    }

    /** Idempotent for identical bodies; CONFLICT for a different body under the same id. */
    public BlobStore.PutResult add(Digest id, byte[] body) {
        return blobs.put(id, body);
    }

    public Optional<byte[]> get(Digest id) {
        return blobs.get(id);
    }

    /** One element per input id, in input order; misses are empty. */
    public List<Optional<byte[]>> getMany(List<Digest> ids) {
        List<Optional<byte[]>> out = new ArrayList<>(ids.size());
        for (Digest id : ids) {
            out.add(get(id));
        }
        return out;
    }

    public long size() {
        return blobs.size();
    }
}

package io.blockstore.core.storage;

import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.Digest;
import io.blockstore.core.protocol.ErrorCode;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Append-only digest → bytes storage over one backend column.
 *
 * Re-putting identical bytes is a no-op; different bytes under an existing id
 * are rejected and the stored value is left untouched. Writers of the same
 * key are serialized through a lock stripe, writers of different keys mostly
 * are not, and readers never lock.
 */
public final class BlobStore {

    public enum PutResult { STORED, DUPLICATE }

    private static final Logger LOG = Logger.getLogger(BlobStore.class.getName());
    private static final int STRIPES = 64;

    private final KeyValueStore backend;
    private final Column column;
    private final Object[] stripes = new Object[STRIPES];

    public BlobStore(KeyValueStore backend, Column column) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.column = Objects.requireNonNull(column, "column");
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new Object();
        }
    }

    public PutResult put(Digest id, byte[] bytes) {
        if (id == null) throw BlockStoreException.invalid("blob id required");
        if (bytes == null) throw BlockStoreException.invalid("blob bytes required for " + id);
        byte[] key = id.encode();
        synchronized (stripeFor(id)) {
            Optional<byte[]> existing = backend.get(column, key);
            if (existing.isPresent()) {
                if (Arrays.equals(existing.get(), bytes)) {
                    return PutResult.DUPLICATE;
                }
                LOG.warning(() -> "Rejected conflicting " + column.familyName() + " entry for " + id);
                throw new BlockStoreException(ErrorCode.CONFLICT,
                        "Different content already stored for " + id.hex() + " in " + column.familyName());
            }
            backend.put(column, key, bytes);
            return PutResult.STORED;
        }
    }

    public Optional<byte[]> get(Digest id) {
        if (id == null) return Optional.empty();
        return backend.get(column, id.encode());
    }

    public long size() {
        return backend.count(column);
    }

    private Object stripeFor(Digest id) {
        return stripes[Math.floorMod(id.hashCode(), STRIPES)];
    }
}

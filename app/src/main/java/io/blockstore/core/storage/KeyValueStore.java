package io.blockstore.core.storage;

import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Minimal key–value API so we can swap implementations (RocksDB, in-memory).
 * Keys/values are raw bytes; callers handle encoding. Implementations are
 * thread-safe; callers provide any compare-then-write atomicity they need.
 */
public interface KeyValueStore extends AutoCloseable {

    Optional<byte[]> get(Column column, byte[] key);

    /** Durable once this returns (subject to the backend's sync setting). */
    void put(Column column, byte[] key, byte[] value);

    /** Full scan in backend order. Used when rebuilding in-memory indexes. */
    void forEach(Column column, BiConsumer<byte[], byte[]> consumer);

    long count(Column column);

    /** Drop all data in every column. */
    void reset();

    @Override
    void close();
}

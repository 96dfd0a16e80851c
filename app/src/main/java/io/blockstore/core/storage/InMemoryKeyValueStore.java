package io.blockstore.core.storage;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Simple, fast in-memory backend.
 * Good for tests and ephemeral stores; nothing survives close().
 *
 * Keys are wrapped in a tiny BytesKey so they can be used in hash maps safely
 * (byte[] doesn't implement value-based equals/hashCode).
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<Column, Map<BytesKey, byte[]>> columns = new EnumMap<>(Column.class);

    public InMemoryKeyValueStore() {
        for (Column column : Column.values()) {
            columns.put(column, new ConcurrentHashMap<>());
        }
    }

    @Override
    public Optional<byte[]> get(Column column, byte[] key) {
        Objects.requireNonNull(key, "key");
        byte[] value = columns.get(column).get(new BytesKey(key));
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void put(Column column, byte[] key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        columns.get(column).put(new BytesKey(key), value.clone());
    }

    @Override
    public void forEach(Column column, BiConsumer<byte[], byte[]> consumer) {
        for (Map.Entry<BytesKey, byte[]> e : columns.get(column).entrySet()) {
            consumer.accept(e.getKey().bytes.clone(), e.getValue().clone());
        }
    }

    @Override
    public long count(Column column) {
        return columns.get(column).size();
    }

    @Override
    public synchronized void reset() {
        for (Map<BytesKey, byte[]> column : columns.values()) {
            column.clear();
        }
    }

    @Override
    public void close() {
        // nothing to release
    }

    /** Value-based key wrapper around byte[] so we can use it in maps/sets. */
    private static final class BytesKey {
        private final byte[] bytes;
        private final int hash; // cache hashCode

        BytesKey(byte[] src) {
            this.bytes = src.clone();
            this.hash = Arrays.hashCode(this.bytes);
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BytesKey)) return false;
            BytesKey other = (BytesKey) o;
            return Arrays.equals(this.bytes, other.bytes);
        }

        @Override public int hashCode() {
            return hash;
        }
    }
}

package io.blockstore.core.storage;

import io.blockstore.core.protocol.BlockStoreException;
import io.blockstore.core.protocol.ErrorCode;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent backend using RocksDB, one column family per {@link Column}:
 *  - "block_blobs"   : key = multihash(block id),  val = block body
 *  - "receipt_blobs" : key = multihash(block id),  val = block receipt
 *  - "transactions"  : key = multihash(tx id),     val = transaction body
 *  - "block_index"   : key = multihash(block id),  val = encoded BlockRecord
 */
public final class RocksDBKeyValueStore implements KeyValueStore {

    private static final Logger LOG = Logger.getLogger(RocksDBKeyValueStore.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final Path dataDir;
    private final RocksDB db;
    private final DBOptions dbOptions;
    private final WriteOptions writeOptions;
    private final ColumnFamilyHandle defaultHandle;
    private final Map<Column, ColumnFamilyHandle> handles;

    // Reads and writes run concurrently; reset/close take the write side so no
    // call touches a dropped column family or a closed handle.
    private final ReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private boolean closed;

    private RocksDBKeyValueStore(Path dataDir,
                                 RocksDB db,
                                 DBOptions dbOptions,
                                 WriteOptions writeOptions,
                                 ColumnFamilyHandle defaultHandle,
                                 Map<Column, ColumnFamilyHandle> handles) {
        this.dataDir = dataDir;
        this.db = db;
        this.dbOptions = dbOptions;
        this.writeOptions = writeOptions;
        this.defaultHandle = defaultHandle;
        this.handles = handles;
    }

    /** Factory: open/create a store in the given directory. */
    public static RocksDBKeyValueStore open(Path dataDir, boolean syncWrites) {
        Objects.requireNonNull(dataDir, "dataDir");
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new BlockStoreException(ErrorCode.STORAGE_FAILURE, "Cannot create data directory " + dataDir, e);
        }
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        WriteOptions wo = new WriteOptions().setSync(syncWrites);

        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
        for (Column column : Column.values()) {
            descriptors.add(new ColumnFamilyDescriptor(column.familyNameBytes()));
        }
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();
        try {
            RocksDB db = RocksDB.open(dbOpts, dataDir.toString(), descriptors, cfHandles);
            // handle order follows descriptor order; default CF is index 0
            Map<Column, ColumnFamilyHandle> byColumn = new EnumMap<>(Column.class);
            Column[] columns = Column.values();
            for (int i = 0; i < columns.length; i++) {
                byColumn.put(columns[i], cfHandles.get(i + 1));
            }
            LOG.info(() -> "Opened RocksDB block store at " + dataDir + (syncWrites ? " (sync writes)" : ""));
            return new RocksDBKeyValueStore(dataDir, db, dbOpts, wo, cfHandles.get(0), byColumn);
        } catch (RocksDBException e) {
            wo.close();
            dbOpts.close();
            throw new BlockStoreException(ErrorCode.STORAGE_FAILURE, "Failed to open RocksDB at " + dataDir, e);
        }
    }

    public Path dataDir() { return dataDir; }

    @Override
    public Optional<byte[]> get(Column column, byte[] key) {
        Objects.requireNonNull(key, "key");
        lifecycleLock.readLock().lock();
        try {
            ensureOpen();
            byte[] value = db.get(handles.get(column), key);
            return Optional.ofNullable(value);
        } catch (RocksDBException e) {
            throw failure("get", column, e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    @Override
    public void put(Column column, byte[] key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lifecycleLock.readLock().lock();
        try {
            ensureOpen();
            db.put(handles.get(column), writeOptions, key, value);
        } catch (RocksDBException e) {
            throw failure("put", column, e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    @Override
    public void forEach(Column column, BiConsumer<byte[], byte[]> consumer) {
        lifecycleLock.readLock().lock();
        try {
            ensureOpen();
            try (RocksIterator it = db.newIterator(handles.get(column))) {
                for (it.seekToFirst(); it.isValid(); it.next()) {
                    consumer.accept(it.key(), it.value());
                }
                it.status();
            }
        } catch (RocksDBException e) {
            throw failure("scan", column, e);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    @Override
    public long count(Column column) {
        // RocksJava only exposes an estimate; iterate for an exact figure.
        lifecycleLock.readLock().lock();
        try {
            ensureOpen();
            try (RocksIterator it = db.newIterator(handles.get(column))) {
                long n = 0;
                for (it.seekToFirst(); it.isValid(); it.next()) n++;
                return n;
            }
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    @Override
    public void reset() {
        lifecycleLock.writeLock().lock();
        try {
            ensureOpen();
            for (Column column : Column.values()) {
                ColumnFamilyHandle old = handles.get(column);
                db.dropColumnFamily(old);
                old.close();
                handles.put(column, db.createColumnFamily(new ColumnFamilyDescriptor(column.familyNameBytes())));
            }
            LOG.info(() -> "Reset RocksDB block store at " + dataDir);
        } catch (RocksDBException e) {
            throw new BlockStoreException(ErrorCode.STORAGE_FAILURE, "reset failed", e);
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lifecycleLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            // Close CF handles first, then DB/options
            for (ColumnFamilyHandle handle : handles.values()) {
                handle.close();
            }
            defaultHandle.close();
            try {
                db.closeE();
            } catch (RocksDBException e) {
                LOG.log(Level.WARNING, "RocksDB close reported an error for " + dataDir, e);
            }
            writeOptions.close();
            dbOptions.close();
            LOG.fine(() -> "Closed RocksDB block store at " + dataDir);
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new BlockStoreException(ErrorCode.STORAGE_FAILURE, "Store is closed: " + dataDir);
        }
    }

    private static BlockStoreException failure(String op, Column column, RocksDBException e) {
        return new BlockStoreException(ErrorCode.STORAGE_FAILURE, op + " failed on " + column.familyName(), e);
    }
}

package io.rockmap.core.engine;

import io.rockmap.core.config.DatabaseConfig;
import io.rockmap.core.error.NotFoundException;
import io.rockmap.core.error.OpenException;
import io.rockmap.core.error.StorageIoException;
import io.rockmap.core.error.WriteException;
import io.rockmap.core.pool.Pool;
import org.rocksdb.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the RocksDB instance, its column families and the worker pool.
 *
 * Each keyspace is one column family. Keyspaces that are described but missing
 * are created on a writable open; keyspaces found on disk but not described are
 * still opened (RocksDB requires it) and reported.
 */
public final class Engine implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Engine.class.getName());
    private static final String DEFAULT_CF = new String(RocksDB.DEFAULT_COLUMN_FAMILY, StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final WriteOptions batchWriteOptions;
    private final Map<String, ColumnFamilyHandle> handles;
    private final List<ColumnFamilyHandle> allHandles;
    private final EngineMode mode;
    private final DatabaseConfig config;
    private final Pool pool;
    private volatile boolean closed;

    private Engine(RocksDB db,
                   DBOptions dbOptions,
                   ColumnFamilyOptions cfOptions,
                   Map<String, ColumnFamilyHandle> handles,
                   List<ColumnFamilyHandle> allHandles,
                   DatabaseConfig config,
                   Pool pool) {
        this.db = db;
        this.dbOptions = dbOptions;
        this.cfOptions = cfOptions;
        this.handles = Collections.unmodifiableMap(handles);
        this.allHandles = allHandles;
        this.mode = config.mode;
        this.config = config;
        this.pool = pool;
        this.batchWriteOptions = new WriteOptions()
                .setSync(config.syncWrites)
                .setDisableWAL(config.disableWal);
    }

    /** Open or create the database at {@code config.path}. */
    public static Engine open(DatabaseConfig config, List<KeyspaceDescriptor> descriptors) {
        long start = System.nanoTime();
        String path = config.path.toString();
        boolean writable = config.mode.writable();

        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(writable && config.createIfMissing)
                .setCreateMissingColumnFamilies(writable);
        if (config.mode == EngineMode.SECONDARY) {
            dbOpts.setMaxOpenFiles(-1);
            try {
                Files.createDirectories(secondaryPath(config));
            } catch (IOException e) {
                dbOpts.close();
                throw new OpenException("Failed to create secondary directory " + secondaryPath(config), e);
            }
        }
        ColumnFamilyOptions cfOpts = new ColumnFamilyOptions();

        if (config.syncWrites && config.disableWal) {
            LOG.warning("syncWrites with the WAL disabled: the engine will reject every write to " + path);
        }

        Set<String> existing = discover(config.path);
        List<String> names = configure(config, descriptors, existing);
        LOG.fine("Configured " + names.size() + " column descriptors for " + path);

        List<ColumnFamilyDescriptor> cfDescs = new ArrayList<>(names.size());
        for (String name : names) {
            cfDescs.add(new ColumnFamilyDescriptor(name.getBytes(StandardCharsets.UTF_8), cfOpts));
        }
        List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

        RocksDB db;
        try {
            db = switch (config.mode) {
                case READ_ONLY -> RocksDB.openReadOnly(dbOpts, path, cfDescs, cfHandles);
                case SECONDARY -> RocksDB.openAsSecondary(dbOpts, path,
                        secondaryPath(config).toString(), cfDescs, cfHandles);
                case READ_WRITE -> RocksDB.open(dbOpts, path, cfDescs, cfHandles);
            };
        } catch (RocksDBException e) {
            cfOpts.close();
            dbOpts.close();
            throw new OpenException("Failed to open database at " + path + " (" + config.mode + ")", e);
        }

        Map<String, ColumnFamilyHandle> byName = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            byName.put(names.get(i), cfHandles.get(i));
        }

        if (writable && !config.neverDropKeyspaces) {
            for (KeyspaceDescriptor desc : descriptors) {
                if (!desc.dropped() || !byName.containsKey(desc.name())) {
                    continue;
                }
                ColumnFamilyHandle handle = byName.get(desc.name());
                try {
                    db.dropColumnFamily(handle);
                } catch (RocksDBException e) {
                    for (ColumnFamilyHandle h : cfHandles) {
                        h.close();
                    }
                    db.close();
                    cfOpts.close();
                    dbOpts.close();
                    throw new OpenException("Failed to drop keyspace " + desc.name(), e);
                }
                LOG.warning("Keyspace " + desc.name() + " has been dropped. Storage may not appear reclaimed"
                        + " until further restart or compaction.");
                byName.remove(desc.name());
                cfHandles.remove(handle);
                handle.close();
            }
        }

        Pool pool = new Pool("rockmap-pool", config.poolWorkers, config.poolQueueMultiplier);
        Engine engine = new Engine(db, dbOpts, cfOpts, byName, cfHandles, config, pool);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        LOG.info("Opened database at " + path + ": mode=" + config.mode + " columns=" + byName.size()
                + " sequence=" + db.getLatestSequenceNumber() + " time=" + elapsedMs + "ms");
        return engine;
    }

    private static Set<String> discover(Path path) {
        Set<String> found = new TreeSet<>();
        try (Options opts = new Options()) {
            for (byte[] raw : RocksDB.listColumnFamilies(opts, path.toString())) {
                found.add(new String(raw, StandardCharsets.UTF_8));
            }
        } catch (RocksDBException e) {
            LOG.fine("No existing column families at " + path + ": " + e.getMessage());
        }
        return found;
    }

    /** Names of the column families to open, default first. */
    private static List<String> configure(DatabaseConfig config, List<KeyspaceDescriptor> descriptors, Set<String> existing) {
        boolean writable = config.mode.writable();
        Set<String> described = new LinkedHashSet<>();
        for (KeyspaceDescriptor desc : descriptors) {
            described.add(desc.name());
        }

        Set<String> names = new LinkedHashSet<>();
        names.add(DEFAULT_CF);
        for (KeyspaceDescriptor desc : descriptors) {
            if (desc.dropped()) {
                if (existing.contains(desc.name())) {
                    names.add(desc.name());
                } else {
                    LOG.fine("Previously dropped keyspace " + desc.name() + " no longer found");
                }
                continue;
            }
            if (existing.contains(desc.name())) {
                names.add(desc.name());
            } else if (writable) {
                LOG.fine("Creating keyspace " + desc.name() + " not previously found in database");
                names.add(desc.name());
            } else {
                LOG.warning("Keyspace " + desc.name() + " does not exist and cannot be created in " + config.mode + " mode");
            }
        }
        for (String name : existing) {
            if (!name.equals(DEFAULT_CF) && !described.contains(name)) {
                LOG.warning("Found undescribed keyspace " + name + " in existing database");
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    private static Path secondaryPath(DatabaseConfig config) {
        if (config.secondaryPath != null) {
            return config.secondaryPath;
        }
        return config.path.resolveSibling(config.path.getFileName() + "-secondary");
    }

    // -------------- queries ----------------

    public ColumnFamilyHandle handle(String keyspace) {
        ColumnFamilyHandle handle = handles.get(keyspace);
        if (handle == null) {
            throw new NotFoundException("keyspace not found: " + keyspace);
        }
        return handle;
    }

    public Optional<ColumnFamilyHandle> findHandle(String keyspace) {
        return Optional.ofNullable(handles.get(keyspace));
    }

    /** Keyspaces currently open, including undescribed ones found on disk. */
    public Set<String> keyspaceNames() {
        Set<String> names = new LinkedHashSet<>(handles.keySet());
        names.remove(DEFAULT_CF);
        return names;
    }

    public EngineMode mode() { return mode; }

    public boolean isReadOnly() { return mode == EngineMode.READ_ONLY; }

    public boolean isSecondary() { return mode == EngineMode.SECONDARY; }

    public DatabaseConfig config() { return config; }

    public Pool pool() { return pool; }

    /** The native handle, for the keyspace and batch layers of this library. */
    public RocksDB db() { return db; }

    public void checkWritable(String what) {
        if (!mode.writable()) {
            throw new WriteException(what + " rejected: database is open " + mode);
        }
    }

    // -------------- introspection ----------------

    public String property(ColumnFamilyHandle cf, String name) {
        try {
            return db.getProperty(cf, name);
        } catch (RocksDBException e) {
            throw new StorageIoException("property " + name + " failed", e);
        }
    }

    public long propertyInteger(ColumnFamilyHandle cf, String name) {
        try {
            return db.getLongProperty(cf, name);
        } catch (RocksDBException e) {
            throw new StorageIoException("property " + name + " failed", e);
        }
    }

    public long latestSequenceNumber() {
        return db.getLatestSequenceNumber();
    }

    // -------------- writes & maintenance ----------------

    /** Applies a batch atomically. Callers run this on the pool. */
    public void write(WriteBatch batch) throws RocksDBException {
        db.write(batchWriteOptions, batch);
    }

    /** Flush all memtables to disk and wait for it. */
    public CompletableFuture<Void> flush() {
        return pool.execute("engine.flush", () -> {
            try (FlushOptions fo = new FlushOptions().setWaitForFlush(true)) {
                db.flush(fo, allHandles);
                return null;
            } catch (RocksDBException e) {
                throw new WriteException("flush failed", e);
            }
        });
    }

    /** Flush and fsync the write-ahead log. */
    public CompletableFuture<Void> sync() {
        return pool.execute("engine.sync", () -> {
            try {
                db.flushWal(true);
                return null;
            } catch (RocksDBException e) {
                throw new WriteException("wal sync failed", e);
            }
        });
    }

    public CompletableFuture<Void> compact(ColumnFamilyHandle cf) {
        return pool.execute("engine.compact", () -> {
            try {
                db.compactRange(cf);
                return null;
            } catch (RocksDBException e) {
                throw new WriteException("compaction failed", e);
            }
        });
    }

    /** Replays the primary's latest changes into this read replica. */
    public CompletableFuture<Void> catchUpWithPrimary() {
        if (!isSecondary()) {
            throw new IllegalStateException("catch-up requires a secondary engine, mode is " + mode);
        }
        return pool.execute("engine.catchup", () -> {
            try {
                db.tryCatchUpWithPrimary();
                return null;
            } catch (RocksDBException e) {
                throw new StorageIoException("catch-up with primary failed", e);
            }
        });
    }

    /** Stops the pool, then releases the native handles. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pool.close();
        for (ColumnFamilyHandle handle : allHandles) {
            handle.close();
        }
        try {
            db.closeE();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "Closing database at " + config.path + " reported an error", e);
        }
        batchWriteOptions.close();
        cfOptions.close();
        dbOptions.close();
        LOG.info("Closed database at " + config.path);
    }
}

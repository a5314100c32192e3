package io.rockmap.core.keyspace;

import io.rockmap.core.cork.Cork;
import io.rockmap.core.engine.Engine;
import io.rockmap.core.error.NotFoundException;
import io.rockmap.core.error.StorageIoException;
import io.rockmap.core.error.WriteException;
import io.rockmap.core.stream.Bound;
import io.rockmap.core.stream.Cursor;
import io.rockmap.core.stream.CursorState;
import io.rockmap.core.stream.Direction;
import io.rockmap.core.stream.KeyVal;
import io.rockmap.core.stream.KeyValueStream;
import io.rockmap.core.stream.Projection;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.Holder;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.Status;
import org.rocksdb.WriteBatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Handle to one named keyspace (a RocksDB column family).
 *
 * Every point operation runs on the engine's pool and returns a future; none
 * executes on the calling thread, though a call blocks while the pool's queue is
 * full. Writes wake the keyspace's watchers for the written key once the write
 * is applied.
 */
public final class Keyspace implements AutoCloseable {

    private final String name;
    private final Engine engine;
    private final ColumnFamilyHandle cf;
    private final OptionProfiles profiles;
    private final Watch watch = new Watch();
    private final Set<KeyValueStream<?>> openStreams = ConcurrentHashMap.newKeySet();

    private Keyspace(String name, Engine engine, ColumnFamilyHandle cf, OptionProfiles profiles) {
        this.name = name;
        this.engine = engine;
        this.cf = cf;
        this.profiles = profiles;
    }

    /** Binds to an existing keyspace; NotFoundException if the engine has none by that name. */
    public static Keyspace open(Engine engine, String name) {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(name, "name");
        ColumnFamilyHandle cf = engine.findHandle(name)
                .orElseThrow(() -> new NotFoundException("keyspace not found: " + name));
        return new Keyspace(name, engine, cf, OptionProfiles.of(engine.config()));
    }

    // -------------- point reads ----------------

    /** Value for {@code key}; fails with NotFoundException when absent. */
    public CompletableFuture<byte[]> get(byte[] key) {
        byte[] k = key.clone();
        return dispatch("get", () -> {
            byte[] value = read(k);
            if (value == null) {
                throw new NotFoundException("key not found in " + name);
            }
            return value;
        });
    }

    public CompletableFuture<Optional<byte[]>> find(byte[] key) {
        byte[] k = key.clone();
        return dispatch("find", () -> Optional.ofNullable(read(k)));
    }

    /** Values for several keys in one engine call, in request order. */
    public CompletableFuture<List<Optional<byte[]>>> getBatch(List<byte[]> keys) {
        List<byte[]> ks = new ArrayList<>(keys.size());
        for (byte[] key : keys) {
            ks.add(key.clone());
        }
        return dispatch("get_batch", () -> {
            if (ks.isEmpty()) {
                return List.of();
            }
            try {
                List<byte[]> values = engine.db().multiGetAsList(profiles.read(),
                        Collections.nCopies(ks.size(), cf), ks);
                List<Optional<byte[]>> out = new ArrayList<>(values.size());
                for (byte[] value : values) {
                    out.add(Optional.ofNullable(value));
                }
                return out;
            } catch (RocksDBException e) {
                throw new StorageIoException("get_batch of " + ks.size() + " keys in " + name + " failed", e);
            }
        });
    }

    public CompletableFuture<Boolean> contains(byte[] key) {
        byte[] k = key.clone();
        return dispatch("contains", () -> {
            Holder<byte[]> holder = new Holder<>();
            if (!engine.db().keyMayExist(cf, profiles.read(), k, holder)) {
                return false;
            }
            if (holder.getValue() != null) {
                return true;
            }
            return read(k) != null;
        });
    }

    /** Exact number of keys, by iteration. */
    public CompletableFuture<Long> count() {
        return dispatch("count", () -> countKeys(Bound.unbounded()));
    }

    public CompletableFuture<Long> countPrefix(byte[] prefix) {
        Bound bound = Bound.prefix(prefix);
        return dispatch("count_prefix", () -> countKeys(bound));
    }

    // -------------- writes ----------------

    public CompletableFuture<Void> insert(byte[] key, byte[] value) {
        Objects.requireNonNull(value, "value");
        byte[] k = key.clone();
        byte[] v = value.clone();
        return write("insert", () -> {
            try {
                engine.db().put(cf, profiles.write(), k, v);
            } catch (RocksDBException e) {
                throw new WriteException("insert into " + name + " failed", e);
            }
            watch.wake(k);
            return null;
        });
    }

    /** Deletes {@code key}. Absent keys are left alone: no error, no wake-up, result false. */
    public CompletableFuture<Boolean> remove(byte[] key) {
        byte[] k = key.clone();
        return write("remove", () -> {
            if (read(k) == null) {
                return false;
            }
            try {
                engine.db().delete(cf, profiles.write(), k);
            } catch (RocksDBException e) {
                throw new WriteException("remove from " + name + " failed", e);
            }
            watch.wake(k);
            return true;
        });
    }

    /** Deletes every key in one atomic batch; returns how many were removed. */
    public CompletableFuture<Long> clear() {
        return write("clear", () -> {
            List<byte[]> keys = new ArrayList<>();
            try (Cursor<byte[]> cursor = cursor(Direction.FORWARD, Projection.KEYS, Bound.unbounded())) {
                for (Optional<byte[]> key = cursor.step(); key.isPresent(); key = cursor.step()) {
                    keys.add(key.get());
                }
            }
            if (keys.isEmpty()) {
                return 0L;
            }
            try (WriteBatch batch = new WriteBatch()) {
                for (byte[] key : keys) {
                    batch.delete(cf, key);
                }
                engine.write(batch);
            } catch (RocksDBException e) {
                throw new WriteException("clear of " + name + " failed", e);
            }
            for (byte[] key : keys) {
                watch.wake(key);
            }
            return (long) keys.size();
        });
    }

    public CompletableFuture<Void> compact() {
        return engine.compact(cf);
    }

    // -------------- streams ----------------

    public KeyValueStream<KeyVal> entries() {
        return stream("entries", Direction.FORWARD, Projection.ENTRIES, Bound.unbounded());
    }

    public KeyValueStream<KeyVal> entriesFrom(byte[] key) {
        return stream("entries_from", Direction.FORWARD, Projection.ENTRIES, Bound.from(key));
    }

    public KeyValueStream<KeyVal> entriesPrefix(byte[] prefix) {
        return stream("entries_prefix", Direction.FORWARD, Projection.ENTRIES, Bound.prefix(prefix));
    }

    public KeyValueStream<KeyVal> reverseEntries() {
        return stream("rev_entries", Direction.REVERSE, Projection.ENTRIES, Bound.unbounded());
    }

    public KeyValueStream<KeyVal> reverseEntriesFrom(byte[] key) {
        return stream("rev_entries_from", Direction.REVERSE, Projection.ENTRIES, Bound.from(key));
    }

    public KeyValueStream<KeyVal> reverseEntriesPrefix(byte[] prefix) {
        return stream("rev_entries_prefix", Direction.REVERSE, Projection.ENTRIES, Bound.prefix(prefix));
    }

    public KeyValueStream<byte[]> keys() {
        return stream("keys", Direction.FORWARD, Projection.KEYS, Bound.unbounded());
    }

    public KeyValueStream<byte[]> keysFrom(byte[] key) {
        return stream("keys_from", Direction.FORWARD, Projection.KEYS, Bound.from(key));
    }

    public KeyValueStream<byte[]> keysPrefix(byte[] prefix) {
        return stream("keys_prefix", Direction.FORWARD, Projection.KEYS, Bound.prefix(prefix));
    }

    public KeyValueStream<byte[]> reverseKeys() {
        return stream("rev_keys", Direction.REVERSE, Projection.KEYS, Bound.unbounded());
    }

    public KeyValueStream<byte[]> reverseKeysFrom(byte[] key) {
        return stream("rev_keys_from", Direction.REVERSE, Projection.KEYS, Bound.from(key));
    }

    public KeyValueStream<byte[]> reverseKeysPrefix(byte[] prefix) {
        return stream("rev_keys_prefix", Direction.REVERSE, Projection.KEYS, Bound.prefix(prefix));
    }

    // -------------- watch / cork / introspection ----------------

    /** Completes on the next write to exactly {@code key} after this call. */
    public CompletableFuture<Void> watch(byte[] key) {
        return watch.register(key);
    }

    public Watch watcher() { return watch; }

    public Cork cork() {
        return new Cork(engine, this);
    }

    public String property(String property) {
        return engine.property(cf, property);
    }

    public long propertyInteger(String property) {
        return engine.propertyInteger(cf, property);
    }

    public String name() { return name; }

    public Engine engine() { return engine; }

    /** The column family handle, for batch writers of this library. */
    public ColumnFamilyHandle handle() { return cf; }

    public int openStreams() { return openStreams.size(); }

    /** Releases streams still open. Call after the engine's pool has stopped. */
    @Override
    public void close() {
        for (KeyValueStream<?> stream : List.copyOf(openStreams)) {
            stream.close();
        }
        profiles.close();
    }

    @Override
    public String toString() {
        return name;
    }

    // -------------- helpers ----------------

    private <T> KeyValueStream<T> stream(String op, Direction direction, Projection<T> projection, Bound bound) {
        Cursor<T> cursor = cursor(direction, projection, bound);
        KeyValueStream<T> stream = new KeyValueStream<>(name + "." + op, engine.pool(), cursor, openStreams::remove);
        openStreams.add(stream);
        return stream;
    }

    private <T> Cursor<T> cursor(Direction direction, Projection<T> projection, Bound bound) {
        RocksDB db = engine.db();
        CursorState state = new CursorState(db, cf, profiles::newIteratorOptions, direction, bound);
        return new Cursor<>(state, projection);
    }

    private long countKeys(Bound bound) {
        long n = 0;
        try (Cursor<byte[]> cursor = cursor(Direction.FORWARD, Projection.KEYS, bound)) {
            while (cursor.step().isPresent()) {
                n++;
            }
        }
        return n;
    }

    // memtables and block cache first; storage only when they cannot answer
    private byte[] read(byte[] key) {
        try {
            return engine.db().get(cf, profiles.cacheRead(), key);
        } catch (RocksDBException e) {
            if (!isIncomplete(e)) {
                throw new StorageIoException("cached read from " + name + " failed", e);
            }
        }
        try {
            return engine.db().get(cf, profiles.read(), key);
        } catch (RocksDBException e) {
            throw new StorageIoException("read from " + name + " failed", e);
        }
    }

    private static boolean isIncomplete(RocksDBException e) {
        Status status = e.getStatus();
        return status != null && status.getCode() == Status.Code.Incomplete;
    }

    private <T> CompletableFuture<T> dispatch(String op, Supplier<T> task) {
        return engine.pool().execute(name + "." + op, task);
    }

    private <T> CompletableFuture<T> write(String op, Supplier<T> task) {
        try {
            engine.checkWritable(name + "." + op);
        } catch (WriteException e) {
            return CompletableFuture.failedFuture(e);
        }
        return dispatch(op, task);
    }
}

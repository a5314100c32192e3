package io.rockmap.core.cork;

import io.rockmap.core.engine.Engine;
import io.rockmap.core.error.WriteException;
import io.rockmap.core.keyspace.Keyspace;
import io.rockmap.core.metrics.StorageMetrics;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Buffered puts and deletes against keyspaces of one engine, applied in a
 * single atomic batch by {@link #commit()}. Nothing reaches the engine before
 * that; closing an uncommitted cork throws the buffered operations away.
 *
 * A cork belongs to the thread that builds it and is not synchronized.
 */
public final class Cork implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Cork.class.getName());

    private record Op(Keyspace keyspace, byte[] key, byte[] value) {
        boolean isDelete() {
            return value == null;
        }
    }

    private final Engine engine;
    private final Keyspace defaultKeyspace;
    private final List<Op> ops = new ArrayList<>();
    private boolean committed;
    private boolean closed;

    /** @param defaultKeyspace target of the keyspace-less put/delete overloads; may be null */
    public Cork(Engine engine, Keyspace defaultKeyspace) {
        this.engine = Objects.requireNonNull(engine, "engine");
        if (defaultKeyspace != null) {
            checkEngine(defaultKeyspace);
        }
        this.defaultKeyspace = defaultKeyspace;
    }

    public Cork put(byte[] key, byte[] value) {
        return put(requireDefault(), key, value);
    }

    public Cork put(Keyspace keyspace, byte[] key, byte[] value) {
        Objects.requireNonNull(value, "value");
        add(keyspace, key, value.clone());
        return this;
    }

    public Cork delete(byte[] key) {
        return delete(requireDefault(), key);
    }

    public Cork delete(Keyspace keyspace, byte[] key) {
        add(keyspace, key, null);
        return this;
    }

    /** Buffered operations not yet committed. */
    public int size() {
        return ops.size();
    }

    public boolean isCommitted() {
        return committed;
    }

    /**
     * Applies every buffered operation atomically on the pool. On failure the
     * future fails with WriteException and none of the operations took effect.
     * Watchers of each written key are woken after the batch lands.
     */
    public CompletableFuture<Void> commit() {
        ensureOpen();
        committed = true;
        List<Op> batch = List.copyOf(ops);
        ops.clear();
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            engine.checkWritable("cork commit");
        } catch (WriteException e) {
            return CompletableFuture.failedFuture(e);
        }
        return engine.pool().execute("cork.commit", () -> {
            apply(batch);
            return null;
        });
    }

    private void apply(List<Op> batch) {
        try (WriteBatch wb = new WriteBatch()) {
            for (Op op : batch) {
                if (op.isDelete()) {
                    wb.delete(op.keyspace().handle(), op.key());
                } else {
                    wb.put(op.keyspace().handle(), op.key(), op.value());
                }
            }
            engine.write(wb);
        } catch (RocksDBException e) {
            throw new WriteException("cork commit of " + batch.size() + " operations failed", e);
        }
        StorageMetrics.recordCorkCommit(batch.size());
        for (Op op : batch) {
            op.keyspace().watcher().wake(op.key());
        }
    }

    /** Discards anything not committed. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!committed && !ops.isEmpty()) {
            LOG.fine("Discarding " + ops.size() + " uncommitted cork operations");
        }
        ops.clear();
    }

    private void add(Keyspace keyspace, byte[] key, byte[] value) {
        ensureOpen();
        Objects.requireNonNull(keyspace, "keyspace");
        Objects.requireNonNull(key, "key");
        checkEngine(keyspace);
        ops.add(new Op(keyspace, key.clone(), value));
    }

    private Keyspace requireDefault() {
        if (defaultKeyspace == null) {
            throw new IllegalStateException("cork has no default keyspace; pass one explicitly");
        }
        return defaultKeyspace;
    }

    private void checkEngine(Keyspace keyspace) {
        if (keyspace.engine() != engine) {
            throw new IllegalArgumentException("keyspace " + keyspace.name() + " belongs to another engine");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("cork is closed");
        }
        if (committed) {
            throw new IllegalStateException("cork was already committed");
        }
    }
}

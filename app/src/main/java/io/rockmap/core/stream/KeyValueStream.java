package io.rockmap.core.stream;

import io.rockmap.core.pool.Pool;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Lazy, single-pass pull sequence over one keyspace.
 *
 * Each {@link #next()} runs one cursor step on the pool and completes with the
 * item, or empty once the sequence is exhausted. Only one pull may be
 * outstanding at a time. Nothing touches the engine before the first pull, and an
 * exhausted stream never steps again; build a new one to re-read.
 *
 * The native iterator is released as soon as the stream reports exhaustion or a
 * failed step. Close a stream abandoned before that; closing while a step is
 * running defers the release until that step returns.
 */
public final class KeyValueStream<T> implements AutoCloseable {

    private final String name;
    private final Pool pool;
    private final Cursor<T> cursor;
    private final Consumer<KeyValueStream<?>> onClose;

    private CompletableFuture<Optional<T>> pending;
    private boolean running;
    private boolean terminated;
    private boolean closed;

    public KeyValueStream(String name, Pool pool, Cursor<T> cursor, Consumer<KeyValueStream<?>> onClose) {
        this.name = Objects.requireNonNull(name, "name");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.onClose = onClose == null ? stream -> {} : onClose;
    }

    /**
     * Pulls the next item. Fails with IllegalStateException if the previous pull
     * has not completed or the stream is closed. Blocks the caller while the
     * pool's queue is full.
     */
    public synchronized CompletableFuture<Optional<T>> next() {
        if (closed) {
            throw new IllegalStateException("stream " + name + " is closed");
        }
        if (pending != null && !pending.isDone()) {
            throw new IllegalStateException("stream " + name + " already has a pull outstanding");
        }
        if (terminated) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        pending = pool.execute(name, this::step);
        return pending;
    }

    // Runs on a pool worker.
    private Optional<T> step() {
        synchronized (this) {
            if (closed || terminated) {
                return Optional.empty();
            }
            running = true;
        }
        Optional<T> item = Optional.empty();
        boolean stepped = false;
        try {
            item = cursor.step();
            stepped = true;
            return item;
        } finally {
            boolean release;
            synchronized (this) {
                running = false;
                if (!stepped || item.isEmpty()) {
                    terminated = true;
                }
                release = terminated || closed;
                if (release) {
                    cursor.close();
                }
            }
            if (release) {
                onClose.accept(this);
            }
        }
    }

    /** True once the stream has reported exhaustion or failed. */
    public synchronized boolean isTerminated() {
        return terminated;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public String name() {
        return name;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            terminated = true;
            if (pending != null && !pending.isDone()) {
                pending.cancel(false);
            }
            if (!running) {
                cursor.close();
            }
        }
        onClose.accept(this);
    }
}

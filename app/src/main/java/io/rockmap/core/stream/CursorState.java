package io.rockmap.core.stream;

import io.rockmap.core.error.StorageIoException;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Slice;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A positioned iterator over one keyspace with a fixed direction and optional bound.
 *
 * Nothing native is allocated until the first {@link #advance()}, which performs
 * the initial positioning instead of a step. Not thread-safe: callers hand it from
 * one pool worker to the next, never use it from two threads at once.
 */
public final class CursorState implements AutoCloseable {

    private final RocksDB db;
    private final ColumnFamilyHandle cf;
    private final Supplier<ReadOptions> optionsFactory;
    private final Direction direction;
    private final Bound bound;

    private ReadOptions options;
    private Slice lowerSlice;
    private Slice upperSlice;
    private RocksIterator iterator;
    private boolean initialized;
    private boolean closed;

    public CursorState(RocksDB db,
                       ColumnFamilyHandle cf,
                       Supplier<ReadOptions> optionsFactory,
                       Direction direction,
                       Bound bound) {
        this.db = Objects.requireNonNull(db, "db");
        this.cf = Objects.requireNonNull(cf, "cf");
        this.optionsFactory = Objects.requireNonNull(optionsFactory, "optionsFactory");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.bound = Objects.requireNonNull(bound, "bound");
    }

    /** First call positions the iterator; later calls move one entry in the cursor's direction. */
    public void advance() {
        if (closed) {
            throw new IllegalStateException("cursor is closed");
        }
        if (!initialized) {
            position();
            initialized = true;
            return;
        }
        if (direction == Direction.FORWARD) {
            iterator.next();
        } else {
            iterator.prev();
        }
    }

    private void position() {
        options = optionsFactory.get();
        if (bound.lower() != null) {
            lowerSlice = new Slice(bound.lower());
            options.setIterateLowerBound(lowerSlice);
        }
        if (bound.upper() != null) {
            upperSlice = new Slice(bound.upper());
            options.setIterateUpperBound(upperSlice);
        }
        iterator = db.newIterator(cf, options);

        byte[] start = bound.start();
        if (direction == Direction.FORWARD) {
            if (start != null) {
                iterator.seek(start);
            } else {
                iterator.seekToFirst();
            }
        } else {
            if (start != null) {
                iterator.seekForPrev(start);
            } else {
                iterator.seekToLast();
            }
        }
    }

    public boolean valid() {
        return !closed && iterator != null && iterator.isValid();
    }

    public boolean initialized() {
        return initialized;
    }

    /** At least one positioning attempt happened and nothing valid is under the cursor. */
    public boolean exhausted() {
        return initialized && !valid();
    }

    /** Copy of the current key. Only meaningful while {@link #valid()}. */
    public byte[] key() {
        return iterator.key();
    }

    /** Copy of the current value. Only meaningful while {@link #valid()}. */
    public byte[] value() {
        return iterator.value();
    }

    /** Raises the iterator's stored error, if it stopped because of one. */
    public void checkStatus() {
        if (iterator == null || closed) {
            return;
        }
        try {
            iterator.status();
        } catch (RocksDBException e) {
            throw new StorageIoException("iteration failed (" + direction + ", " + bound + ")", e);
        }
    }

    public Direction direction() { return direction; }

    public Bound bound() { return bound; }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (iterator != null) {
            iterator.close();
        }
        if (options != null) {
            options.close();
        }
        if (lowerSlice != null) {
            lowerSlice.close();
        }
        if (upperSlice != null) {
            upperSlice.close();
        }
    }
}

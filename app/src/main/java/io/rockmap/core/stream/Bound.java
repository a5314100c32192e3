package io.rockmap.core.stream;

import java.util.Arrays;
import java.util.Objects;

/**
 * Restricts where a cursor starts and which keys it may yield.
 *
 * <ul>
 *   <li>{@link #unbounded()}: whole keyspace.</li>
 *   <li>{@link #from(byte[])}: start at a key; forward cursors yield keys &gt;= it,
 *       reverse cursors keys &lt;= it.</li>
 *   <li>{@link #prefix(byte[])}: the range [prefix, successor(prefix)).</li>
 * </ul>
 */
public final class Bound {

    enum Shape { UNBOUNDED, FROM, PREFIX }

    private static final Bound UNBOUNDED = new Bound(Shape.UNBOUNDED, null, null);

    private final Shape shape;
    private final byte[] key;
    private final byte[] upper;

    private Bound(Shape shape, byte[] key, byte[] upper) {
        this.shape = shape;
        this.key = key;
        this.upper = upper;
    }

    public static Bound unbounded() {
        return UNBOUNDED;
    }

    public static Bound from(byte[] key) {
        Objects.requireNonNull(key, "key");
        return new Bound(Shape.FROM, key.clone(), null);
    }

    public static Bound prefix(byte[] prefix) {
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.length == 0) {
            return UNBOUNDED;
        }
        return new Bound(Shape.PREFIX, prefix.clone(), successor(prefix));
    }

    Shape shape() { return shape; }

    /** Key to seek to on the first positioning, or null to start at an end. */
    byte[] start() {
        return shape == Shape.FROM ? key : null;
    }

    /** Inclusive lower bound enforced by the engine, or null. */
    byte[] lower() {
        return shape == Shape.PREFIX ? key : null;
    }

    /** Exclusive upper bound enforced by the engine, or null. */
    byte[] upper() {
        return upper;
    }

    public boolean contains(byte[] candidate) {
        return switch (shape) {
            case UNBOUNDED, FROM -> true;
            case PREFIX -> candidate.length >= key.length
                    && Arrays.equals(candidate, 0, key.length, key, 0, key.length);
        };
    }

    /**
     * Smallest key greater than every key starting with {@code prefix}; null when
     * the prefix is all 0xFF and no such key exists.
     */
    static byte[] successor(byte[] prefix) {
        int end = prefix.length;
        while (end > 0 && prefix[end - 1] == (byte) 0xFF) {
            end--;
        }
        if (end == 0) {
            return null;
        }
        byte[] next = Arrays.copyOf(prefix, end);
        next[end - 1]++;
        return next;
    }

    @Override
    public String toString() {
        return switch (shape) {
            case UNBOUNDED -> "Bound{*}";
            case FROM -> "Bound{from " + key.length + " bytes}";
            case PREFIX -> "Bound{prefix " + key.length + " bytes}";
        };
    }
}

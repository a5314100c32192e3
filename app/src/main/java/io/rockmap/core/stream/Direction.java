package io.rockmap.core.stream;

/** Traversal order of a cursor, fixed when it is created. */
public enum Direction {
    FORWARD,
    REVERSE
}

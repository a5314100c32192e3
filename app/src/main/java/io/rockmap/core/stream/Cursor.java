package io.rockmap.core.stream;

import java.util.Objects;
import java.util.Optional;

/**
 * Drives a {@link CursorState} one entry per {@link #step()} and projects what it
 * finds. Every stream shape (direction, projection, bound) is this one class.
 */
public final class Cursor<T> implements AutoCloseable {

    private final CursorState state;
    private final Projection<T> projection;

    public Cursor(CursorState state, Projection<T> projection) {
        this.state = Objects.requireNonNull(state, "state");
        this.projection = Objects.requireNonNull(projection, "projection");
    }

    /** What the cursor is positioned on, without moving it. */
    public Optional<T> fetch() {
        if (state.valid()) {
            if (!state.bound().contains(state.key())) {
                return Optional.empty();
            }
            return Optional.of(projection.project(state));
        }
        state.checkStatus();
        return Optional.empty();
    }

    /** One advance followed by one fetch. Never advances an exhausted cursor. */
    public Optional<T> step() {
        if (state.exhausted()) {
            return Optional.empty();
        }
        state.advance();
        return fetch();
    }

    public boolean exhausted() {
        return state.exhausted();
    }

    public CursorState state() {
        return state;
    }

    @Override
    public void close() {
        state.close();
    }
}

package io.rockmap.core.stream;

/** What a cursor hands out for the entry it is positioned on. */
@FunctionalInterface
public interface Projection<T> {

    Projection<KeyVal> ENTRIES = state -> new KeyVal(state.key(), state.value());

    Projection<byte[]> KEYS = CursorState::key;

    /** Called only while {@code state} is positioned on a live entry. */
    T project(CursorState state);
}

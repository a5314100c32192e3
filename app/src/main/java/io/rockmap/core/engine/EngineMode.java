package io.rockmap.core.engine;

/** How the engine was opened. Only READ_WRITE accepts writes. */
public enum EngineMode {
    READ_WRITE,
    READ_ONLY,
    /** Read replica following a primary's files. */
    SECONDARY;

    public boolean writable() {
        return this == READ_WRITE;
    }
}

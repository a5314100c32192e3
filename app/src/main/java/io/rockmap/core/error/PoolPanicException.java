package io.rockmap.core.error;

/**
 * A pool dispatch failed unexpectedly, or the pool no longer accepts work.
 * The worker that ran the dispatch keeps serving other requests.
 */
public final class PoolPanicException extends StorageException {

    public PoolPanicException(String message) {
        super(message);
    }

    public PoolPanicException(String message, Throwable cause) {
        super(message, cause);
    }
}

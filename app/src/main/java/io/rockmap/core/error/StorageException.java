package io.rockmap.core.error;

/**
 * Base of every failure raised by the storage layer.
 * Unchecked so it can travel inside a CompletableFuture unchanged.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}

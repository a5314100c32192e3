package io.rockmap.core.error;

/** A write, clear or batch commit was rejected. Nothing is retried. */
public final class WriteException extends StorageException {

    public WriteException(String message) {
        super(message);
    }

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.rockmap.core.error;

/** Underlying storage failure during a read or an iteration step. */
public final class StorageIoException extends StorageException {

    public StorageIoException(String message, Throwable cause) {
        super(message, cause);
    }
}

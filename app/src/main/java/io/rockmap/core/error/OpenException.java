package io.rockmap.core.error;

/** The engine could not be opened (corruption, version mismatch, permissions, I/O). */
public final class OpenException extends StorageException {

    public OpenException(String message) {
        super(message);
    }

    public OpenException(String message, Throwable cause) {
        super(message, cause);
    }
}

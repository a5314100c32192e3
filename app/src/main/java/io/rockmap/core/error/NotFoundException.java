package io.rockmap.core.error;

/** A keyspace or key does not exist. Callers usually map this to an empty result. */
public final class NotFoundException extends StorageException {

    public NotFoundException(String message) {
        super(message);
    }
}

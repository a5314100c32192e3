package io.rockmap.core.engine;

import java.util.Objects;

/**
 * Declares a keyspace the engine should know about.
 * A dropped descriptor names a keyspace that should be removed if still present.
 */
public record KeyspaceDescriptor(String name, boolean dropped) {

    public KeyspaceDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("keyspace name must not be blank");
        }
    }

    public static KeyspaceDescriptor of(String name) {
        return new KeyspaceDescriptor(name, false);
    }

    public static KeyspaceDescriptor dropped(String name) {
        return new KeyspaceDescriptor(name, true);
    }
}

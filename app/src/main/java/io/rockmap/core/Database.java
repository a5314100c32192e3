package io.rockmap.core;

import io.rockmap.core.config.DatabaseConfig;
import io.rockmap.core.cork.Cork;
import io.rockmap.core.engine.Engine;
import io.rockmap.core.engine.KeyspaceDescriptor;
import io.rockmap.core.error.NotFoundException;
import io.rockmap.core.error.StorageException;
import io.rockmap.core.keyspace.Keyspace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Registry of the keyspaces of one opened engine, looked up by name.
 *
 * Keyspaces are opened once in {@link #open(DatabaseConfig)} and live until
 * {@link #close()}. Uncommitted corks are never flushed on close.
 */
public final class Database implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Database.class.getName());

    private final Engine engine;
    private final Map<String, Keyspace> keyspaces;
    private volatile boolean closed;

    private Database(Engine engine, Map<String, Keyspace> keyspaces) {
        this.engine = engine;
        this.keyspaces = Collections.unmodifiableMap(keyspaces);
    }

    /**
     * Opens the engine and every keyspace it holds: the configured ones plus any
     * found on disk. Throws OpenException when the engine is unusable.
     */
    public static Database open(DatabaseConfig config) {
        List<KeyspaceDescriptor> descriptors = new ArrayList<>();
        for (String name : config.keyspaces) {
            descriptors.add(KeyspaceDescriptor.of(name));
        }
        for (String name : config.droppedKeyspaces) {
            descriptors.add(KeyspaceDescriptor.dropped(name));
        }

        Engine engine = Engine.open(config, descriptors);
        Map<String, Keyspace> opened = new LinkedHashMap<>();
        try {
            for (String name : engine.keyspaceNames()) {
                opened.put(name, Keyspace.open(engine, name));
            }
        } catch (StorageException e) {
            for (Keyspace keyspace : opened.values()) {
                keyspace.close();
            }
            engine.close();
            throw e;
        }
        LOG.fine("Opened keyspaces " + opened.keySet());
        return new Database(engine, opened);
    }

    /** Keyspace by name; NotFoundException when there is none. */
    public Keyspace get(String name) {
        Keyspace keyspace = keyspaces.get(name);
        if (keyspace == null) {
            throw new NotFoundException("keyspace not found: " + name);
        }
        return keyspace;
    }

    public Optional<Keyspace> find(String name) {
        return Optional.ofNullable(keyspaces.get(name));
    }

    public Set<String> names() {
        return keyspaces.keySet();
    }

    /** Empty cork; name the keyspace on each operation. */
    public Cork cork() {
        return new Cork(engine, null);
    }

    public boolean isReadOnly() { return engine.isReadOnly(); }

    public boolean isSecondary() { return engine.isSecondary(); }

    public Engine engine() { return engine; }

    /** Stops the pool, releases open streams and closes the engine. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        engine.pool().close();
        for (Keyspace keyspace : keyspaces.values()) {
            keyspace.close();
        }
        engine.close();
    }
}

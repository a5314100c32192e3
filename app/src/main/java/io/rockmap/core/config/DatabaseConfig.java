package io.rockmap.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rockmap.core.engine.EngineMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Settings for opening a database. Immutable; use the with* methods to derive variants. */
public final class DatabaseConfig {
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final int DEFAULT_QUEUE_MULTIPLIER = 4;

    public final Path path;
    public final List<String> keyspaces;
    public final List<String> droppedKeyspaces;
    public final EngineMode mode;
    public final Path secondaryPath;
    public final int poolWorkers;
    public final int poolQueueMultiplier;
    public final boolean syncWrites;
    public final boolean disableWal;
    public final boolean verifyChecksums;
    public final boolean neverDropKeyspaces;
    public final boolean createIfMissing;

    public DatabaseConfig(Path path,
                          List<String> keyspaces,
                          List<String> droppedKeyspaces,
                          EngineMode mode,
                          Path secondaryPath,
                          int poolWorkers,
                          int poolQueueMultiplier,
                          boolean syncWrites,
                          boolean disableWal,
                          boolean verifyChecksums,
                          boolean neverDropKeyspaces,
                          boolean createIfMissing) {
        this.path = Objects.requireNonNull(path, "path");
        this.keyspaces = List.copyOf(keyspaces);
        this.droppedKeyspaces = List.copyOf(droppedKeyspaces);
        this.mode = Objects.requireNonNull(mode, "mode");
        this.secondaryPath = secondaryPath;
        this.poolWorkers = poolWorkers;
        this.poolQueueMultiplier = poolQueueMultiplier;
        this.syncWrites = syncWrites;
        this.disableWal = disableWal;
        this.verifyChecksums = verifyChecksums;
        this.neverDropKeyspaces = neverDropKeyspaces;
        this.createIfMissing = createIfMissing;
    }

    public static DatabaseConfig defaults(Path path) {
        return new DatabaseConfig(
                path,
                List.of(),
                List.of(),
                EngineMode.READ_WRITE,
                null,
                Runtime.getRuntime().availableProcessors(),
                DEFAULT_QUEUE_MULTIPLIER,
                false,      // WAL fsync per write
                false,
                true,
                false,
                true
        );
    }

    /** Reads a JSON config file; absent fields keep their defaults. */
    public static DatabaseConfig load(Path file) throws IOException {
        JsonNode root = JSON.readTree(Files.readString(file));
        if (root == null || !root.isObject()) {
            throw new IOException("Config root must be a JSON object: " + file);
        }
        JsonNode pathNode = root.get("path");
        if (pathNode == null || pathNode.asText().isBlank()) {
            throw new IOException("Config is missing \"path\": " + file);
        }
        DatabaseConfig defaults = defaults(Path.of(pathNode.asText()));
        EngineMode mode = defaults.mode;
        if (root.hasNonNull("mode")) {
            try {
                mode = EngineMode.valueOf(root.get("mode").asText().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IOException("Unknown mode in " + file + ": " + root.get("mode").asText(), ex);
            }
        }
        Path secondary = root.hasNonNull("secondaryPath") ? Path.of(root.get("secondaryPath").asText()) : null;
        return new DatabaseConfig(
                defaults.path,
                strings(root.get("keyspaces")),
                strings(root.get("droppedKeyspaces")),
                mode,
                secondary,
                root.path("poolWorkers").asInt(defaults.poolWorkers),
                root.path("poolQueueMultiplier").asInt(defaults.poolQueueMultiplier),
                root.path("syncWrites").asBoolean(defaults.syncWrites),
                root.path("disableWal").asBoolean(defaults.disableWal),
                root.path("verifyChecksums").asBoolean(defaults.verifyChecksums),
                root.path("neverDropKeyspaces").asBoolean(defaults.neverDropKeyspaces),
                root.path("createIfMissing").asBoolean(defaults.createIfMissing)
        );
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return out;
        }
        for (JsonNode item : node) {
            String value = item.asText();
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out;
    }

    public DatabaseConfig withKeyspaces(List<String> keyspaces) {
        return new DatabaseConfig(path, keyspaces, droppedKeyspaces, mode, secondaryPath, poolWorkers,
                poolQueueMultiplier, syncWrites, disableWal, verifyChecksums, neverDropKeyspaces, createIfMissing);
    }

    public DatabaseConfig withKeyspaces(String... keyspaces) {
        return withKeyspaces(List.of(keyspaces));
    }

    public DatabaseConfig withDroppedKeyspaces(List<String> dropped) {
        return new DatabaseConfig(path, keyspaces, dropped, mode, secondaryPath, poolWorkers,
                poolQueueMultiplier, syncWrites, disableWal, verifyChecksums, neverDropKeyspaces, createIfMissing);
    }

    public DatabaseConfig withMode(EngineMode mode) {
        return new DatabaseConfig(path, keyspaces, droppedKeyspaces, mode, secondaryPath, poolWorkers,
                poolQueueMultiplier, syncWrites, disableWal, verifyChecksums, neverDropKeyspaces, createIfMissing);
    }

    public DatabaseConfig withSecondary(Path secondaryPath) {
        return new DatabaseConfig(path, keyspaces, droppedKeyspaces, EngineMode.SECONDARY, secondaryPath,
                poolWorkers, poolQueueMultiplier, syncWrites, disableWal, verifyChecksums, neverDropKeyspaces, createIfMissing);
    }

    public DatabaseConfig withPool(int workers, int queueMultiplier) {
        return new DatabaseConfig(path, keyspaces, droppedKeyspaces, mode, secondaryPath, workers,
                queueMultiplier, syncWrites, disableWal, verifyChecksums, neverDropKeyspaces, createIfMissing);
    }

    public DatabaseConfig withSyncWrites(boolean syncWrites) {
        return new DatabaseConfig(path, keyspaces, droppedKeyspaces, mode, secondaryPath, poolWorkers,
                poolQueueMultiplier, syncWrites, disableWal, verifyChecksums, neverDropKeyspaces, createIfMissing);
    }

    /** Writes skip the write-ahead log; anything not flushed is lost on a crash. */
    public DatabaseConfig withDisableWal(boolean disableWal) {
        return new DatabaseConfig(path, keyspaces, droppedKeyspaces, mode, secondaryPath, poolWorkers,
                poolQueueMultiplier, syncWrites, disableWal, verifyChecksums, neverDropKeyspaces, createIfMissing);
    }

    public DatabaseConfig withNeverDropKeyspaces(boolean neverDrop) {
        return new DatabaseConfig(path, keyspaces, droppedKeyspaces, mode, secondaryPath, poolWorkers,
                poolQueueMultiplier, syncWrites, disableWal, verifyChecksums, neverDrop, createIfMissing);
    }

    public DatabaseConfig withCreateIfMissing(boolean createIfMissing) {
        return new DatabaseConfig(path, keyspaces, droppedKeyspaces, mode, secondaryPath, poolWorkers,
                poolQueueMultiplier, syncWrites, disableWal, verifyChecksums, neverDropKeyspaces, createIfMissing);
    }
}

package io.rockmap.core;

import io.rockmap.core.config.DatabaseConfig;
import io.rockmap.core.engine.EngineMode;
import io.rockmap.core.error.NotFoundException;
import io.rockmap.core.error.OpenException;
import io.rockmap.core.error.WriteException;
import io.rockmap.core.keyspace.Keyspace;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    @TempDir
    Path dir;

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private DatabaseConfig config(String... keyspaces) {
        return DatabaseConfig.defaults(dir.resolve("db")).withKeyspaces(keyspaces).withPool(2, 4);
    }

    @Test
    void opensConfiguredKeyspaces() {
        try (Database db = Database.open(config("users", "rooms"))) {
            assertEquals(Set.of("users", "rooms"), db.names());
            assertEquals("users", db.get("users").name());
            assertTrue(db.find("rooms").isPresent());
            assertFalse(db.isReadOnly());
            assertFalse(db.isSecondary());
            assertEquals(EngineMode.READ_WRITE, db.engine().mode());
        }
    }

    @Test
    void unknownKeyspaceIsNotFound() {
        try (Database db = Database.open(config("users"))) {
            assertThrows(NotFoundException.class, () -> db.get("default"));
            assertThrows(NotFoundException.class, () -> db.get("missing"));
            assertTrue(db.find("missing").isEmpty());
        }
    }

    @Test
    void dataSurvivesReopen() throws Exception {
        try (Database db = Database.open(config("users"))) {
            db.get("users").insert(b("alice"), b("1")).get(5, TimeUnit.SECONDS);
        }
        try (Database db = Database.open(config("users", "rooms"))) {
            assertArrayEquals(b("1"), db.get("users").get(b("alice")).get(5, TimeUnit.SECONDS));
            assertEquals(Set.of("users", "rooms"), db.names());
        }
    }

    @Test
    void undescribedKeyspacesOnDiskAreStillOpened() {
        try (Database db = Database.open(config("users", "legacy"))) {
            assertEquals(2, db.names().size());
        }
        try (Database db = Database.open(config("users"))) {
            assertTrue(db.names().contains("legacy"));
        }
    }

    @Test
    void droppedKeyspaceIsRemoved() throws Exception {
        try (Database db = Database.open(config("users", "legacy"))) {
            db.get("legacy").insert(b("k"), b("v")).get(5, TimeUnit.SECONDS);
        }
        try (Database db = Database.open(config("users").withDroppedKeyspaces(List.of("legacy")))) {
            assertEquals(Set.of("users"), db.names());
        }
        try (Database db = Database.open(config("users"))) {
            assertEquals(Set.of("users"), db.names());
        }
    }

    @Test
    void neverDropKeepsDroppedKeyspace() {
        try (Database db = Database.open(config("users", "legacy"))) {
            assertEquals(2, db.names().size());
        }
        DatabaseConfig keep = config("users").withDroppedKeyspaces(List.of("legacy")).withNeverDropKeyspaces(true);
        try (Database db = Database.open(keep)) {
            assertTrue(db.names().contains("legacy"));
        }
    }

    @Test
    void readOnlyRejectsWritesButServesReads() throws Exception {
        try (Database db = Database.open(config("users"))) {
            db.get("users").insert(b("alice"), b("1")).get(5, TimeUnit.SECONDS);
        }
        try (Database db = Database.open(config("users").withMode(EngineMode.READ_ONLY))) {
            Keyspace users = db.get("users");
            assertTrue(db.isReadOnly());
            assertArrayEquals(b("1"), users.get(b("alice")).get(5, TimeUnit.SECONDS));

            ExecutionException insert = assertThrows(ExecutionException.class,
                    () -> users.insert(b("bob"), b("2")).get(5, TimeUnit.SECONDS));
            assertInstanceOf(WriteException.class, insert.getCause());
            ExecutionException remove = assertThrows(ExecutionException.class,
                    () -> users.remove(b("alice")).get(5, TimeUnit.SECONDS));
            assertInstanceOf(WriteException.class, remove.getCause());
        }
    }

    @Test
    void readOnlySkipsKeyspacesItCannotCreate() {
        try (Database db = Database.open(config("users"))) {
            assertEquals(1, db.names().size());
        }
        try (Database db = Database.open(config("users", "brand-new").withMode(EngineMode.READ_ONLY))) {
            assertEquals(Set.of("users"), db.names());
            assertThrows(NotFoundException.class, () -> db.get("brand-new"));
        }
    }

    @Test
    void readOnlyOpenOfMissingDatabaseFails() {
        DatabaseConfig missing = DatabaseConfig.defaults(dir.resolve("absent"))
                .withKeyspaces("users")
                .withMode(EngineMode.READ_ONLY);

        assertThrows(OpenException.class, () -> Database.open(missing));
    }

    @Test
    void missingDirectoryWithoutCreateFails() {
        DatabaseConfig noCreate = config("users").withCreateIfMissing(false);

        assertThrows(OpenException.class, () -> Database.open(noCreate));
    }

    @Test
    void secondaryFollowsPrimary() throws Exception {
        try (Database primary = Database.open(config("users"))) {
            primary.get("users").insert(b("alice"), b("1")).get(5, TimeUnit.SECONDS);
            primary.engine().flush().get(5, TimeUnit.SECONDS);

            DatabaseConfig replica = config("users").withSecondary(dir.resolve("replica"));
            try (Database secondary = Database.open(replica)) {
                assertTrue(secondary.isSecondary());
                assertArrayEquals(b("1"), secondary.get("users").get(b("alice")).get(5, TimeUnit.SECONDS));
                secondary.engine().catchUpWithPrimary().get(5, TimeUnit.SECONDS);

                ExecutionException ex = assertThrows(ExecutionException.class,
                        () -> secondary.get("users").insert(b("bob"), b("2")).get(5, TimeUnit.SECONDS));
                assertInstanceOf(WriteException.class, ex.getCause());
            }
        }
    }

    @Test
    void maintenanceOperationsComplete() throws Exception {
        try (Database db = Database.open(config("users"))) {
            db.get("users").insert(b("a"), b("1")).get(5, TimeUnit.SECONDS);
            db.engine().flush().get(5, TimeUnit.SECONDS);
            db.engine().sync().get(5, TimeUnit.SECONDS);
            assertTrue(db.engine().latestSequenceNumber() > 0);
            assertThrows(IllegalStateException.class, () -> db.engine().catchUpWithPrimary());
        }
    }

    @Test
    void closeIsIdempotent() {
        Database db = Database.open(config("users"));
        db.close();
        db.close();
        assertTrue(db.engine().pool().isClosed());
    }
}

package io.rockmap.core.cork;

import io.rockmap.core.Database;
import io.rockmap.core.config.DatabaseConfig;
import io.rockmap.core.engine.EngineMode;
import io.rockmap.core.error.WriteException;
import io.rockmap.core.keyspace.Keyspace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CorkTest {

    @TempDir
    Path dir;

    private Database db;
    private Keyspace users;
    private Keyspace rooms;

    @BeforeEach
    void setUp() {
        db = Database.open(DatabaseConfig.defaults(dir.resolve("db")).withKeyspaces("users", "rooms").withPool(2, 4));
        users = db.get("users");
        rooms = db.get("rooms");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private static byte[] b(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void nothingIsVisibleBeforeCommit() throws Exception {
        await(users.insert(b("doomed"), b("x")));
        Cork cork = users.cork()
                .put(b("a"), b("1"))
                .put(b("b"), b("2"))
                .delete(b("doomed"));

        assertEquals(3, cork.size());
        assertFalse(await(users.contains(b("a"))));
        assertTrue(await(users.contains(b("doomed"))));

        await(cork.commit());

        assertTrue(cork.isCommitted());
        assertArrayEquals(b("1"), await(users.get(b("a"))));
        assertArrayEquals(b("2"), await(users.get(b("b"))));
        assertFalse(await(users.contains(b("doomed"))));
    }

    @Test
    void spansKeyspaces() throws Exception {
        try (Cork cork = db.cork()) {
            cork.put(users, b("u1"), b("alice")).put(rooms, b("r1"), b("lobby"));
            await(cork.commit());
        }

        assertArrayEquals(b("alice"), await(users.get(b("u1"))));
        assertArrayEquals(b("lobby"), await(rooms.get(b("r1"))));
    }

    @Test
    void closingUncommittedCorkDiscardsEverything() throws Exception {
        try (Cork cork = users.cork()) {
            cork.put(b("a"), b("1")).put(b("b"), b("2"));
        }

        assertEquals(0L, await(users.count()));
    }

    @Test
    void corkCannotBeReused() throws Exception {
        Cork cork = users.cork().put(b("a"), b("1"));
        await(cork.commit());

        assertThrows(IllegalStateException.class, cork::commit);
        assertThrows(IllegalStateException.class, () -> cork.put(b("b"), b("2")));

        Cork closed = users.cork();
        closed.close();
        assertThrows(IllegalStateException.class, () -> closed.delete(b("a")));
    }

    @Test
    void keyspacelessOperationsNeedDefaultKeyspace() {
        try (Cork cork = db.cork()) {
            assertThrows(IllegalStateException.class, () -> cork.put(b("a"), b("1")));
        }
    }

    @Test
    void commitWakesWatchersAfterBatchLands() throws Exception {
        CompletableFuture<Void> userWatch = users.watch(b("a"));
        CompletableFuture<Void> roomWatch = rooms.watch(b("r"));
        CompletableFuture<Void> untouched = users.watch(b("z"));
        Cork cork = db.cork().put(users, b("a"), b("1")).delete(rooms, b("r"));

        assertFalse(userWatch.isDone());
        await(cork.commit());

        await(userWatch);
        await(roomWatch);
        assertFalse(untouched.isDone());
    }

    @Test
    void laterOperationOnSameKeyWins() throws Exception {
        Cork cork = users.cork().put(b("k"), b("1")).delete(b("k")).put(b("k"), b("3"));
        await(cork.commit());

        assertArrayEquals(b("3"), await(users.get(b("k"))));
        assertEquals(1L, await(users.count()));
    }

    @Test
    void emptyCommitCompletesImmediately() throws Exception {
        CompletableFuture<Void> done = users.cork().commit();
        assertTrue(done.isDone());
        await(done);
    }

    @Test
    void rejectsKeyspaceOfAnotherEngine() throws Exception {
        try (Database other = Database.open(DatabaseConfig.defaults(dir.resolve("other")).withKeyspaces("users"))) {
            Keyspace foreign = other.get("users");
            try (Cork cork = db.cork()) {
                assertThrows(IllegalArgumentException.class, () -> cork.put(foreign, b("a"), b("1")));
            }
        }
    }

    @Test
    void readOnlyDatabaseRejectsCommit() throws Exception {
        await(users.insert(b("a"), b("1")));
        db.close();

        db = Database.open(DatabaseConfig.defaults(dir.resolve("db"))
                .withKeyspaces("users", "rooms")
                .withMode(EngineMode.READ_ONLY));
        Keyspace readOnly = db.get("users");
        Cork cork = readOnly.cork().put(b("b"), b("2"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> await(cork.commit()));
        assertInstanceOf(WriteException.class, ex.getCause());
        assertArrayEquals(b("1"), await(readOnly.get(b("a"))));
    }

    @Test
    void engineRejectionAppliesNothing() throws Exception {
        DatabaseConfig rejecting = DatabaseConfig.defaults(dir.resolve("rejecting"))
                .withKeyspaces("users", "rooms")
                .withPool(2, 4)
                .withSyncWrites(true)
                .withDisableWal(true);
        try (Database other = Database.open(rejecting)) {
            Keyspace otherUsers = other.get("users");
            Keyspace otherRooms = other.get("rooms");
            CompletableFuture<Void> watcher = otherUsers.watch(b("a"));
            Cork cork = other.cork()
                    .put(otherUsers, b("a"), b("1"))
                    .put(otherRooms, b("r"), b("lobby"))
                    .delete(otherUsers, b("b"));

            ExecutionException ex = assertThrows(ExecutionException.class, () -> await(cork.commit()));
            assertInstanceOf(WriteException.class, ex.getCause());

            assertTrue(await(otherUsers.find(b("a"))).isEmpty());
            assertTrue(await(otherRooms.find(b("r"))).isEmpty());
            assertEquals(0L, await(otherUsers.count()));
            assertEquals(0L, await(otherRooms.count()));
            assertFalse(watcher.isDone());
            assertThrows(IllegalStateException.class, cork::commit);
        }
    }
}

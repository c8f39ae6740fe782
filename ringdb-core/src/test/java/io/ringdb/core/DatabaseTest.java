package io.ringdb.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.exception.CorruptionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class DatabaseTest {

    private static final DatabaseConfig SYNC = DatabaseConfig.create().withFlushDelay(Duration.ZERO);

    @TempDir
    Path tempDir;

    private Database db;

    @AfterEach
    void tearDown() {
        if (db != null) {
            db.close();
        }
    }

    private static JsonElement json(String text) {
        return JsonParser.parseString(text);
    }

    private static List<Item> scanAll(Database db) {
        List<Item> items = new ArrayList<>();
        try (CloseableIterator<Item> it = db.scan()) {
            it.forEachRemaining(items::add);
        }
        return items;
    }

    /**
     * Ring "a" with items 1, 2, 3 and 50 loaded from a file, read-only for ids [0, 100), under a writable
     * in-memory ring "b" for ids from 100.
     */
    private Database openTwoRings() throws IOException {
        Path file = tempDir.resolve("a.json");
        Files.writeString(file, """
            [
              {"__id": 1, "x": 1},
              {"__id": 2, "x": 2},
              {"__id": 3, "x": 3},
              {"__id": 50, "x": 50}
            ]
            """);
        RingConfig a = RingConfig.file(file).withIdRange(0, 100).withReadonly(true);
        RingConfig b = RingConfig.memory("b").withIdRange(100, RingConfig.UNBOUNDED);
        return Database.open(SYNC, a, b);
    }

    @Nested
    class InsertAndSelect {

        @Test
        void insertAssignsIncreasingIds() {
            db = Database.open(SYNC, RingConfig.memory("main"));

            long first = db.insert(json("{\"x\": 1}"));
            long second = db.insert(json("{\"x\": 2}"));

            assertThat(first).isEqualTo(1);
            assertThat(second).isEqualTo(2);
            assertThat(db.select(first)).isEqualTo(json("{\"x\": 1}"));
            assertThat(db.select(second)).isEqualTo(json("{\"x\": 2}"));
        }

        @Test
        void explicitIdAdvancesAutoincrement() {
            db = Database.open(SYNC, RingConfig.memory("main"));

            assertThat(db.insert(10, json("{\"x\": 10}"))).isEqualTo(10);
            assertThat(db.insert(json("{\"x\": 11}"))).isEqualTo(11);
            assertThat(db.insert(5, json("{\"x\": 5}"))).isEqualTo(5);
            assertThat(db.insert(json("{}"))).isEqualTo(12);
        }

        @Test
        void nonObjectDataIsStoredAsIs() {
            db = Database.open(SYNC, RingConfig.memory("main"));

            long id = db.insert(json("[1, \"two\", null]"));

            assertThat(db.select(id)).isEqualTo(json("[1, \"two\", null]"));
        }

        @Test
        void missingItemIsNotFound() {
            db = Database.open(SYNC, RingConfig.memory("main"));

            assertThat(db.get(7)).isEmpty();
            assertThatThrownBy(() -> db.select(7))
                .isInstanceOfSatisfying(DatabaseException.NotFound.class, e -> assertThat(e.id()).isEqualTo(7));
        }

        @Test
        void negativeIdIsNeverFound() {
            db = Database.open(SYNC, RingConfig.memory("main"));
            db.insert(json("{}"));

            assertThat(db.get(-1)).isEmpty();
            assertThat(db.delete(-1)).isFalse();
            assertThat(db.findRing(-1L)).isEmpty();
            assertThatThrownBy(() -> db.update(-1, Edit.overwrite(json("{}"))))
                .isInstanceOf(DatabaseException.NotFound.class);
            assertThatThrownBy(() -> db.insert(-1, json("{}")))
                .isInstanceOf(DatabaseException.IdOutOfRange.class);
        }

        @Test
        void duplicateIdIsRejected() {
            db = Database.open(SYNC, RingConfig.memory("main"));
            db.insert(3, json("{}"));

            assertThatThrownBy(() -> db.insert(3, json("{\"again\": true}")))
                .isInstanceOfSatisfying(DatabaseException.DuplicateId.class, e -> {
                    assertThat(e.id()).isEqualTo(3);
                    assertThat(e.ring()).isEqualTo("main");
                });
            assertThat(db.select(3)).isEqualTo(json("{}"));
        }

        @Test
        void duplicateInLowerRingIsRejected() {
            db = Database.open(SYNC, RingConfig.memory("low"), RingConfig.memory("high"));
            db.insert(json("{}"), "low");

            assertThat(db.findRing(1)).map(Ring::name).contains("low");
            assertThatThrownBy(() -> db.insert(1, json("{}")))
                .isInstanceOfSatisfying(DatabaseException.DuplicateId.class, e -> assertThat(e.ring()).isEqualTo("low"));
        }

        @Test
        void targetedInsertUsesNamedRing() {
            db = Database.open(SYNC, RingConfig.memory("low"), RingConfig.memory("high").withIdRange(1000, 2000));

            long id = db.insert(json("{\"x\": 1}"), "low");

            assertThat(id).isEqualTo(1);
            assertThat(db.findRing(id)).map(Ring::name).contains("low");
            assertThatThrownBy(() -> db.insert(json("{}"), "missing"))
                .isInstanceOfSatisfying(DatabaseException.UnknownRing.class, e -> assertThat(e.name()).isEqualTo("missing"));
        }
    }

    @Nested
    class RingStack {

        @Test
        void insertLandsInTopWritableRing() throws IOException {
            db = openTwoRings();

            long id = db.insert(json("{\"x\": 1}"));

            assertThat(id).isEqualTo(100);
            assertThat(db.findRing(id)).map(Ring::name).contains("b");
            assertThat(db.top().name()).isEqualTo("b");
            assertThat(db.bottom().name()).isEqualTo("a");
        }

        @Test
        void updateOfReadonlyItemIsSavedInHigherRing() throws IOException {
            db = openTwoRings();
            Ring a = db.findRing("a").orElseThrow();

            JsonElement updated = db.update(50, Edit.set("y", new JsonPrimitive(7)));

            assertThat(updated).isEqualTo(json("{\"x\": 50, \"y\": 7}"));
            assertThat(db.findRing(50)).map(Ring::name).contains("b");
            assertThat(db.select(50)).isEqualTo(updated);
            assertThat(a.select(50)).contains(json("{\"x\": 50}"));
            assertThat(scanAll(db))
                .extracting(Item::id)
                .containsExactly(1L, 2L, 3L, 50L);
            assertThat(scanAll(db).get(3).data()).isEqualTo(updated);
        }

        @Test
        void updateOfWritableItemStaysInPlace() throws IOException {
            db = openTwoRings();
            long id = db.insert(json("{\"x\": 1}"));

            db.update(id, Edit.mergePatch(json("{\"x\": 2, \"z\": {\"k\": 1}}")));

            assertThat(db.select(id)).isEqualTo(json("{\"x\": 2, \"z\": {\"k\": 1}}"));
            assertThat(db.findRing("b").orElseThrow().size()).isEqualTo(1);
        }

        @Test
        void editsAreAppliedInOrder() {
            db = Database.open(SYNC, RingConfig.memory("main"));
            long id = db.insert(json("{\"a\": 1}"));

            JsonElement result = db.update(id,
                Edit.set("b", new JsonPrimitive(2)),
                Edit.remove("a"),
                Edit.mergePatch(json("{\"c\": 3}"))
            );

            assertThat(result).isEqualTo(json("{\"b\": 2, \"c\": 3}"));
            assertThat(db.select(id)).isEqualTo(result);
        }

        @Test
        void updateOfMissingItemIsNotFound() {
            db = Database.open(SYNC, RingConfig.memory("main"));

            assertThatThrownBy(() -> db.update(1, Edit.overwrite(json("{}"))))
                .isInstanceOf(DatabaseException.NotFound.class);
        }

        @Test
        void updateWithOnlyReadonlyRingsFails() throws IOException {
            Path file = tempDir.resolve("frozen.json");
            Files.writeString(file, "[{\"__id\": 1, \"x\": 1}]");
            db = Database.open(SYNC, RingConfig.file(file).withReadonly(true));

            assertThatThrownBy(() -> db.update(1, Edit.overwrite(json("{}"))))
                .isInstanceOfSatisfying(DatabaseException.ReadOnly.class, e -> assertThat(e.ring()).isEqualTo("frozen"));
            assertThat(db.select(1)).isEqualTo(json("{\"x\": 1}"));
        }

        @Test
        void insertWithoutWritableRingFails() throws IOException {
            Path file = tempDir.resolve("frozen.json");
            Files.writeString(file, "[]");
            db = Database.open(SYNC, RingConfig.file(file).withReadonly(true));

            assertThatThrownBy(() -> db.insert(json("{}"))).isInstanceOf(DatabaseException.NoWritableRing.class);
            assertThatThrownBy(() -> db.insert(1, json("{}"))).isInstanceOf(DatabaseException.NoWritableRing.class);
            assertThatThrownBy(() -> db.insert(json("{}"), "frozen")).isInstanceOf(DatabaseException.ReadOnly.class);
        }

        @Test
        void insertFallsBackToLowerRingWhenTopRangeIsUsedUp() {
            db = Database.open(SYNC,
                RingConfig.memory("low").withIdRange(100, RingConfig.UNBOUNDED),
                RingConfig.memory("high").withIdRange(1, 3)
            );

            assertThat(db.insert(json("{}"))).isEqualTo(1);
            assertThat(db.insert(json("{}"))).isEqualTo(2);
            assertThat(db.insert(json("{}"))).isEqualTo(100);
            assertThat(db.findRing(100)).map(Ring::name).contains("low");
        }

        @Test
        void idOutsideEveryRangeIsRejected() {
            db = Database.open(SYNC, RingConfig.memory("main").withIdRange(0, 2));

            db.insert(json("{}"));
            assertThatThrownBy(() -> db.insert(json("{}")))
                .isInstanceOfSatisfying(DatabaseException.IdOutOfRange.class, e -> assertThat(e.id()).isEqualTo(2));
            assertThatThrownBy(() -> db.insert(500, json("{}")))
                .isInstanceOfSatisfying(DatabaseException.IdOutOfRange.class, e -> assertThat(e.ring()).isEqualTo("main"));
        }

        @Test
        void appendedRingBecomesTop() throws IOException {
            db = openTwoRings();
            db.update(2, Edit.set("v", new JsonPrimitive("b")));

            db.append(RingConfig.memory("c").withIdRange(1000, 2000));

            assertThat(db.rings()).extracting(Ring::name).containsExactly("a", "b", "c");
            assertThat(db.top().name()).isEqualTo("c");
            assertThat(db.insert(json("{}"))).isEqualTo(1000);

            db.update(2, Edit.set("v", new JsonPrimitive("again")));
            assertThat(db.findRing(2)).map(Ring::name).contains("b");
            assertThat(db.select(2)).isEqualTo(json("{\"x\": 2, \"v\": \"again\"}"));
            assertThatThrownBy(() -> db.append(RingConfig.memory("c"))).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Delete {

        @Test
        void secondDeleteReturnsFalse() {
            db = Database.open(SYNC, RingConfig.memory("main"));
            long id = db.insert(json("{}"));

            assertThat(db.delete(id)).isTrue();
            assertThat(db.delete(id)).isFalse();
            assertThat(db.get(id)).isEmpty();
        }

        @Test
        void deleteOfUnknownIdReturnsFalse() {
            db = Database.open(SYNC, RingConfig.memory("main"));

            assertThat(db.delete(99)).isFalse();
        }

        @Test
        void deleteInReadonlyRingFails() throws IOException {
            db = openTwoRings();

            assertThatThrownBy(() -> db.delete(1))
                .isInstanceOfSatisfying(DatabaseException.ReadOnly.class, e -> assertThat(e.ring()).isEqualTo("a"));
            assertThat(db.select(1)).isEqualTo(json("{\"x\": 1}"));
        }

        @Test
        void deletingShadowingCopyUncoversLowerCopy() throws IOException {
            db = openTwoRings();
            db.update(50, Edit.overwrite(json("{\"x\": -1}")));

            assertThat(db.delete(50)).isTrue();

            assertThat(db.select(50)).isEqualTo(json("{\"x\": 50}"));
            assertThatThrownBy(() -> db.delete(50)).isInstanceOf(DatabaseException.ReadOnly.class);
        }
    }

    @Nested
    class Scan {

        @Test
        void scanMergesRingsInIdOrder() throws IOException {
            db = openTwoRings();
            db.insert(json("{\"x\": 100}"));
            db.update(3, Edit.set("x", new JsonPrimitive(33)));

            List<Item> items = scanAll(db);

            assertThat(items).extracting(Item::id).containsExactly(1L, 2L, 3L, 50L, 100L);
            assertThat(items.get(2).data()).isEqualTo(json("{\"x\": 33}"));
        }

        @Test
        void scanRangeIsHalfOpen() throws IOException {
            db = openTwoRings();
            db.insert(json("{}"));

            List<Long> ids = new ArrayList<>();
            try (CloseableIterator<Item> it = db.scan(2L, 100L)) {
                it.forEachRemaining(item -> ids.add(item.id()));
            }

            assertThat(ids).containsExactly(2L, 3L, 50L);
        }

        @Test
        void scanOfEmptyDatabaseIsEmpty() {
            db = Database.open(SYNC, RingConfig.memory("main"));

            assertThat(scanAll(db)).isEmpty();
        }
    }

    @Nested
    class Persistence {

        @Test
        void itemsSurviveReopen() {
            Path file = tempDir.resolve("data/main.json");

            try (Database first = Database.open(DatabaseConfig.create(), RingConfig.file(file))) {
                first.insert(json("{\"name\": \"alpha\"}"));
                first.insert(json("[1, 2]"));
                first.insert(7, json("{\"__data\": \"reserved\"}"));
                first.delete(1);
            }

            db = Database.open(SYNC, RingConfig.file(file));

            assertThat(db.get(1)).isEmpty();
            assertThat(db.select(2)).isEqualTo(json("[1, 2]"));
            assertThat(db.select(7)).isEqualTo(json("{\"__data\": \"reserved\"}"));
            assertThat(db.insert(json("{}"))).isEqualTo(8);
        }

        @Test
        void updateSavedAboveReadOnlyRingSurvivesReopen() throws IOException {
            Path lower = tempDir.resolve("a.json");
            Files.writeString(lower, "[{\"__id\": 50, \"x\": 50}]");
            RingConfig a = RingConfig.file(lower).withIdRange(0, 100).withReadonly(true);
            RingConfig b = RingConfig.file(tempDir.resolve("b.json")).withIdRange(100, RingConfig.UNBOUNDED);

            try (Database first = Database.open(SYNC, a, b)) {
                first.update(50, Edit.set("y", new JsonPrimitive(7)));
            }

            db = Database.open(SYNC, a, b);

            assertThat(db.findRing(50)).map(Ring::name).contains("b");
            assertThat(db.select(50)).isEqualTo(json("{\"x\": 50, \"y\": 7}"));
            assertThat(db.insert(json("{}"))).isEqualTo(100);
        }

        @Test
        void loadAcceptsIdBelowRingRange() throws IOException {
            Path file = tempDir.resolve("ring.json");
            Files.writeString(file, "[{\"__id\": 5, \"x\": 1}]");

            db = Database.open(SYNC, RingConfig.file(file).withIdRange(100, 200));

            assertThat(db.select(5)).isEqualTo(json("{\"x\": 1}"));
            assertThat(db.insert(json("{}"))).isEqualTo(100);
        }

        @Test
        void loadRejectsIdAboveRingRange() throws IOException {
            Path file = tempDir.resolve("ring.json");
            Files.writeString(file, "[{\"__id\": 150, \"x\": 1}]");

            assertThatThrownBy(() -> Database.open(SYNC, RingConfig.file(file).withIdRange(0, 100)))
                .isInstanceOf(CorruptionException.class)
                .hasMessageContaining("150");
        }

        @Test
        void loadRejectsDuplicateIds() throws IOException {
            Path file = tempDir.resolve("ring.json");
            Files.writeString(file, "[{\"__id\": 1}, {\"__id\": 1}]");

            assertThatThrownBy(() -> Database.open(SYNC, RingConfig.file(file)))
                .isInstanceOf(CorruptionException.class);
        }

        @Test
        void debouncedWritesReachDiskAfterDelay() throws Exception {
            Path file = tempDir.resolve("main.json");
            db = Database.open(DatabaseConfig.create().withFlushDelay(Duration.ofMillis(100)), RingConfig.file(file));

            db.insert(json("{\"x\": 1}"));
            db.insert(json("{\"x\": 2}"));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!Files.readString(file).contains("\"x\": 2") && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
            assertThat(Files.readString(file)).contains("\"__id\": 1", "\"__id\": 2");
        }

        @Test
        void closedDatabaseRejectsOperations() {
            Database closed = Database.open(SYNC, RingConfig.memory("main"));
            closed.close();

            assertThatThrownBy(() -> closed.insert(json("{}"))).isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> closed.get(1)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class Concurrency {

        @Test
        void concurrentUpdatesOfOneItemAreNotLost() throws Exception {
            db = Database.open(DatabaseConfig.create(), RingConfig.memory("main"));
            long id = db.insert(json("{\"count\": 0}"));
            Edit increment = data -> {
                JsonObject next = data.getAsJsonObject().deepCopy();
                next.addProperty("count", next.get("count").getAsInt() + 1);
                return next;
            };

            int threads = 8;
            int perThread = 200;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        db.update(id, increment);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            assertThat(db.select(id).getAsJsonObject().get("count").getAsInt()).isEqualTo(threads * perThread);
        }

        @Test
        void concurrentInsertsGetDistinctIds() throws Exception {
            db = Database.open(DatabaseConfig.create(), RingConfig.memory("main"));

            int threads = 8;
            int perThread = 100;
            Set<Long> ids = ConcurrentHashMap.newKeySet();
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        ids.add(db.insert(json("{}")));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            assertThat(ids).hasSize(threads * perThread);
            assertThat(db.top().size()).isEqualTo(threads * perThread);
        }
    }
}

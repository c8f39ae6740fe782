package io.ringdb.benchmark;

import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.ringdb.common.CloseableIterator;
import io.ringdb.common.record.FieldType;
import io.ringdb.common.record.RecordSchema;
import io.ringdb.core.Database;
import io.ringdb.core.DatabaseConfig;
import io.ringdb.core.Edit;
import io.ringdb.core.Item;
import io.ringdb.core.RingConfig;
import io.ringdb.core.index.FieldIndex;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Two in-memory rings: a lower one seeded with items and one on top for new ids, each maintaining
 * a name index.
 */
@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
public class RingStackBenchmark {

    private static final int ITEM_COUNT = 50_000;
    private static final long TOP_START_ID = 1_000_000;

    private static final RecordSchema BY_NAME = RecordSchema.builder()
        .key("name", FieldType.STRING)
        .key("id", FieldType.INTEGER)
        .build();

    private Database db;

    @Setup(Level.Trial)
    public void setup() {
        db = Database.open(
            DatabaseConfig.create(),
            RingConfig.memory("base").withIdRange(0, TOP_START_ID).withIndexes(new FieldIndex("by_name", BY_NAME)),
            RingConfig.memory("top").withIdRange(TOP_START_ID, RingConfig.UNBOUNDED).withIndexes(new FieldIndex("by_name", BY_NAME))
        );
        for (int i = 0; i < ITEM_COUNT; i++) {
            db.insert(item(i), "base");
        }
        db.awaitPropagation();
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        db.close();
    }

    private static JsonObject item(int n) {
        JsonObject data = new JsonObject();
        data.addProperty("name", "item-" + n);
        data.addProperty("n", n);
        return data;
    }

    private static long randomBaseId() {
        return 1 + ThreadLocalRandom.current().nextInt(ITEM_COUNT);
    }

    @Benchmark
    @BenchmarkMode({Mode.Throughput, Mode.SampleTime})
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public Object selectFromLowerRing() {
        return db.select(randomBaseId());
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public long insertIntoTopRing() {
        return db.insert(item(ThreadLocalRandom.current().nextInt()));
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public Object updateInPlace() {
        return db.update(randomBaseId(), Edit.set("touched", new JsonPrimitive(true)));
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    @OperationsPerInvocation(1000)
    public void scanMerged1000(Blackhole bh) {
        long start = randomBaseId();
        try (CloseableIterator<Item> it = db.scan(start, start + 1000)) {
            it.forEachRemaining(bh::consume);
        }
    }
}

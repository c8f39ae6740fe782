package io.ringdb.benchmark;

import io.ringdb.common.ByteArray;
import io.ringdb.common.record.FieldType;
import io.ringdb.common.record.RecordSchema;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@Fork(1)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
public class KeyCodecBenchmark {

    private static final int KEY_COUNT = 10_000;

    private static final RecordSchema SCHEMA = RecordSchema.builder()
        .key("name", FieldType.STRING)
        .key("parent", FieldType.NULLABLE_INTEGER)
        .key("id", FieldType.INTEGER)
        .value("age")
        .build();

    private List<List<Object>> tuples;
    private ByteArray[] keys;

    @Setup(Level.Trial)
    public void setup() {
        tuples = new ArrayList<>(KEY_COUNT);
        keys = new ByteArray[KEY_COUNT];
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < KEY_COUNT; i++) {
            List<Object> tuple = List.of("name-" + random.nextInt(1_000_000), (long) random.nextInt(1000), (long) i);
            tuples.add(tuple);
            keys[i] = SCHEMA.encodeKey(tuple);
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public ByteArray encode() {
        return SCHEMA.encodeKey(tuples.get(ThreadLocalRandom.current().nextInt(KEY_COUNT)));
    }

    @Benchmark
    @BenchmarkMode(Mode.Throughput)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public List<Object> decode() {
        return SCHEMA.decodeKey(keys[ThreadLocalRandom.current().nextInt(KEY_COUNT)]);
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    @OperationsPerInvocation(KEY_COUNT)
    public void compareAll(Blackhole bh) {
        for (int i = 1; i < KEY_COUNT; i++) {
            bh.consume(keys[i - 1].compareTo(keys[i]));
        }
    }
}

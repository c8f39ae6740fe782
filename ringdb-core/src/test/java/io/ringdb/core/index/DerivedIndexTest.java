package io.ringdb.core.index;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import io.ringdb.common.ByteArray;
import io.ringdb.common.KeyValue;
import io.ringdb.common.record.FieldType;
import io.ringdb.common.record.Record;
import io.ringdb.common.record.RecordSchema;
import io.ringdb.core.Change;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DerivedIndexTest {

    private static final RecordSchema BY_TAG = RecordSchema.builder()
        .key("tags", FieldType.STRING)
        .key("id", FieldType.INTEGER)
        .value("score")
        .build();

    private final FieldIndex index = new FieldIndex("by_tag", BY_TAG);

    private static Change change(long id, String oldData, String newData) {
        return new Change(RecordSchema.DATA.encodeKey(id), oldData, newData);
    }

    private static ByteArray key(String tag, long id) {
        return BY_TAG.encodeKey(tag, id);
    }

    @Test
    void insertPutsAllRecords() {
        IndexPlan plan = index.plan(change(1, null, "{\"tags\": [\"a\", \"b\"], \"score\": 5}"));

        assertThat(plan.deletes()).isEmpty();
        assertThat(plan.puts()).containsExactly(
            new KeyValue(key("a", 1), "[5]"),
            new KeyValue(key("b", 1), "[5]")
        );
    }

    @Test
    void deleteRemovesAllRecords() {
        IndexPlan plan = index.plan(change(1, "{\"tags\": [\"a\", \"b\"]}", null));

        assertThat(plan.deletes()).containsExactly(key("a", 1), key("b", 1));
        assertThat(plan.puts()).isEmpty();
    }

    @Test
    void unchangedRecordsAreNotRewritten() {
        IndexPlan plan = index.plan(change(1,
            "{\"tags\": [\"a\", \"b\"], \"score\": 5, \"note\": \"x\"}",
            "{\"tags\": [\"b\", \"c\"], \"score\": 5, \"note\": \"y\"}"
        ));

        assertThat(plan.deletes()).containsExactly(key("a", 1));
        assertThat(plan.puts()).containsExactly(new KeyValue(key("c", 1), "[5]"));
    }

    @Test
    void overwrittenKeysAreNotDeleted() {
        IndexPlan plan = index.plan(change(1, "{\"tags\": [\"a\"], \"score\": 5}", "{\"tags\": [\"a\"], \"score\": 6}"));

        assertThat(plan.deletes()).isEmpty();
        assertThat(plan.puts()).containsExactly(new KeyValue(key("a", 1), "[6]"));
    }

    @Test
    void irrelevantChangeGivesEmptyPlan() {
        IndexPlan plan = index.plan(change(1, "{\"tags\": [\"a\"], \"x\": 1}", "{\"tags\": [\"a\"], \"x\": 2}"));

        assertThat(plan.isEmpty()).isTrue();
    }

    @Test
    void repeatedValuesKeepFirstRecord() {
        Map<ByteArray, String> records = index.records(1, JsonParser.parseString("{\"tags\": [\"a\", \"a\"], \"score\": 1}"));

        assertThat(records).containsOnlyKeys(key("a", 1));
    }

    @Test
    void pruneOnDisjointPlansKeepsEverything() {
        Map<ByteArray, String> deletes = new LinkedHashMap<>(Map.of(key("a", 1), ""));
        Map<ByteArray, String> puts = new LinkedHashMap<>(Map.of(key("b", 1), ""));

        DerivedIndex.prune(deletes, puts);

        assertThat(deletes).containsOnlyKeys(key("a", 1));
        assertThat(puts).containsOnlyKeys(key("b", 1));
    }

    @Test
    void customIndexCanDeriveAnyRecords() {
        DerivedIndex lengths = new DerivedIndex("by_length", RecordSchema.builder().key("length", FieldType.INTEGER).key("id", FieldType.INTEGER).build()) {
            @Override
            protected List<Record> derive(long id, JsonElement data) {
                return List.of(Record.of(schema(), List.of((long) data.toString().length(), id), null));
            }
        };

        IndexPlan plan = lengths.plan(change(9, null, "[1,2]"));

        assertThat(plan.puts()).containsExactly(new KeyValue(lengths.schema().encodeKey(5L, 9L), ""));
    }
}

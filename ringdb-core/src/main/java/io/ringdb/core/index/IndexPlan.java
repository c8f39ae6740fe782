package io.ringdb.core.index;

import io.ringdb.common.ByteArray;
import io.ringdb.common.KeyValue;

import java.util.List;

/**
 * Writes that bring an index in line with one change of its source data: keys to delete, then records
 * to (over)write.
 */
public record IndexPlan(List<ByteArray> deletes, List<KeyValue> puts) {

    public IndexPlan {
        deletes = List.copyOf(deletes);
        puts = List.copyOf(puts);
    }

    public boolean isEmpty() {
        return deletes.isEmpty() && puts.isEmpty();
    }
}

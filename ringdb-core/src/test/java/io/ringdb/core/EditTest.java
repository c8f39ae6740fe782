package io.ringdb.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EditTest {

    private static JsonElement json(String text) {
        return JsonParser.parseString(text);
    }

    @Nested
    class MergePatch {

        @Test
        void mergesNestedObjects() {
            JsonElement result = Edit.mergePatch(json("{\"a\": {\"b\": 2, \"c\": null}, \"d\": 4}"))
                .apply(json("{\"a\": {\"b\": 1, \"c\": 3, \"e\": 5}, \"f\": 6}"));

            assertThat(result).isEqualTo(json("{\"a\": {\"b\": 2, \"e\": 5}, \"d\": 4, \"f\": 6}"));
        }

        @Test
        void nonObjectPatchReplacesTarget() {
            assertThat(Edit.mergePatch(json("[1, 2]")).apply(json("{\"a\": 1}"))).isEqualTo(json("[1, 2]"));
            assertThat(Edit.mergePatch(json("{\"a\": 1}")).apply(json("\"text\""))).isEqualTo(json("{\"a\": 1}"));
        }

        @Test
        void arraysAreReplacedNotMerged() {
            JsonElement result = Edit.mergePatch(json("{\"tags\": [\"x\"]}")).apply(json("{\"tags\": [\"a\", \"b\"]}"));

            assertThat(result).isEqualTo(json("{\"tags\": [\"x\"]}"));
        }
    }

    @Test
    void editsDoNotMutateTheirInput() {
        JsonElement original = json("{\"a\": {\"b\": 1}}");
        JsonElement copy = original.deepCopy();

        Edit.mergePatch(json("{\"a\": {\"b\": 2}}")).apply(original);
        Edit.set("x", new JsonPrimitive(1)).apply(original);
        Edit.remove("a").apply(original);

        assertThat(original).isEqualTo(copy);
    }

    @Test
    void overwriteIgnoresCurrentData() {
        JsonElement replacement = json("{\"z\": true}");

        assertThat(Edit.overwrite(replacement).apply(json("{\"a\": 1}"))).isEqualTo(replacement);
    }

    @Test
    void setOnMissingDataStartsNewObject() {
        assertThat(Edit.set("a", new JsonPrimitive("x")).apply(null)).isEqualTo(json("{\"a\": \"x\"}"));
    }

    @Test
    void fieldEditsRequireObjectData() {
        assertThatThrownBy(() -> Edit.set("a", new JsonPrimitive(1)).apply(json("[1]")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Edit.remove("a").apply(json("3")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package io.twingraph.events.factory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JsonDiffTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Applying the diff to the source reproduces the target")
    void applyingDiffReproducesTarget() throws Exception {
        JsonNode source = objectMapper.readTree("""
            {"name":"Room 1","temp":20,"tags":["a","b","c"],"nested":{"x":1,"drop":true},"old":1}
            """);
        JsonNode target = objectMapper.readTree("""
            {"name":"Room 1","temp":21.5,"tags":["a"],"nested":{"x":2,"y":[1,2]},"new":"v"}
            """);

        List<JsonPatchOperation> patch = JsonDiff.diff(source, target);

        assertThat(JsonPatch.apply(source, patch)).isEqualTo(target);
    }

    @Test
    void equalDocumentsProduceNoOperations() throws Exception {
        JsonNode doc = objectMapper.readTree("{\"a\":{\"b\":[1,2,3]}}");

        assertThat(JsonDiff.diff(doc, doc.deepCopy())).isEmpty();
    }

    @Test
    void arrayRemovalsAreEmittedHighestIndexFirst() throws Exception {
        JsonNode source = objectMapper.readTree("{\"list\":[1,2,3,4]}");
        JsonNode target = objectMapper.readTree("{\"list\":[1,2]}");

        List<JsonPatchOperation> patch = JsonDiff.diff(source, target);

        assertThat(patch).extracting(JsonPatchOperation::op, JsonPatchOperation::path)
            .containsExactly(
                tuple("remove", "/list/3"),
                tuple("remove", "/list/2")
            );
    }

    @Test
    void pointerSegmentsAreEscaped() throws Exception {
        JsonNode source = objectMapper.readTree("{}");
        JsonNode target = objectMapper.readTree("{\"a/b\":1,\"c~d\":2}");

        List<JsonPatchOperation> patch = JsonDiff.diff(source, target);

        assertThat(patch).extracting(JsonPatchOperation::path).containsExactly("/a~1b", "/c~0d");
        assertThat(patch.get(0).firstSegment()).isEqualTo("a/b");
        assertThat(JsonPatch.apply(source, patch)).isEqualTo(target);
    }

    @Test
    void scalarTypeChangeBecomesReplace() throws Exception {
        JsonNode source = objectMapper.readTree("{\"v\":{\"inner\":1}}");
        JsonNode target = objectMapper.readTree("{\"v\":\"flat\"}");

        List<JsonPatchOperation> patch = JsonDiff.diff(source, target);

        assertThat(patch).hasSize(1);
        assertThat(patch.get(0).op()).isEqualTo(JsonPatchOperation.REPLACE);
        assertThat(patch.get(0).path()).isEqualTo("/v");
    }
}

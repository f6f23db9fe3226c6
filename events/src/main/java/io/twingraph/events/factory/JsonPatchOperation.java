package io.twingraph.events.factory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

public record JsonPatchOperation(String op, String path, JsonNode value) {

    public static final String ADD = "add";
    public static final String REMOVE = "remove";
    public static final String REPLACE = "replace";

    public static JsonPatchOperation add(String path, JsonNode value) {
        return new JsonPatchOperation(ADD, path, value);
    }

    public static JsonPatchOperation remove(String path) {
        return new JsonPatchOperation(REMOVE, path, null);
    }

    public static JsonPatchOperation replace(String path, JsonNode value) {
        return new JsonPatchOperation(REPLACE, path, value);
    }

    public List<String> segments() {
        return JsonPointer.parse(path);
    }

    public String firstSegment() {
        List<String> segments = segments();
        return segments.isEmpty() ? "" : segments.get(0);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("op", op);
        node.put("path", path);
        if (!REMOVE.equals(op)) {
            node.set("value", value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy());
        }
        return node;
    }
}

package io.twingraph.events.factory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Applies add/remove/replace operations to a copy of a document.
 */
public final class JsonPatch {

    private JsonPatch() {
    }

    public static JsonNode apply(JsonNode document, List<JsonPatchOperation> operations) {
        JsonNode result = document == null ? JsonNodeFactory.instance.nullNode() : document.deepCopy();
        for (JsonPatchOperation operation : operations) {
            result = apply(result, operation);
        }
        return result;
    }

    private static JsonNode apply(JsonNode root, JsonPatchOperation operation) {
        List<String> segments = operation.segments();
        if (segments.isEmpty()) {
            if (JsonPatchOperation.REMOVE.equals(operation.op())) {
                return JsonNodeFactory.instance.nullNode();
            }
            return operation.value().deepCopy();
        }

        JsonNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            parent = child(parent, segments.get(i), operation.path());
        }
        String last = segments.get(segments.size() - 1);

        if (parent.isObject()) {
            ObjectNode object = (ObjectNode) parent;
            switch (operation.op()) {
                case JsonPatchOperation.ADD, JsonPatchOperation.REPLACE -> object.set(last, operation.value().deepCopy());
                case JsonPatchOperation.REMOVE -> object.remove(last);
                default -> throw new IllegalArgumentException("Unsupported patch op: " + operation.op());
            }
        } else if (parent.isArray()) {
            ArrayNode array = (ArrayNode) parent;
            switch (operation.op()) {
                case JsonPatchOperation.ADD -> {
                    if ("-".equals(last)) {
                        array.add(operation.value().deepCopy());
                    } else {
                        array.insert(index(last, operation.path()), operation.value().deepCopy());
                    }
                }
                case JsonPatchOperation.REPLACE -> array.set(index(last, operation.path()), operation.value().deepCopy());
                case JsonPatchOperation.REMOVE -> array.remove(index(last, operation.path()));
                default -> throw new IllegalArgumentException("Unsupported patch op: " + operation.op());
            }
        } else {
            throw new IllegalArgumentException("Patch path does not resolve to a container: " + operation.path());
        }
        return root;
    }

    private static JsonNode child(JsonNode node, String segment, String path) {
        JsonNode next = node.isArray() ? node.get(index(segment, path)) : node.get(segment);
        if (next == null) {
            throw new IllegalArgumentException("Patch path not found: " + path);
        }
        return next;
    }

    private static int index(String segment, String path) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid array index in patch path: " + path, e);
        }
    }
}

package io.twingraph.events.factory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Structural diff between two JSON documents.
 * Applying the result to {@code source} with {@link JsonPatch#apply} yields {@code target}.
 */
public final class JsonDiff {

    private JsonDiff() {
    }

    public static List<JsonPatchOperation> diff(JsonNode source, JsonNode target) {
        List<JsonPatchOperation> operations = new ArrayList<>();
        diff("", normalize(source), normalize(target), operations);
        return operations;
    }

    private static void diff(String path, JsonNode source, JsonNode target, List<JsonPatchOperation> out) {
        if (source.isObject() && target.isObject()) {
            diffObjects(path, source, target, out);
            return;
        }
        if (source.isArray() && target.isArray()) {
            diffArrays(path, source, target, out);
            return;
        }
        if (!source.equals(target)) {
            out.add(JsonPatchOperation.replace(path, target.deepCopy()));
        }
    }

    private static void diffObjects(String path, JsonNode source, JsonNode target, List<JsonPatchOperation> out) {
        Iterator<String> sourceNames = source.fieldNames();
        while (sourceNames.hasNext()) {
            String name = sourceNames.next();
            if (!target.has(name)) {
                out.add(JsonPatchOperation.remove(JsonPointer.append(path, name)));
            }
        }
        Iterator<Map.Entry<String, JsonNode>> targetFields = target.fields();
        while (targetFields.hasNext()) {
            Map.Entry<String, JsonNode> field = targetFields.next();
            String childPath = JsonPointer.append(path, field.getKey());
            JsonNode sourceValue = source.get(field.getKey());
            if (sourceValue == null) {
                out.add(JsonPatchOperation.add(childPath, field.getValue().deepCopy()));
            } else {
                diff(childPath, sourceValue, field.getValue(), out);
            }
        }
    }

    private static void diffArrays(String path, JsonNode source, JsonNode target, List<JsonPatchOperation> out) {
        int common = Math.min(source.size(), target.size());
        for (int i = 0; i < common; i++) {
            diff(JsonPointer.append(path, i), source.get(i), target.get(i), out);
        }
        for (int i = source.size() - 1; i >= target.size(); i--) {
            out.add(JsonPatchOperation.remove(JsonPointer.append(path, i)));
        }
        for (int i = source.size(); i < target.size(); i++) {
            out.add(JsonPatchOperation.add(JsonPointer.append(path, i), target.get(i).deepCopy()));
        }
    }

    private static JsonNode normalize(JsonNode node) {
        return node == null ? MissingNode.getInstance() : node;
    }
}

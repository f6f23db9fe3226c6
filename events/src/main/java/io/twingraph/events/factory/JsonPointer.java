package io.twingraph.events.factory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RFC 6901 pointer helpers.
 */
final class JsonPointer {

    private JsonPointer() {
    }

    static String append(String parent, String token) {
        return parent + "/" + token.replace("~", "~0").replace("/", "~1");
    }

    static String append(String parent, int index) {
        return parent + "/" + index;
    }

    static List<String> parse(String pointer) {
        if (pointer == null || pointer.isEmpty()) {
            return Collections.emptyList();
        }
        if (pointer.charAt(0) != '/') {
            throw new IllegalArgumentException("JSON pointer must start with '/': " + pointer);
        }
        List<String> segments = new ArrayList<>();
        for (String raw : pointer.substring(1).split("/", -1)) {
            segments.add(raw.replace("~1", "/").replace("~0", "~"));
        }
        return segments;
    }
}

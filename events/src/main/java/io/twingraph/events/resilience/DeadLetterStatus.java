package io.twingraph.events.resilience;

import java.util.Locale;

public enum DeadLetterStatus {
    PENDING,
    RETRYING,
    RESOLVED,
    DISCARDED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DeadLetterStatus fromDb(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package dev.ebullient.sagakeeper.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ThreadStatus {
    OPEN,
    PROGRESSING,
    RESOLVED,
    ABANDONED;

    /** Open and progressing threads still need narrative attention. */
    public boolean isActive() {
        return this == OPEN || this == PROGRESSING;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ThreadStatus fromId(String id) {
        if (id == null || id.isBlank()) {
            return OPEN;
        }
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}

package dev.ebullient.sagakeeper.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Impact {
    MINOR,
    MODERATE,
    MAJOR,
    CRITICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Impact fromId(String id) {
        if (id == null) {
            return MINOR;
        }
        return switch (id.trim().toLowerCase(Locale.ROOT)) {
            case "moderate" -> MODERATE;
            case "major" -> MAJOR;
            case "critical" -> CRITICAL;
            default -> MINOR;
        };
    }
}

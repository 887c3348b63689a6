package dev.ebullient.sagakeeper.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Importance {
    MINOR(1),
    MEDIUM(2),
    MAJOR(3);

    private final int weight;

    Importance(int weight) {
        this.weight = weight;
    }

    /** Higher weight sorts first when ranking threads */
    public int weight() {
        return weight;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup: extracted facts use free text, so anything unrecognized is MEDIUM.
     */
    @JsonCreator
    public static Importance fromId(String id) {
        if (id == null) {
            return MEDIUM;
        }
        return switch (id.trim().toLowerCase(Locale.ROOT)) {
            case "major" -> MAJOR;
            case "minor" -> MINOR;
            default -> MEDIUM;
        };
    }
}

package dev.ebullient.sagakeeper.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered phases of an arc. Declaration order is narrative order.
 */
public enum ArcPhase {
    ARRIVAL,
    DISCOVERY,
    ESCALATION,
    CLIMAX,
    RESOLUTION,
    DEPARTURE;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ArcPhase fromId(String id) {
        if (id == null || id.isBlank()) {
            return ARRIVAL;
        }
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}

package dev.ebullient.sagakeeper.memory;

import java.util.Map;

/**
 * One nearest-neighbour match.
 *
 * @param distance cosine distance in [0, 2], smaller is closer; null if the index did not report one
 */
public record IndexHit(
        String id,
        String text,
        Map<String, String> metadata,
        Double distance) {

    public IndexHit {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** Metadata value, or empty string when absent */
    public String meta(String key) {
        return metadata.getOrDefault(key, "");
    }

    public int metaInt(String key) {
        String value = metadata.get(key);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}

package dev.ebullient.sagakeeper.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Immutable timeline entry. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorldEvent(
        String eventId,
        String chapterId,
        int chapterNumber,
        String description,
        String eventType,
        Impact impact,
        List<String> charactersInvolved,
        List<String> locationsInvolved,
        long timestamp) {

    public WorldEvent {
        description = Objects.requireNonNullElse(description, "");
        eventType = Objects.requireNonNullElse(eventType, "discovery");
        impact = Objects.requireNonNullElse(impact, Impact.MINOR);
        charactersInvolved = charactersInvolved == null ? List.of() : List.copyOf(charactersInvolved);
        locationsInvolved = locationsInvolved == null ? List.of() : List.copyOf(locationsInvolved);
    }
}

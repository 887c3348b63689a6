package dev.ebullient.sagakeeper.merge;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured facts extracted from one finished chapter.
 * Property names follow the JSON the extraction prompt asks for.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FactBatch(
        @JsonProperty("new_characters") List<NewCharacterFact> newCharacters,
        @JsonProperty("character_updates") List<CharacterUpdateFact> characterUpdates,
        @JsonProperty("location_updates") List<LocationUpdateFact> locationUpdates,
        @JsonProperty("thread_updates") List<ThreadActionFact> threadUpdates,
        @JsonProperty("relationships") List<RelationshipFact> relationships,
        @JsonProperty("major_events") List<TimelineEventFact> majorEvents) {

    public FactBatch {
        newCharacters = clean(newCharacters);
        characterUpdates = clean(characterUpdates);
        locationUpdates = clean(locationUpdates);
        threadUpdates = clean(threadUpdates);
        relationships = clean(relationships);
        majorEvents = clean(majorEvents);
    }

    public static FactBatch empty() {
        return new FactBatch(null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return newCharacters.isEmpty() && characterUpdates.isEmpty() && locationUpdates.isEmpty()
                && threadUpdates.isEmpty() && relationships.isEmpty() && majorEvents.isEmpty();
    }

    static <T> List<T> clean(List<T> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }
}

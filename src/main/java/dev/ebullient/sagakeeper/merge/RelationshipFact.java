package dev.ebullient.sagakeeper.merge;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RelationshipFact(
        @JsonProperty("character_a") String characterA,
        @JsonProperty("character_b") String characterB,
        @JsonProperty("type") String type,
        @JsonProperty("description") String description) {

    public RelationshipFact {
        characterA = Objects.requireNonNullElse(characterA, "");
        characterB = Objects.requireNonNullElse(characterB, "");
        type = type == null || type.isBlank() ? "neutral" : type;
        description = Objects.requireNonNullElse(description, "");
    }
}

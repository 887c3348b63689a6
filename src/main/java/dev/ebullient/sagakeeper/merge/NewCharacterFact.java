package dev.ebullient.sagakeeper.merge;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NewCharacterFact(
        @JsonProperty("name") String name,
        @JsonProperty("role") String role,
        @JsonProperty("personality") String personality,
        @JsonProperty("first_description") String firstDescription) {

    public NewCharacterFact {
        name = Objects.requireNonNullElse(name, "");
        role = Objects.requireNonNullElse(role, "");
        personality = Objects.requireNonNullElse(personality, "");
        firstDescription = Objects.requireNonNullElse(firstDescription, "");
    }
}

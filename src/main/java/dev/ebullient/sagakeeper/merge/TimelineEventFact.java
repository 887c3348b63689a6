package dev.ebullient.sagakeeper.merge;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TimelineEventFact(
        @JsonProperty("description") String description,
        @JsonProperty("type") String type,
        @JsonProperty("impact") String impact) {

    public TimelineEventFact {
        description = Objects.requireNonNullElse(description, "");
        type = type == null || type.isBlank() ? "discovery" : type;
    }
}

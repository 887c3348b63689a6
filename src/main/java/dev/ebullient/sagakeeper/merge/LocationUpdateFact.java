package dev.ebullient.sagakeeper.merge;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LocationUpdateFact(
        @JsonProperty("location_name") String locationName,
        @JsonProperty("change") String change,
        @JsonProperty("status") String status) {

    public LocationUpdateFact {
        locationName = Objects.requireNonNullElse(locationName, "");
        change = Objects.requireNonNullElse(change, "");
    }
}

package dev.ebullient.sagakeeper.merge;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Changes to an existing character, addressed by its exact current name.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CharacterUpdateFact(
        @JsonProperty("character_name") String characterName,
        @JsonProperty("updates") Changes updates) {

    public CharacterUpdateFact {
        characterName = Objects.requireNonNullElse(characterName, "");
        updates = updates == null ? new Changes(null, null, null, null) : updates;
    }

    /** Null status or location means "unchanged". */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Changes(
            @JsonProperty("status") String status,
            @JsonProperty("location") String location,
            @JsonProperty("items_gained") List<String> itemsGained,
            @JsonProperty("items_lost") List<String> itemsLost) {

        public Changes {
            itemsGained = FactBatch.clean(itemsGained);
            itemsLost = FactBatch.clean(itemsLost);
        }
    }
}

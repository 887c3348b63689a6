package dev.ebullient.sagakeeper.model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Character {
    public static final String ROLE_NEUTRAL = "neutral";
    public static final String STATUS_ACTIVE = "active";

    private String characterId;
    private String name;
    private String personality = "";
    private String role = ROLE_NEUTRAL;
    private String background = "";
    private String status = STATUS_ACTIVE;
    private String currentLocation;
    private Set<String> items = new LinkedHashSet<>();
    private Map<String, String> relationships = new LinkedHashMap<>();
    private String firstAppearance;
    private String lastAppearance;
    private String faction;
    private String notes = "";

    public Character() {
    }

    public Character(String characterId, String name) {
        this.characterId = characterId;
        this.name = name;
    }

    /** @return true if the item was not already held */
    public boolean gainItem(String item) {
        return items.add(item);
    }

    /** @return true if the item was held */
    public boolean loseItem(String item) {
        return items.remove(item);
    }

    public String getCharacterId() {
        return characterId;
    }

    public void setCharacterId(String characterId) {
        this.characterId = characterId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPersonality() {
        return personality;
    }

    public void setPersonality(String personality) {
        this.personality = personality;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public String getBackground() {
        return background;
    }

    public void setBackground(String background) {
        this.background = background;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getCurrentLocation() {
        return currentLocation;
    }

    public void setCurrentLocation(String currentLocation) {
        this.currentLocation = currentLocation;
    }

    public Set<String> getItems() {
        return items;
    }

    public void setItems(Set<String> items) {
        this.items = items == null ? new LinkedHashSet<>() : new LinkedHashSet<>(items);
    }

    public Map<String, String> getRelationships() {
        return relationships;
    }

    public void setRelationships(Map<String, String> relationships) {
        this.relationships = relationships == null ? new LinkedHashMap<>() : new LinkedHashMap<>(relationships);
    }

    public String getFirstAppearance() {
        return firstAppearance;
    }

    public void setFirstAppearance(String firstAppearance) {
        this.firstAppearance = firstAppearance;
    }

    public String getLastAppearance() {
        return lastAppearance;
    }

    public void setLastAppearance(String lastAppearance) {
        this.lastAppearance = lastAppearance;
    }

    public String getFaction() {
        return faction;
    }

    public void setFaction(String faction) {
        this.faction = faction;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}

package dev.ebullient.sagakeeper.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Relationship between an unordered pair of characters.
 * The pair is stored sorted so that (a, b) and (b, a) share one record.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Relationship {
    public static final int DEFAULT_STRENGTH = 50;

    private String characterA;
    private String characterB;
    private String relationshipType = "neutral";
    private int strength = DEFAULT_STRENGTH;
    private String establishedChapter;
    private String lastUpdated;
    private String notes = "";

    public Relationship() {
    }

    public Relationship(String firstId, String secondId, String relationshipType, String chapterId) {
        if (firstId.compareTo(secondId) <= 0) {
            this.characterA = firstId;
            this.characterB = secondId;
        } else {
            this.characterA = secondId;
            this.characterB = firstId;
        }
        this.relationshipType = relationshipType;
        this.establishedChapter = chapterId;
        this.lastUpdated = chapterId;
    }

    /** Stable composite key for an unordered pair of character IDs. */
    public static String key(String firstId, String secondId) {
        return firstId.compareTo(secondId) <= 0
                ? "rel_" + firstId + "_" + secondId
                : "rel_" + secondId + "_" + firstId;
    }

    public String key() {
        return key(characterA, characterB);
    }

    public String getCharacterA() {
        return characterA;
    }

    public void setCharacterA(String characterA) {
        this.characterA = characterA;
    }

    public String getCharacterB() {
        return characterB;
    }

    public void setCharacterB(String characterB) {
        this.characterB = characterB;
    }

    /** ally, friend, rival, enemy, mentor, family, romantic, neutral */
    public String getRelationshipType() {
        return relationshipType;
    }

    public void setRelationshipType(String relationshipType) {
        this.relationshipType = relationshipType;
    }

    public int getStrength() {
        return strength;
    }

    public void setStrength(int strength) {
        this.strength = Math.max(0, Math.min(100, strength));
    }

    public String getEstablishedChapter() {
        return establishedChapter;
    }

    public void setEstablishedChapter(String establishedChapter) {
        this.establishedChapter = establishedChapter;
    }

    public String getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(String lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}

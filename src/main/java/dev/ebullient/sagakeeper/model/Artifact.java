package dev.ebullient.sagakeeper.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Artifact {
    private String artifactId;
    private String name;
    private String description = "";
    private List<String> powers = new ArrayList<>();
    private String currentOwner;
    private String location;
    private String status = "unknown";
    private String firstMentioned;
    private String importance = "minor";
    private String notes = "";

    public String getArtifactId() {
        return artifactId;
    }

    public void setArtifactId(String artifactId) {
        this.artifactId = artifactId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getPowers() {
        return powers;
    }

    public void setPowers(List<String> powers) {
        this.powers = powers == null ? new ArrayList<>() : new ArrayList<>(powers);
    }

    /** Character ID of the owner, or null when unowned or lost. */
    public String getCurrentOwner() {
        return currentOwner;
    }

    public void setCurrentOwner(String currentOwner) {
        this.currentOwner = currentOwner;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    /** possessed, lost, destroyed, unknown, ... */
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getFirstMentioned() {
        return firstMentioned;
    }

    public void setFirstMentioned(String firstMentioned) {
        this.firstMentioned = firstMentioned;
    }

    public String getImportance() {
        return importance;
    }

    public void setImportance(String importance) {
        this.importance = importance;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}

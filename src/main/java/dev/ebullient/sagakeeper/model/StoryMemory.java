package dev.ebullient.sagakeeper.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Aggregate root for the whole story state. Owns every collection by value.
 * <p>
 * Mutation goes through the merge pipeline and the story session; everything
 * else should read through {@link StoryView}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoryMemory implements StoryView {
    private String storyTitle;
    private String worldName;
    private String sagaGoal = "";
    private List<String> sagaMilestones = new ArrayList<>();
    private long createdAt = System.currentTimeMillis();
    private long lastUpdated = createdAt;

    private int currentChapterNumber;
    private String currentArcId;

    private Map<String, Character> characters = new LinkedHashMap<>();
    private Map<String, WorldLocation> locations = new LinkedHashMap<>();
    private Map<String, Faction> factions = new LinkedHashMap<>();
    private Map<String, Artifact> artifacts = new LinkedHashMap<>();
    private Map<String, Arc> arcs = new LinkedHashMap<>();
    private Map<String, Chapter> chapters = new LinkedHashMap<>();
    private Map<String, PlotThread> plotThreads = new LinkedHashMap<>();
    private Map<String, Relationship> relationships = new LinkedHashMap<>();
    private List<WorldEvent> worldTimeline = new ArrayList<>();

    private Map<String, Integer> themeCounts = new LinkedHashMap<>();
    private List<String> arcTypeHistory = new ArrayList<>();

    public StoryMemory() {
    }

    public StoryMemory(String storyTitle, String worldName, String sagaGoal) {
        this.storyTitle = storyTitle;
        this.worldName = worldName;
        this.sagaGoal = sagaGoal == null ? "" : sagaGoal;
    }

    /**
     * Next free sequential ID for a collection, e.g. {@code char_004}.
     */
    public static String nextId(String prefix, Map<String, ?> collection) {
        int n = collection.size() + 1;
        String id = "%s_%03d".formatted(prefix, n);
        while (collection.containsKey(id)) {
            n++;
            id = "%s_%03d".formatted(prefix, n);
        }
        return id;
    }

    // --- StoryView ---

    @Override
    public String storyTitle() {
        return storyTitle;
    }

    @Override
    public String worldName() {
        return worldName;
    }

    @Override
    public String sagaGoal() {
        return sagaGoal;
    }

    @Override
    public int currentChapterNumber() {
        return currentChapterNumber;
    }

    @Override
    public String currentArcId() {
        return currentArcId;
    }

    @Override
    public Map<String, Character> characters() {
        return Collections.unmodifiableMap(characters);
    }

    @Override
    public Map<String, WorldLocation> locations() {
        return Collections.unmodifiableMap(locations);
    }

    @Override
    public Map<String, Arc> arcs() {
        return Collections.unmodifiableMap(arcs);
    }

    @Override
    public Map<String, Chapter> chapters() {
        return Collections.unmodifiableMap(chapters);
    }

    @Override
    public Map<String, PlotThread> plotThreads() {
        return Collections.unmodifiableMap(plotThreads);
    }

    @Override
    public Map<String, Relationship> relationships() {
        return Collections.unmodifiableMap(relationships);
    }

    @Override
    public List<WorldEvent> worldTimeline() {
        return Collections.unmodifiableList(worldTimeline);
    }

    @Override
    public Map<String, Integer> themeCounts() {
        return Collections.unmodifiableMap(themeCounts);
    }

    @Override
    public List<PlotThread> openThreads() {
        return plotThreads.values().stream()
                .filter(PlotThread::isActive)
                .toList();
    }

    @Override
    public List<PlotThread> majorOpenThreads() {
        return openThreads().stream()
                .filter(t -> t.getImportance() == Importance.MAJOR)
                .toList();
    }

    @Override
    public Optional<Arc> currentArc() {
        if (currentArcId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(arcs.get(currentArcId));
    }

    @Override
    public List<Chapter> recentChapters(int n) {
        if (n <= 0) {
            return List.of();
        }
        return chapters.values().stream()
                .sorted(Comparator.comparingInt(Chapter::chapterNumber).reversed())
                .limit(n)
                .toList();
    }

    // --- Bean accessors (persistence and merge) ---

    public String getStoryTitle() {
        return storyTitle;
    }

    public void setStoryTitle(String storyTitle) {
        this.storyTitle = storyTitle;
    }

    public String getWorldName() {
        return worldName;
    }

    public void setWorldName(String worldName) {
        this.worldName = worldName;
    }

    public String getSagaGoal() {
        return sagaGoal;
    }

    public void setSagaGoal(String sagaGoal) {
        this.sagaGoal = sagaGoal == null ? "" : sagaGoal;
    }

    public List<String> getSagaMilestones() {
        return sagaMilestones;
    }

    public void setSagaMilestones(List<String> sagaMilestones) {
        this.sagaMilestones = sagaMilestones == null ? new ArrayList<>() : new ArrayList<>(sagaMilestones);
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(long lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public int getCurrentChapterNumber() {
        return currentChapterNumber;
    }

    public void setCurrentChapterNumber(int currentChapterNumber) {
        this.currentChapterNumber = currentChapterNumber;
    }

    public String getCurrentArcId() {
        return currentArcId;
    }

    public void setCurrentArcId(String currentArcId) {
        this.currentArcId = currentArcId;
    }

    public Map<String, Character> getCharacters() {
        return characters;
    }

    public void setCharacters(Map<String, Character> characters) {
        this.characters = characters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(characters);
    }

    public Map<String, WorldLocation> getLocations() {
        return locations;
    }

    public void setLocations(Map<String, WorldLocation> locations) {
        this.locations = locations == null ? new LinkedHashMap<>() : new LinkedHashMap<>(locations);
    }

    public Map<String, Faction> getFactions() {
        return factions;
    }

    public void setFactions(Map<String, Faction> factions) {
        this.factions = factions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(factions);
    }

    public Map<String, Artifact> getArtifacts() {
        return artifacts;
    }

    public void setArtifacts(Map<String, Artifact> artifacts) {
        this.artifacts = artifacts == null ? new LinkedHashMap<>() : new LinkedHashMap<>(artifacts);
    }

    public Map<String, Arc> getArcs() {
        return arcs;
    }

    public void setArcs(Map<String, Arc> arcs) {
        this.arcs = arcs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(arcs);
    }

    public Map<String, Chapter> getChapters() {
        return chapters;
    }

    public void setChapters(Map<String, Chapter> chapters) {
        this.chapters = chapters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(chapters);
    }

    public Map<String, PlotThread> getPlotThreads() {
        return plotThreads;
    }

    public void setPlotThreads(Map<String, PlotThread> plotThreads) {
        this.plotThreads = plotThreads == null ? new LinkedHashMap<>() : new LinkedHashMap<>(plotThreads);
    }

    public Map<String, Relationship> getRelationships() {
        return relationships;
    }

    public void setRelationships(Map<String, Relationship> relationships) {
        this.relationships = relationships == null ? new LinkedHashMap<>() : new LinkedHashMap<>(relationships);
    }

    public List<WorldEvent> getWorldTimeline() {
        return worldTimeline;
    }

    public void setWorldTimeline(List<WorldEvent> worldTimeline) {
        this.worldTimeline = worldTimeline == null ? new ArrayList<>() : new ArrayList<>(worldTimeline);
    }

    public Map<String, Integer> getThemeCounts() {
        return themeCounts;
    }

    public void setThemeCounts(Map<String, Integer> themeCounts) {
        this.themeCounts = themeCounts == null ? new LinkedHashMap<>() : new LinkedHashMap<>(themeCounts);
    }

    public List<String> getArcTypeHistory() {
        return arcTypeHistory;
    }

    public void setArcTypeHistory(List<String> arcTypeHistory) {
        this.arcTypeHistory = arcTypeHistory == null ? new ArrayList<>() : new ArrayList<>(arcTypeHistory);
    }
}

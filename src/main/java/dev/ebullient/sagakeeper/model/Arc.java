package dev.ebullient.sagakeeper.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Arc {
    private String arcId;
    private int arcNumber;
    private String name;
    private String arcType = "";
    private String status = "planned";
    private String primaryLocation = "";
    private String summary = "";
    private String centralConflict = "";
    private List<String> themes = new ArrayList<>();
    private int expectedChapters = 10;
    private int currentChapter;
    private ArcPhase currentPhase = ArcPhase.ARRIVAL;
    private List<String> threadsIntroduced = new ArrayList<>();
    private List<String> threadsAdvanced = new ArrayList<>();
    private List<String> threadsResolved = new ArrayList<>();

    /** Record a thread ID against one of the arc's thread lists, once. */
    private static void track(List<String> threadIds, String threadId) {
        if (!threadIds.contains(threadId)) {
            threadIds.add(threadId);
        }
    }

    public void threadIntroduced(String threadId) {
        track(threadsIntroduced, threadId);
    }

    public void threadAdvanced(String threadId) {
        track(threadsAdvanced, threadId);
    }

    public void threadResolved(String threadId) {
        track(threadsResolved, threadId);
    }

    public String getArcId() {
        return arcId;
    }

    public void setArcId(String arcId) {
        this.arcId = arcId;
    }

    public int getArcNumber() {
        return arcNumber;
    }

    public void setArcNumber(int arcNumber) {
        this.arcNumber = arcNumber;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getArcType() {
        return arcType;
    }

    public void setArcType(String arcType) {
        this.arcType = arcType;
    }

    /** planned, active, completed */
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPrimaryLocation() {
        return primaryLocation;
    }

    public void setPrimaryLocation(String primaryLocation) {
        this.primaryLocation = primaryLocation;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public String getCentralConflict() {
        return centralConflict;
    }

    public void setCentralConflict(String centralConflict) {
        this.centralConflict = centralConflict;
    }

    public List<String> getThemes() {
        return themes;
    }

    public void setThemes(List<String> themes) {
        this.themes = themes == null ? new ArrayList<>() : new ArrayList<>(themes);
    }

    public int getExpectedChapters() {
        return expectedChapters;
    }

    public void setExpectedChapters(int expectedChapters) {
        this.expectedChapters = expectedChapters;
    }

    public int getCurrentChapter() {
        return currentChapter;
    }

    public void setCurrentChapter(int currentChapter) {
        this.currentChapter = currentChapter;
    }

    public ArcPhase getCurrentPhase() {
        return currentPhase;
    }

    public void setCurrentPhase(ArcPhase currentPhase) {
        this.currentPhase = currentPhase == null ? ArcPhase.ARRIVAL : currentPhase;
    }

    public List<String> getThreadsIntroduced() {
        return threadsIntroduced;
    }

    public void setThreadsIntroduced(List<String> threadsIntroduced) {
        this.threadsIntroduced = threadsIntroduced == null ? new ArrayList<>() : new ArrayList<>(threadsIntroduced);
    }

    public List<String> getThreadsAdvanced() {
        return threadsAdvanced;
    }

    public void setThreadsAdvanced(List<String> threadsAdvanced) {
        this.threadsAdvanced = threadsAdvanced == null ? new ArrayList<>() : new ArrayList<>(threadsAdvanced);
    }

    public List<String> getThreadsResolved() {
        return threadsResolved;
    }

    public void setThreadsResolved(List<String> threadsResolved) {
        this.threadsResolved = threadsResolved == null ? new ArrayList<>() : new ArrayList<>(threadsResolved);
    }
}

package dev.ebullient.sagakeeper.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PlotThread {
    private String threadId;
    private String name;
    private String threadType = "mystery";
    private String setupChapter;
    private String setupDescription = "";
    private ThreadStatus status = ThreadStatus.OPEN;
    private Importance importance = Importance.MEDIUM;
    private String expectedResolution = "medium_term";
    private List<ThreadDevelopment> developments = new ArrayList<>();
    private String resolutionChapter;
    private String resolutionDescription;
    private List<String> charactersInvolved = new ArrayList<>();
    private String notes = "";

    public PlotThread() {
    }

    public PlotThread(String threadId, String name, String setupChapter, String setupDescription) {
        this.threadId = threadId;
        this.name = name;
        this.setupChapter = setupChapter;
        this.setupDescription = setupDescription;
    }

    /**
     * Append a development unless the same chapter already recorded the same description.
     *
     * @return true if the development was appended
     */
    public boolean addDevelopment(ThreadDevelopment development) {
        if (developments.contains(development)) {
            return false;
        }
        developments.add(development);
        return true;
    }

    /**
     * Resolve this thread. The first resolution wins.
     *
     * @return false if the thread was already resolved
     */
    public boolean resolve(String chapterId, String description) {
        if (status == ThreadStatus.RESOLVED) {
            return false;
        }
        status = ThreadStatus.RESOLVED;
        resolutionChapter = chapterId;
        resolutionDescription = description;
        return true;
    }

    @JsonIgnore
    public boolean isActive() {
        return status.isActive();
    }

    public String getThreadId() {
        return threadId;
    }

    public void setThreadId(String threadId) {
        this.threadId = threadId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /** mystery, prophecy, promise, quest, danger, rivalry, romance, ... */
    public String getThreadType() {
        return threadType;
    }

    public void setThreadType(String threadType) {
        this.threadType = threadType;
    }

    public String getSetupChapter() {
        return setupChapter;
    }

    public void setSetupChapter(String setupChapter) {
        this.setupChapter = setupChapter;
    }

    public String getSetupDescription() {
        return setupDescription;
    }

    public void setSetupDescription(String setupDescription) {
        this.setupDescription = setupDescription;
    }

    public ThreadStatus getStatus() {
        return status;
    }

    public void setStatus(ThreadStatus status) {
        this.status = status == null ? ThreadStatus.OPEN : status;
    }

    public Importance getImportance() {
        return importance;
    }

    public void setImportance(Importance importance) {
        this.importance = importance == null ? Importance.MEDIUM : importance;
    }

    public String getExpectedResolution() {
        return expectedResolution;
    }

    public void setExpectedResolution(String expectedResolution) {
        this.expectedResolution = expectedResolution;
    }

    public List<ThreadDevelopment> getDevelopments() {
        return developments;
    }

    public void setDevelopments(List<ThreadDevelopment> developments) {
        this.developments = developments == null ? new ArrayList<>() : new ArrayList<>(developments);
    }

    public String getResolutionChapter() {
        return resolutionChapter;
    }

    public void setResolutionChapter(String resolutionChapter) {
        this.resolutionChapter = resolutionChapter;
    }

    public String getResolutionDescription() {
        return resolutionDescription;
    }

    public void setResolutionDescription(String resolutionDescription) {
        this.resolutionDescription = resolutionDescription;
    }

    public List<String> getCharactersInvolved() {
        return charactersInvolved;
    }

    public void setCharactersInvolved(List<String> charactersInvolved) {
        this.charactersInvolved = charactersInvolved == null ? new ArrayList<>() : new ArrayList<>(charactersInvolved);
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}

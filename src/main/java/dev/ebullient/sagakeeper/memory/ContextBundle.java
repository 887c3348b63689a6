package dev.ebullient.sagakeeper.memory;

import java.util.List;

/**
 * Everything the planner gets to see before writing the next chapter.
 * Each list is independently possibly empty.
 */
public record ContextBundle(
        List<RecentChapter> recentChapters,
        List<RelevantChapter> relevantChapters,
        List<RelevantEvent> relevantEvents,
        List<SurpriseCallback> surpriseCallbacks,
        List<ActiveThread> activeThreads) {

    public ContextBundle {
        recentChapters = recentChapters == null ? List.of() : List.copyOf(recentChapters);
        relevantChapters = relevantChapters == null ? List.of() : List.copyOf(relevantChapters);
        relevantEvents = relevantEvents == null ? List.of() : List.copyOf(relevantEvents);
        surpriseCallbacks = surpriseCallbacks == null ? List.of() : List.copyOf(surpriseCallbacks);
        activeThreads = activeThreads == null ? List.of() : List.copyOf(activeThreads);
    }

    public record RecentChapter(String chapterId, int chapterNumber, String title, String summary, String cliffhanger) {
    }

    public record RelevantChapter(String chapterId, int chapterNumber, String title, String summary, double relevance) {
    }

    public record RelevantEvent(String event, String chapterId, int chapterNumber, double relevance) {
    }

    public record SurpriseCallback(String chapterId, int chapterNumber, String title, String keyEvent, String note) {
    }

    public record ActiveThread(String threadId, String name, String type, String importance, String status) {
    }
}

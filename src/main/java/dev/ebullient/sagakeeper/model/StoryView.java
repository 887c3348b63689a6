package dev.ebullient.sagakeeper.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the story state. Collections are unmodifiable; derived
 * views are computed on every call.
 */
public interface StoryView {

    String storyTitle();

    String worldName();

    String sagaGoal();

    int currentChapterNumber();

    String currentArcId();

    Map<String, Character> characters();

    Map<String, WorldLocation> locations();

    Map<String, Arc> arcs();

    Map<String, Chapter> chapters();

    Map<String, PlotThread> plotThreads();

    Map<String, Relationship> relationships();

    List<WorldEvent> worldTimeline();

    Map<String, Integer> themeCounts();

    /** Threads that are open or progressing, in insertion order. */
    List<PlotThread> openThreads();

    List<PlotThread> majorOpenThreads();

    Optional<Arc> currentArc();

    /** The {@code n} chapters with the highest chapter number, newest first. */
    List<Chapter> recentChapters(int n);
}

package dev.ebullient.sagakeeper;

import java.util.List;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.sagakeeper.chat.FactExtractor;
import dev.ebullient.sagakeeper.memory.ContextBundle;
import dev.ebullient.sagakeeper.memory.SmartRetriever;
import dev.ebullient.sagakeeper.merge.FactBatch;
import dev.ebullient.sagakeeper.merge.MergeReport;
import dev.ebullient.sagakeeper.merge.StateMergePipeline;
import dev.ebullient.sagakeeper.model.Arc;
import dev.ebullient.sagakeeper.model.Chapter;
import dev.ebullient.sagakeeper.model.StoryMemory;
import dev.ebullient.sagakeeper.model.StoryView;
import dev.ebullient.sagakeeper.model.WorldLocation;
import dev.ebullient.sagakeeper.store.StoryStore;

/**
 * Owner of the one story being written. All mutation goes through here, one call at a time;
 * callers only ever get a read-only {@link StoryView} back.
 */
@Singleton
public class StorySession {
    private static final Logger log = Logger.getLogger(StorySession.class);

    @Inject
    StoryStore store;

    @Inject
    StateMergePipeline pipeline;

    @Inject
    FactExtractor extractor;

    @Inject
    SmartRetriever retriever;

    private StoryMemory memory;

    /** The current story, loaded from disk on first use. */
    public synchronized Optional<StoryView> current() {
        return loaded().map(m -> m);
    }

    public synchronized StoryView newStory(String storyTitle, String worldName, String sagaGoal) {
        StoryMemory created = store.initializeNewStory(storyTitle, worldName, sagaGoal);
        store.save(created, store.exists());
        memory = created;
        return memory;
    }

    public synchronized Optional<WorldLocation> addLocation(String name, String description) {
        return loaded().map(m -> {
            String id = StoryMemory.nextId("loc", m.getLocations());
            WorldLocation location = new WorldLocation(id, name, description);
            m.getLocations().put(id, location);
            store.save(m, false);
            log.infof("Added location '%s' as %s", name, id);
            return location;
        });
    }

    /**
     * Start a new arc and make it the current one. The previous arc, if any, is completed.
     */
    public synchronized Optional<Arc> startArc(String name, String arcType, String primaryLocation,
            String centralConflict, int expectedChapters) {
        return loaded().map(m -> {
            m.currentArc().ifPresent(previous -> previous.setStatus("completed"));
            String id = StoryMemory.nextId("arc", m.getArcs());
            Arc arc = new Arc();
            arc.setArcId(id);
            arc.setArcNumber(m.getArcs().size() + 1);
            arc.setName(name);
            arc.setArcType(arcType == null ? "" : arcType);
            arc.setPrimaryLocation(primaryLocation == null ? "" : primaryLocation);
            arc.setCentralConflict(centralConflict == null ? "" : centralConflict);
            if (expectedChapters > 0) {
                arc.setExpectedChapters(expectedChapters);
            }
            arc.setStatus("active");
            m.getArcs().put(id, arc);
            m.setCurrentArcId(id);
            if (!arc.getArcType().isBlank()) {
                m.getArcTypeHistory().add(arc.getArcType());
            }
            store.save(m, false);
            log.infof("Started arc '%s' as %s", name, id);
            return arc;
        });
    }

    /**
     * Merge a finished chapter. Facts are extracted from the content when the draft carries none.
     */
    public synchronized Optional<MergeReport> submitChapter(ChapterDraft draft) {
        Optional<StoryMemory> loaded = loaded();
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        StoryMemory m = loaded.get();
        int number = m.getCurrentChapterNumber() + 1;
        String chapterId = "ch_%03d".formatted(number);
        Chapter chapter = new Chapter(chapterId, number, m.getCurrentArcId(), draft.title(), draft.summary(),
                draft.keyEvents(), draft.charactersPresent(), draft.locations(), draft.cliffhanger(),
                draft.cliffhangerType(), draft.themes(), draft.tone(), draft.wordCount(), System.currentTimeMillis());

        if (!draft.content().isBlank()) {
            store.saveChapterText(chapterId, draft.content());
        }
        FactBatch facts = draft.facts();
        if (facts == null) {
            facts = draft.content().isBlank() ? FactBatch.empty() : extractor.extract(chapter, draft.content());
        }
        try {
            return Optional.of(pipeline.mergeChapter(m, chapter, facts));
        } catch (RuntimeException e) {
            // the merge changed the story in memory but it was not saved
            memory = null;
            log.warnf("Merging chapter %s failed; the story will be reloaded from disk", chapterId);
            throw e;
        }
    }

    public synchronized Optional<ContextBundle> planningContext(int nRecent, int nRelevant, int nSurprise) {
        return loaded().map(m -> retriever.retrieveForPlanning(m, m.getCurrentArcId(), nRecent, nRelevant, nSurprise));
    }

    /**
     * Index stored chapters and threads that are missing from the semantic index.
     *
     * @return the number of chapters indexed, or empty if there is no story
     */
    public synchronized Optional<Integer> catchUpIndex() {
        return loaded().map(m -> pipeline.catchUpIndex(m));
    }

    public Optional<String> createBackup() {
        return store.createBackup();
    }

    public List<String> listBackups() {
        return store.listBackups();
    }

    /**
     * Replace the current story with a backup, and save it as the current story.
     * The story being replaced is backed up first.
     */
    public synchronized Optional<StoryView> restore(String backupId) {
        Optional<StoryMemory> restored = store.restoreBackup(backupId);
        restored.ifPresent(m -> {
            store.save(m, true);
            memory = m;
            log.infof("Current story replaced by backup %s", backupId);
        });
        return restored.map(m -> m);
    }

    private Optional<StoryMemory> loaded() {
        if (memory == null) {
            memory = store.load().orElse(null);
            if (memory != null) {
                catchUpQuietly(memory);
            }
        }
        return Optional.ofNullable(memory);
    }

    private void catchUpQuietly(StoryMemory m) {
        try {
            pipeline.catchUpIndex(m);
        } catch (RuntimeException e) {
            log.warnf(e, "Could not bring the index up to date with '%s'", m.getStoryTitle());
        }
    }
}

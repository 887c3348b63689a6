package dev.ebullient.sagakeeper.merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.sagakeeper.memory.IndexCollection;
import dev.ebullient.sagakeeper.memory.StoryIndex;
import dev.ebullient.sagakeeper.model.Arc;
import dev.ebullient.sagakeeper.model.Chapter;
import dev.ebullient.sagakeeper.model.Character;
import dev.ebullient.sagakeeper.model.Impact;
import dev.ebullient.sagakeeper.model.Importance;
import dev.ebullient.sagakeeper.model.PlotThread;
import dev.ebullient.sagakeeper.model.Relationship;
import dev.ebullient.sagakeeper.model.StoryMemory;
import dev.ebullient.sagakeeper.model.StoryView;
import dev.ebullient.sagakeeper.model.ThreadDevelopment;
import dev.ebullient.sagakeeper.model.ThreadStatus;
import dev.ebullient.sagakeeper.model.WorldEvent;
import dev.ebullient.sagakeeper.model.WorldLocation;
import dev.ebullient.sagakeeper.store.StoryStore;

/**
 * Reconciles the facts extracted from a finished chapter with the story state.
 * <p>
 * Categories are applied in a fixed order (characters, character updates,
 * locations, threads, relationships, timeline, arc progress, themes) so that
 * later categories can refer to entities created earlier in the same batch.
 */
@Singleton
public class StateMergePipeline {
    private static final Logger log = Logger.getLogger(StateMergePipeline.class);

    @ConfigProperty(name = "sagakeeper.store.backup-on-save", defaultValue = "true")
    boolean backupOnSave;

    @Inject
    StoryStore store;

    @Inject
    StoryIndex index;

    /**
     * Apply, save, then index. The save is never undone by an indexing failure;
     * chapters left out of the index are picked up by the next merge or by {@link #catchUpIndex}.
     */
    public MergeReport mergeChapter(StoryMemory memory, Chapter chapter, FactBatch facts) {
        MergeReport report = apply(memory, chapter, facts);
        if (report.skipped()) {
            return report;
        }
        store.save(memory, backupOnSave);

        try {
            catchUpIndex(memory);
            return report.withIndexResult(index.contains(IndexCollection.CHAPTERS, chapter.chapterId()), null);
        } catch (RuntimeException e) {
            log.warnf(e, "Indexing chapter %s failed; story state was saved", chapter.chapterId());
            return report.withIndexResult(false, "Indexing failed: " + e.getMessage());
        }
    }

    /**
     * Index every stored chapter that is not in the index yet, oldest first,
     * followed by every plot thread that is not indexed.
     *
     * @return the number of chapters that were indexed
     */
    public int catchUpIndex(StoryView story) {
        if (!index.isAvailable()) {
            return 0;
        }
        List<Chapter> missing = story.chapters().values().stream()
                .filter(ch -> !index.contains(IndexCollection.CHAPTERS, ch.chapterId()))
                .sorted(Comparator.comparingInt(Chapter::chapterNumber))
                .toList();
        for (Chapter chapter : missing) {
            index.indexChapter(chapter);
        }
        for (PlotThread thread : story.plotThreads().values()) {
            if (!index.contains(IndexCollection.THREADS, thread.getThreadId())) {
                index.indexThread(thread);
            }
        }
        if (missing.size() > 1) {
            log.infof("Caught up %d chapters missing from the index", missing.size());
        }
        return missing.size();
    }

    /**
     * Apply a fact batch to the in-memory story. A chapter that is already in the
     * story is skipped as a whole, so replaying a batch changes nothing.
     */
    public MergeReport apply(StoryMemory memory, Chapter chapter, FactBatch facts) {
        if (memory.getChapters().containsKey(chapter.chapterId())) {
            log.warnf("Chapter %s was already merged; skipping", chapter.chapterId());
            return MergeReport.skipped(chapter.chapterId());
        }
        FactBatch batch = facts == null ? FactBatch.empty() : facts;
        log.infof("Merging chapter %d (%s)", chapter.chapterNumber(), chapter.chapterId());

        memory.getChapters().put(chapter.chapterId(), chapter);
        memory.setCurrentChapterNumber(chapter.chapterNumber());

        Merge merge = new Merge(memory, chapter);
        batch.newCharacters().forEach(merge::newCharacter);
        batch.characterUpdates().forEach(merge::updateCharacter);
        batch.locationUpdates().forEach(merge::updateLocation);
        batch.threadUpdates().forEach(merge::threadAction);
        batch.relationships().forEach(merge::relationship);
        batch.majorEvents().forEach(merge::timelineEvent);
        merge.arcProgress();
        merge.themes();

        return new MergeReport(chapter.chapterId(), false, merge.createdCharacters, merge.createdThreads,
                merge.warnings, false);
    }

    /** State for a single batch */
    static class Merge {
        final StoryMemory memory;
        final Chapter chapter;
        final Optional<Arc> arc;
        final List<String> createdCharacters = new ArrayList<>();
        final List<String> createdThreads = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        Merge(StoryMemory memory, Chapter chapter) {
            this.memory = memory;
            this.chapter = chapter;
            this.arc = memory.currentArc();
        }

        void warn(String message) {
            log.warn(message);
            warnings.add(message);
        }

        void newCharacter(NewCharacterFact fact) {
            if (fact.name().isBlank()) {
                warn("Ignoring new character without a name");
                return;
            }
            Optional<String> match = NameResolver.findMatch(fact.name(), characterNames());
            if (match.isPresent()) {
                Character existing = memory.getCharacters().get(match.get());
                log.debugf("'%s' matches existing character '%s'", fact.name(), existing.getName());
                if (isBlank(existing.getPersonality()) && !fact.personality().isBlank()) {
                    existing.setPersonality(fact.personality());
                }
                if (isBlank(existing.getBackground()) && !fact.firstDescription().isBlank()) {
                    existing.setBackground(fact.firstDescription());
                }
                if (Character.ROLE_NEUTRAL.equals(existing.getRole()) && !fact.role().isBlank()) {
                    existing.setRole(fact.role());
                }
                return;
            }

            String id = StoryMemory.nextId("char", memory.getCharacters());
            Character character = new Character(id, fact.name().trim());
            character.setPersonality(fact.personality());
            character.setRole(fact.role().isBlank() ? Character.ROLE_NEUTRAL : fact.role());
            character.setBackground(fact.firstDescription());
            character.setStatus(Character.STATUS_ACTIVE);
            character.setFirstAppearance(chapter.chapterId());
            character.setLastAppearance(chapter.chapterId());
            memory.getCharacters().put(id, character);
            createdCharacters.add(id);
            log.infof("Added character '%s' (%s) as %s", character.getName(), character.getRole(), id);
        }

        void updateCharacter(CharacterUpdateFact fact) {
            Optional<Character> found = characterByName(fact.characterName());
            if (found.isEmpty()) {
                warn("Character '%s' not found".formatted(fact.characterName()));
                return;
            }
            Character character = found.get();
            CharacterUpdateFact.Changes changes = fact.updates();
            if (!isBlank(changes.status())) {
                log.debugf("%s: status %s -> %s", character.getName(), character.getStatus(), changes.status());
                character.setStatus(changes.status());
            }
            if (!isBlank(changes.location())) {
                character.setCurrentLocation(changes.location());
            }
            for (String item : changes.itemsGained()) {
                if (character.gainItem(item)) {
                    log.debugf("%s gained '%s'", character.getName(), item);
                }
            }
            for (String item : changes.itemsLost()) {
                if (character.loseItem(item)) {
                    log.debugf("%s lost '%s'", character.getName(), item);
                }
            }
            character.setLastAppearance(chapter.chapterId());
        }

        void updateLocation(LocationUpdateFact fact) {
            Optional<WorldLocation> found = memory.getLocations().values().stream()
                    .filter(l -> l.getName().equals(fact.locationName()))
                    .findFirst();
            if (found.isEmpty()) {
                warn("New location mentioned: %s (%s)".formatted(fact.locationName(), fact.change()));
                return;
            }
            if (!isBlank(fact.status())) {
                found.get().setStatus(fact.status());
            }
            log.debugf("%s: %s", fact.locationName(), fact.change());
        }

        void threadAction(ThreadActionFact fact) {
            switch (fact.action()) {
                case ThreadActionFact.INTRODUCE -> introduceThread(fact);
                case ThreadActionFact.PROGRESS -> progressThread(fact);
                case ThreadActionFact.RESOLVE -> resolveThread(fact);
                default -> warn("Unknown thread action '%s' for '%s'".formatted(fact.action(), fact.threadName()));
            }
        }

        private void introduceThread(ThreadActionFact fact) {
            if (fact.threadName().isBlank()) {
                warn("Ignoring thread introduction without a name");
                return;
            }
            Map<String, String> names = new LinkedHashMap<>();
            memory.getPlotThreads().forEach((id, t) -> names.put(id, t.getName()));
            Optional<String> match = NameResolver.findMatch(fact.threadName(), names);
            if (match.isPresent()) {
                PlotThread existing = memory.getPlotThreads().get(match.get());
                log.debugf("Thread '%s' already exists as '%s'", fact.threadName(), existing.getName());
                if (isBlank(existing.getSetupDescription()) && !fact.description().isBlank()) {
                    existing.setSetupDescription(fact.description());
                }
                return;
            }

            String id = StoryMemory.nextId("thread", memory.getPlotThreads());
            PlotThread thread = new PlotThread(id, fact.threadName().trim(), chapter.chapterId(), fact.description());
            if (!isBlank(fact.threadType())) {
                thread.setThreadType(fact.threadType());
            }
            if (!isBlank(fact.importance())) {
                thread.setImportance(Importance.fromId(fact.importance()));
            }
            memory.getPlotThreads().put(id, thread);
            arc.ifPresent(a -> a.threadIntroduced(id));
            createdThreads.add(id);
            log.infof("New thread '%s' (%s)", thread.getName(), id);
        }

        private void progressThread(ThreadActionFact fact) {
            Optional<PlotThread> found = threadByName(fact.threadName());
            if (found.isEmpty()) {
                warn("Thread '%s' not found".formatted(fact.threadName()));
                return;
            }
            PlotThread thread = found.get();
            thread.addDevelopment(new ThreadDevelopment(chapter.chapterId(), fact.description()));
            if (thread.getStatus() != ThreadStatus.RESOLVED) {
                thread.setStatus(ThreadStatus.PROGRESSING);
            }
            arc.ifPresent(a -> a.threadAdvanced(thread.getThreadId()));
            log.debugf("Progressed thread '%s'", thread.getName());
        }

        private void resolveThread(ThreadActionFact fact) {
            Optional<PlotThread> found = threadByName(fact.threadName());
            if (found.isEmpty()) {
                warn("Thread '%s' not found".formatted(fact.threadName()));
                return;
            }
            PlotThread thread = found.get();
            if (!thread.resolve(chapter.chapterId(), fact.description())) {
                warn("Thread '%s' was already resolved in %s".formatted(thread.getName(), thread.getResolutionChapter()));
                return;
            }
            arc.ifPresent(a -> a.threadResolved(thread.getThreadId()));
            log.infof("Resolved thread '%s'", thread.getName());
        }

        void relationship(RelationshipFact fact) {
            Optional<Character> a = characterByName(fact.characterA());
            Optional<Character> b = characterByName(fact.characterB());
            if (a.isEmpty() || b.isEmpty()) {
                warn("Could not find characters for relationship %s <-> %s"
                        .formatted(fact.characterA(), fact.characterB()));
                return;
            }
            String aId = a.get().getCharacterId();
            String bId = b.get().getCharacterId();
            if (aId.equals(bId)) {
                warn("Ignoring relationship of '%s' with itself".formatted(fact.characterA()));
                return;
            }

            String key = Relationship.key(aId, bId);
            Relationship existing = memory.getRelationships().get(key);
            if (existing != null) {
                existing.setLastUpdated(chapter.chapterId());
                log.debugf("Updated relationship %s <-> %s", fact.characterA(), fact.characterB());
                return;
            }
            Relationship relationship = new Relationship(aId, bId, fact.type(), chapter.chapterId());
            relationship.setNotes(fact.description());
            memory.getRelationships().put(key, relationship);
            a.get().getRelationships().putIfAbsent(bId, fact.type());
            b.get().getRelationships().putIfAbsent(aId, fact.type());
            log.debugf("New relationship %s <-> %s (%s)", fact.characterA(), fact.characterB(), fact.type());
        }

        void timelineEvent(TimelineEventFact fact) {
            List<WorldEvent> timeline = memory.getWorldTimeline();
            boolean seen = timeline.stream()
                    .anyMatch(e -> e.chapterId().equals(chapter.chapterId()) && e.description().equals(fact.description()));
            if (seen) {
                return;
            }
            String id = chapter.chapterId() + "_" + timeline.size();
            timeline.add(new WorldEvent(id, chapter.chapterId(), chapter.chapterNumber(), fact.description(),
                    fact.type(), Impact.fromId(fact.impact()), List.of(), List.of(), System.currentTimeMillis()));
        }

        void arcProgress() {
            arc.ifPresent(a -> {
                a.setCurrentChapter(a.getCurrentChapter() + 1);
                log.debugf("Arc '%s' progress: %d/%d", a.getName(), a.getCurrentChapter(), a.getExpectedChapters());
            });
        }

        void themes() {
            for (String theme : chapter.themes()) {
                memory.getThemeCounts().merge(theme, 1, Integer::sum);
            }
        }

        private Map<String, String> characterNames() {
            Map<String, String> names = new LinkedHashMap<>();
            memory.getCharacters().forEach((id, c) -> names.put(id, c.getName()));
            return names;
        }

        private Optional<Character> characterByName(String name) {
            return memory.getCharacters().values().stream()
                    .filter(c -> c.getName().equals(name))
                    .findFirst();
        }

        private Optional<PlotThread> threadByName(String name) {
            return memory.getPlotThreads().values().stream()
                    .filter(t -> t.getName().equals(name))
                    .findFirst();
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}

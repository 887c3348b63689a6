package dev.ebullient.sagakeeper.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.ebullient.sagakeeper.HashingEmbeddingModel;
import dev.ebullient.sagakeeper.StoryFixtures;
import dev.ebullient.sagakeeper.memory.IndexStats;
import dev.ebullient.sagakeeper.memory.StoryIndex;
import dev.ebullient.sagakeeper.model.Arc;
import dev.ebullient.sagakeeper.model.Chapter;
import dev.ebullient.sagakeeper.model.Character;
import dev.ebullient.sagakeeper.model.Impact;
import dev.ebullient.sagakeeper.model.Importance;
import dev.ebullient.sagakeeper.model.PlotThread;
import dev.ebullient.sagakeeper.model.Relationship;
import dev.ebullient.sagakeeper.model.StoryMemory;
import dev.ebullient.sagakeeper.model.ThreadStatus;
import dev.ebullient.sagakeeper.model.WorldEvent;
import dev.ebullient.sagakeeper.model.WorldLocation;
import dev.ebullient.sagakeeper.store.StoryStore;

class StateMergePipelineTest {

    @TempDir
    Path tempDir;

    HashingEmbeddingModel embeddingModel;
    StoryStore store;
    StoryIndex index;
    StateMergePipeline pipeline;
    StoryMemory story;

    @BeforeEach
    void setUp() {
        embeddingModel = new HashingEmbeddingModel();
        store = StoryFixtures.store(tempDir);
        index = StoryFixtures.index(tempDir, embeddingModel);
        pipeline = new StateMergePipeline();
        StoryFixtures.inject(pipeline, "backupOnSave", true);
        StoryFixtures.inject(pipeline, "store", store);
        StoryFixtures.inject(pipeline, "index", index);
        story = StoryFixtures.story();
    }

    static Chapter chapter(int number) {
        return StoryFixtures.chapter(number, null, "Summary " + number, "Something happens in " + number);
    }

    static FactBatch facts() {
        return FactBatch.empty();
    }

    static FactBatch newCharacters(NewCharacterFact... facts) {
        return new FactBatch(List.of(facts), null, null, null, null, null);
    }

    static FactBatch characterUpdates(CharacterUpdateFact... facts) {
        return new FactBatch(null, List.of(facts), null, null, null, null);
    }

    static FactBatch threads(ThreadActionFact... facts) {
        return new FactBatch(null, null, null, List.of(facts), null, null);
    }

    static FactBatch relationships(RelationshipFact... facts) {
        return new FactBatch(null, null, null, null, List.of(facts), null);
    }

    Character addCharacter(String id, String name) {
        Character c = new Character(id, name);
        story.getCharacters().put(id, c);
        return c;
    }

    @Test
    void apply_recordsChapterAndCurrentNumber() {
        MergeReport report = pipeline.apply(story, chapter(1), null);

        assertFalse(report.skipped());
        assertTrue(story.chapters().containsKey("ch_001"));
        assertEquals(1, story.currentChapterNumber());
    }

    @Test
    void newCharacter_createdWithSequentialIds() {
        MergeReport report = pipeline.apply(story, chapter(1), newCharacters(
                new NewCharacterFact("Kael", "protagonist", "stubborn", "a deckhand"),
                new NewCharacterFact("Mira", null, null, null)));

        assertEquals(List.of("char_001", "char_002"), report.createdCharacters());
        Character kael = story.characters().get("char_001");
        assertEquals("Kael", kael.getName());
        assertEquals("protagonist", kael.getRole());
        assertEquals("a deckhand", kael.getBackground());
        assertEquals("active", kael.getStatus());
        assertEquals("ch_001", kael.getFirstAppearance());
        assertEquals(Character.ROLE_NEUTRAL, story.characters().get("char_002").getRole());
    }

    @Test
    void newCharacter_nameVariantsCollapseToOne() {
        Character informant = addCharacter("char_001", "The Mysterious Informant");

        MergeReport report = pipeline.apply(story, chapter(1), newCharacters(
                new NewCharacterFact("mysterious informant", "ally", "nervous", "hides in the cellar"),
                new NewCharacterFact("Unnamed Guard Leader", "antagonist", "", ""),
                new NewCharacterFact("Guard Leader", "ally", "gruff", "")));

        assertEquals(2, story.characters().size());
        assertEquals(List.of("char_002"), report.createdCharacters());
        assertEquals("nervous", informant.getPersonality());
        assertEquals("hides in the cellar", informant.getBackground());
        assertEquals("ally", informant.getRole());

        Character guard = story.characters().get("char_002");
        assertEquals("Unnamed Guard Leader", guard.getName());
        assertEquals("antagonist", guard.getRole(), "role is only filled in while neutral");
        assertEquals("gruff", guard.getPersonality());
    }

    @Test
    void newCharacter_neverOverwritesExistingFields() {
        Character kael = addCharacter("char_001", "Kael");
        kael.setPersonality("stubborn");
        kael.setRole("protagonist");

        pipeline.apply(story, chapter(1), newCharacters(new NewCharacterFact("KAEL", "villain", "cheerful", "")));

        assertEquals("stubborn", kael.getPersonality());
        assertEquals("protagonist", kael.getRole());
    }

    @Test
    void characterUpdate_itemsAreASet() {
        Character kael = addCharacter("char_001", "Kael");
        kael.gainItem("compass");

        MergeReport report = pipeline.apply(story, chapter(1), characterUpdates(
                new CharacterUpdateFact("Kael", new CharacterUpdateFact.Changes("injured", "The Harbor",
                        List.of("rope", "rope", "compass"), List.of("lantern"))),
                new CharacterUpdateFact("Nobody", new CharacterUpdateFact.Changes("dead", null, null, null))));

        assertEquals(List.of("compass", "rope"), List.copyOf(kael.getItems()));
        assertEquals("injured", kael.getStatus());
        assertEquals("The Harbor", kael.getCurrentLocation());
        assertEquals("ch_001", kael.getLastAppearance());
        assertEquals(List.of("Character 'Nobody' not found"), report.warnings());
    }

    @Test
    void characterUpdate_exactNameOnlyAndBlankFieldsUnchanged() {
        Character kael = addCharacter("char_001", "Kael");
        kael.setCurrentLocation("The Harbor");

        MergeReport report = pipeline.apply(story, chapter(1), characterUpdates(
                new CharacterUpdateFact("kael", new CharacterUpdateFact.Changes("dead", null, null, null)),
                new CharacterUpdateFact("Kael", new CharacterUpdateFact.Changes(null, "", null, List.of("compass")))));

        assertEquals("active", kael.getStatus());
        assertEquals("The Harbor", kael.getCurrentLocation());
        assertEquals(1, report.warnings().size());
    }

    @Test
    void locationUpdate_unknownIsNeverCreated() {
        WorldLocation harbor = new WorldLocation("loc_001", "The Harbor", "Salt and tar");
        story.getLocations().put(harbor.getLocationId(), harbor);

        MergeReport report = pipeline.apply(story, chapter(1), new FactBatch(null, null, List.of(
                new LocationUpdateFact("The Harbor", "burned", "destroyed"),
                new LocationUpdateFact("Glass Spire", "first seen", "active")), null, null, null));

        assertEquals("destroyed", harbor.getStatus());
        assertEquals(1, story.locations().size());
        assertEquals(List.of("New location mentioned: Glass Spire (first seen)"), report.warnings());
    }

    @Test
    void threadIntroduce_deduplicatesNameVariants() {
        Arc arc = new Arc();
        arc.setArcId("arc_001");
        story.getArcs().put("arc_001", arc);
        story.setCurrentArcId("arc_001");

        MergeReport report = pipeline.apply(story, chapter(1), threads(
                new ThreadActionFact("introduce", "Wind Walker Prophecy", "", "prophecy", "major"),
                ThreadActionFact.introduce("The Wind Walker prophecy", "An old verse"),
                ThreadActionFact.introduce("A mysterious map", "Found in a drawer")));

        assertEquals(List.of("thread_001", "thread_002"), report.createdThreads());
        PlotThread prophecy = story.plotThreads().get("thread_001");
        assertEquals("Wind Walker Prophecy", prophecy.getName());
        assertEquals("An old verse", prophecy.getSetupDescription());
        assertEquals("prophecy", prophecy.getThreadType());
        assertEquals(Importance.MAJOR, prophecy.getImportance());
        assertEquals(ThreadStatus.OPEN, prophecy.getStatus());
        assertEquals("ch_001", prophecy.getSetupChapter());

        PlotThread map = story.plotThreads().get("thread_002");
        assertEquals("mystery", map.getThreadType());
        assertEquals(Importance.MEDIUM, map.getImportance());
        assertEquals(List.of("thread_001", "thread_002"), arc.getThreadsIntroduced());
        assertEquals(1, arc.getCurrentChapter());
    }

    @Test
    void threadProgress_appendsDevelopmentOnce() {
        pipeline.apply(story, chapter(1), threads(ThreadActionFact.introduce("Lost Heir", "A rumour")));

        MergeReport report = pipeline.apply(story, chapter(2), threads(
                ThreadActionFact.progress("Lost Heir", "A letter is found"),
                ThreadActionFact.progress("Lost Heir", "A letter is found"),
                ThreadActionFact.progress("lost heir", "Ignored")));

        PlotThread thread = story.plotThreads().get("thread_001");
        assertEquals(ThreadStatus.PROGRESSING, thread.getStatus());
        assertEquals(1, thread.getDevelopments().size());
        assertEquals("ch_002", thread.getDevelopments().get(0).chapterId());
        assertEquals(List.of("Thread 'lost heir' not found"), report.warnings());
    }

    @Test
    void threadResolve_firstResolutionWins() {
        pipeline.apply(story, chapter(1), threads(ThreadActionFact.introduce("Lost Heir", "A rumour")));
        pipeline.apply(story, chapter(2), threads(ThreadActionFact.resolve("Lost Heir", "The heir is crowned")));

        MergeReport report = pipeline.apply(story, chapter(3), threads(
                ThreadActionFact.resolve("Lost Heir", "The heir abdicates"),
                ThreadActionFact.progress("Lost Heir", "Songs are written")));

        PlotThread thread = story.plotThreads().get("thread_001");
        assertEquals(ThreadStatus.RESOLVED, thread.getStatus());
        assertEquals("ch_002", thread.getResolutionChapter());
        assertEquals("The heir is crowned", thread.getResolutionDescription());
        assertEquals(1, thread.getDevelopments().size());
        assertEquals(1, report.warnings().size());
        assertTrue(story.openThreads().isEmpty());
    }

    @Test
    void threadAction_unknownActionIsAWarning() {
        MergeReport report = pipeline.apply(story, chapter(1), threads(
                new ThreadActionFact("abandon", "Lost Heir", "", null, null)));

        assertTrue(story.plotThreads().isEmpty());
        assertEquals(List.of("Unknown thread action 'abandon' for 'Lost Heir'"), report.warnings());
    }

    @Test
    void relationship_unorderedPairIsOneRecord() {
        Character kael = addCharacter("char_001", "Kael");
        Character mira = addCharacter("char_002", "Mira");

        pipeline.apply(story, chapter(1), relationships(new RelationshipFact("Mira", "Kael", "rival", "a bet")));
        pipeline.apply(story, chapter(2), relationships(new RelationshipFact("Kael", "Mira", "friend", "")));

        assertEquals(1, story.relationships().size());
        Relationship rel = story.relationships().get("rel_char_001_char_002");
        assertEquals("char_001", rel.getCharacterA());
        assertEquals("char_002", rel.getCharacterB());
        assertEquals("rival", rel.getRelationshipType());
        assertEquals(Relationship.DEFAULT_STRENGTH, rel.getStrength());
        assertEquals("ch_001", rel.getEstablishedChapter());
        assertEquals("ch_002", rel.getLastUpdated());
        assertEquals("a bet", rel.getNotes());
        assertEquals("rival", kael.getRelationships().get("char_002"));
        assertEquals("rival", mira.getRelationships().get("char_001"));
    }

    @Test
    void relationship_unknownOrSelfIsSkipped() {
        addCharacter("char_001", "Kael");

        MergeReport report = pipeline.apply(story, chapter(1), relationships(
                new RelationshipFact("Kael", "Ghost", "enemy", ""),
                new RelationshipFact("Kael", "Kael", "ally", "")));

        assertTrue(story.relationships().isEmpty());
        assertEquals(2, report.warnings().size());
    }

    @Test
    void timelineEvent_appendedOncePerChapter() {
        pipeline.apply(story, chapter(1), new FactBatch(null, null, null, null, null, List.of(
                new TimelineEventFact("The bridge falls", "battle", "major"),
                new TimelineEventFact("The bridge falls", "battle", "major"),
                new TimelineEventFact("A bell rings", null, "loud"))));

        List<WorldEvent> timeline = story.worldTimeline();
        assertEquals(2, timeline.size());
        assertEquals("ch_001_0", timeline.get(0).eventId());
        assertEquals(Impact.MAJOR, timeline.get(0).impact());
        assertEquals("ch_001_1", timeline.get(1).eventId());
        assertEquals("discovery", timeline.get(1).eventType());
        assertEquals(Impact.MINOR, timeline.get(1).impact());
    }

    @Test
    void themes_tallied() {
        Chapter first = new Chapter("ch_001", 1, null, "One", "", List.of(), List.of(), List.of(), "", "",
                List.of("loss", "hope"), null, 0, 0);
        Chapter second = new Chapter("ch_002", 2, null, "Two", "", List.of(), List.of(), List.of(), "", "",
                List.of("hope"), null, 0, 0);

        pipeline.apply(story, first, facts());
        pipeline.apply(story, second, facts());

        assertEquals(1, story.themeCounts().get("loss"));
        assertEquals(2, story.themeCounts().get("hope"));
    }

    @Test
    void replay_isSkipped() {
        FactBatch batch = newCharacters(new NewCharacterFact("Kael", "protagonist", "", ""));
        pipeline.apply(story, chapter(1), batch);

        MergeReport report = pipeline.apply(story, chapter(1), batch);

        assertTrue(report.skipped());
        assertEquals(1, story.characters().size());
    }

    @Test
    void mergeChapter_savesThenIndexes() {
        MergeReport report = pipeline.mergeChapter(story, chapter(1),
                threads(ThreadActionFact.introduce("Lost Heir", "A rumour")));

        assertTrue(report.indexed());
        assertEquals(new IndexStats(1, 1, 1), index.stats());
        StoryMemory saved = store.load().orElseThrow();
        assertTrue(saved.chapters().containsKey("ch_001"));
        assertEquals("Lost Heir", saved.plotThreads().get("thread_001").getName());
    }

    @Test
    void mergeChapter_indexFailureKeepsSave() {
        embeddingModel.failure = new IllegalStateException("embedding service down");

        MergeReport report = pipeline.mergeChapter(story, chapter(1), facts());

        assertFalse(report.indexed());
        assertTrue(report.warnings().get(0).contains("embedding service down"));
        assertTrue(store.load().orElseThrow().chapters().containsKey("ch_001"));
    }

    @Test
    void mergeChapter_nextMergeIndexesEarlierChapter() {
        embeddingModel.failure = new IllegalStateException("embedding service down");
        pipeline.mergeChapter(story, chapter(1), threads(ThreadActionFact.introduce("Lost Heir", "A rumour")));
        assertEquals(new IndexStats(0, 0, 0), index.stats());

        embeddingModel.failure = null;
        MergeReport report = pipeline.mergeChapter(story, chapter(2), facts());

        assertTrue(report.indexed());
        assertEquals(new IndexStats(2, 2, 1), index.stats());
    }

    @Test
    void catchUpIndex_indexesOnlyWhatIsMissing() {
        embeddingModel.failure = new IllegalStateException("embedding service down");
        pipeline.mergeChapter(story, chapter(1), threads(ThreadActionFact.introduce("Lost Heir", "A rumour")));
        pipeline.mergeChapter(story, chapter(2), facts());
        embeddingModel.failure = null;

        assertEquals(2, pipeline.catchUpIndex(story));
        assertEquals(new IndexStats(2, 2, 1), index.stats());
        assertEquals("ch_001", index.searchChapters("Summary 1", 1, null).get(0).id());

        int calls = embeddingModel.calls.get();
        assertEquals(0, pipeline.catchUpIndex(story));
        assertEquals(calls, embeddingModel.calls.get());
    }

    @Test
    void mergeChapter_replayDoesNotSaveAgain() {
        pipeline.mergeChapter(story, chapter(1), facts());
        pipeline.mergeChapter(story, chapter(2), facts());
        int backups = store.listBackups().size();

        MergeReport report = pipeline.mergeChapter(story, chapter(2), facts());

        assertTrue(report.skipped());
        assertEquals(backups, store.listBackups().size());
    }
}

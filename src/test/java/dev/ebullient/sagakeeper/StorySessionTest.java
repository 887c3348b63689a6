package dev.ebullient.sagakeeper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.ebullient.sagakeeper.memory.ContextBundle;
import dev.ebullient.sagakeeper.memory.IndexStats;
import dev.ebullient.sagakeeper.memory.SmartRetriever;
import dev.ebullient.sagakeeper.memory.StoryIndex;
import dev.ebullient.sagakeeper.merge.FactBatch;
import dev.ebullient.sagakeeper.merge.MergeReport;
import dev.ebullient.sagakeeper.merge.NewCharacterFact;
import dev.ebullient.sagakeeper.model.Arc;
import dev.ebullient.sagakeeper.model.StoryView;
import dev.ebullient.sagakeeper.store.StoryStore;

class StorySessionTest {

    @TempDir
    Path tempDir;

    ScriptedChatModel chatModel;
    HashingEmbeddingModel embeddingModel;
    StoryStore store;
    StoryIndex index;
    SmartRetriever retriever;
    StorySession session;

    @BeforeEach
    void setUp() {
        chatModel = new ScriptedChatModel();
        store = StoryFixtures.store(tempDir);
        embeddingModel = new HashingEmbeddingModel();
        index = StoryFixtures.index(tempDir, embeddingModel);
        retriever = StoryFixtures.retriever(index, 1L);
        session = session();
    }

    @AfterEach
    void tearDown() {
        StoryFixtures.invoke(retriever, "shutdown");
    }

    StorySession session() {
        return StoryFixtures.session(store, index, retriever, chatModel);
    }

    static ChapterDraft draft(String title, String content, FactBatch facts) {
        return new ChapterDraft(title, "Summary of " + title, List.of(title + " begins"), List.of(), List.of(),
                "", "", List.of("journey"), null, content, facts);
    }

    @Test
    void noStory_everythingIsEmpty() {
        assertTrue(session.current().isEmpty());
        assertTrue(session.addLocation("Harbor", "").isEmpty());
        assertTrue(session.startArc("Arrival", "", "", "", 0).isEmpty());
        assertTrue(session.submitChapter(draft("One", "", FactBatch.empty())).isEmpty());
        assertTrue(session.planningContext(3, 5, 2).isEmpty());
        assertTrue(session.createBackup().isEmpty());
        assertTrue(session.catchUpIndex().isEmpty());
    }

    @Test
    void newStory_isSavedAndReloaded() {
        session.newStory("The Long Road", "Aethermoor", "Find the last sky-ship");

        StoryView reloaded = session().current().orElseThrow();
        assertEquals("The Long Road", reloaded.storyTitle());
        assertEquals("Aethermoor", reloaded.worldName());
    }

    @Test
    void locationsAndArcs() {
        session.newStory("The Long Road", "Aethermoor", "");
        assertEquals("loc_001", session.addLocation("Harbor", "Salt and tar").orElseThrow().getLocationId());
        assertEquals("loc_002", session.addLocation("Glass Spire", "").orElseThrow().getLocationId());

        Arc first = session.startArc("Arrival", "journey", "loc_001", "Who sank the ferry?", 6).orElseThrow();
        Arc second = session.startArc("The Spire", "mystery", "loc_002", "", 0).orElseThrow();

        StoryView story = session.current().orElseThrow();
        assertEquals("arc_002", story.currentArcId());
        assertEquals("completed", first.getStatus());
        assertEquals("active", second.getStatus());
        assertEquals(6, first.getExpectedChapters());
        assertEquals(10, second.getExpectedChapters());
        assertEquals(List.of("journey", "mystery"), store.load().orElseThrow().getArcTypeHistory());
    }

    @Test
    void submitChapter_numbersChaptersAndStoresText() {
        session.newStory("The Long Road", "Aethermoor", "");
        session.startArc("Arrival", "journey", "", "", 0);

        MergeReport first = session.submitChapter(draft("One", "The ship leaves.",
                new FactBatch(List.of(new NewCharacterFact("Kael", "protagonist", "", "")), null, null, null, null,
                        null)))
                .orElseThrow();
        MergeReport second = session.submitChapter(draft("Two", "", FactBatch.empty())).orElseThrow();

        assertEquals("ch_001", first.chapterId());
        assertEquals(List.of("char_001"), first.createdCharacters());
        assertEquals("ch_002", second.chapterId());
        assertTrue(chatModel.requests.isEmpty());

        StoryView story = session.current().orElseThrow();
        assertEquals(2, story.currentChapterNumber());
        assertEquals("arc_001", story.chapters().get("ch_001").arcId());
        assertEquals(3, story.chapters().get("ch_001").wordCount());
        assertEquals(2, story.arcs().get("arc_001").getCurrentChapter());
        assertEquals(Optional.of("The ship leaves."), store.loadChapterText("ch_001"));
        assertTrue(store.loadChapterText("ch_002").isEmpty());
    }

    @Test
    void submitChapter_failedSaveLeavesNoChapterBehind() throws IOException {
        session.newStory("The Long Road", "Aethermoor", "");
        Path blocker = Files.createDirectories(tempDir.resolve("story_memory.json.tmp").resolve("x"));

        assertThrows(UncheckedIOException.class,
                () -> session.submitChapter(draft("One", "", FactBatch.empty())));
        assertTrue(session.current().orElseThrow().chapters().isEmpty());
        assertEquals(0, session.current().orElseThrow().currentChapterNumber());

        Files.delete(blocker);
        Files.delete(blocker.getParent());
        assertEquals("ch_001", session.submitChapter(draft("One", "", FactBatch.empty())).orElseThrow().chapterId());
        assertEquals(1, store.load().orElseThrow().chapters().size());
    }

    @Test
    void chaptersMissingFromIndexAreCaughtUp() {
        session.newStory("The Long Road", "Aethermoor", "");
        embeddingModel.failure = new IllegalStateException("embedding service down");
        MergeReport report = session.submitChapter(draft("One", "", FactBatch.empty())).orElseThrow();
        assertFalse(report.indexed());
        assertEquals(new IndexStats(0, 0, 0), index.stats());

        embeddingModel.failure = null;
        assertEquals(Optional.of(1), session.catchUpIndex());
        assertEquals(new IndexStats(1, 1, 0), index.stats());
        assertEquals(Optional.of(0), session.catchUpIndex());
    }

    @Test
    void loadingStoryCatchesUpIndex() {
        session.newStory("The Long Road", "Aethermoor", "");
        embeddingModel.failure = new IllegalStateException("embedding service down");
        session.submitChapter(draft("One", "", FactBatch.empty()));
        session.submitChapter(draft("Two", "", FactBatch.empty()));
        embeddingModel.failure = null;

        StoryIndex reopened = StoryFixtures.index(tempDir, embeddingModel);
        SmartRetriever other = StoryFixtures.retriever(reopened, 1L);
        try {
            StoryFixtures.session(store, reopened, other, chatModel).current();

            assertEquals(new IndexStats(2, 2, 0), reopened.stats());
        } finally {
            StoryFixtures.invoke(other, "shutdown");
        }
    }

    @Test
    void submitChapter_extractsFactsWhenMissing() {
        session.newStory("The Long Road", "Aethermoor", "");
        chatModel.reply("""
                {"new_characters": [{"name": "Mira", "role": "ally"}]}
                """);

        MergeReport report = session.submitChapter(draft("One", "Mira boards the ship.", null)).orElseThrow();

        assertEquals(1, chatModel.requests.size());
        assertEquals(List.of("char_001"), report.createdCharacters());
        assertEquals("Mira", session.current().orElseThrow().characters().get("char_001").getName());
    }

    @Test
    void planningContext_usesCurrentStory() {
        session.newStory("The Long Road", "Aethermoor", "");
        for (int i = 1; i <= 5; i++) {
            session.submitChapter(draft("Part " + i, "", FactBatch.empty()));
        }

        ContextBundle bundle = session.planningContext(3, 5, 0).orElseThrow();

        assertEquals(List.of("ch_005", "ch_004", "ch_003"),
                bundle.recentChapters().stream().map(ContextBundle.RecentChapter::chapterId).toList());
        assertFalse(bundle.relevantChapters().isEmpty());
    }

    @Test
    void restore_replacesCurrentStory() {
        session.newStory("The Long Road", "Aethermoor", "");
        String backupId = session.createBackup().orElseThrow();
        session.addLocation("Harbor", "");

        StoryView restored = session.restore(backupId).orElseThrow();

        assertTrue(restored.locations().isEmpty());
        assertTrue(session.current().orElseThrow().locations().isEmpty());
        assertTrue(store.load().orElseThrow().locations().isEmpty());
        assertTrue(session.restore("missing.json").isEmpty());
    }
}

package dev.ebullient.sagakeeper.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.sagakeeper.memory.ContextBundle.ActiveThread;
import dev.ebullient.sagakeeper.memory.ContextBundle.RecentChapter;
import dev.ebullient.sagakeeper.memory.ContextBundle.RelevantChapter;
import dev.ebullient.sagakeeper.memory.ContextBundle.RelevantEvent;
import dev.ebullient.sagakeeper.memory.ContextBundle.SurpriseCallback;
import dev.ebullient.sagakeeper.model.Chapter;
import dev.ebullient.sagakeeper.model.PlotThread;
import dev.ebullient.sagakeeper.model.StoryView;

/**
 * Assembles planning context from the story state and the semantic index:
 * recent chapters, semantically related chapters and events, a few random
 * callbacks to old chapters, and the most important open threads.
 */
@Singleton
public class SmartRetriever {
    private static final Logger log = Logger.getLogger(SmartRetriever.class);

    public static final int DEFAULT_RECENT = 3;
    public static final int DEFAULT_RELEVANT = 5;
    public static final int DEFAULT_SURPRISE = 2;

    static final int SURPRISE_GAP = 5;
    static final int MAX_ACTIVE_THREADS = 5;
    static final String CALLBACK_NOTE = "Consider subtle callback";

    public record ThreadHistoryEntry(String chapterId, String description, Chapter chapter) {
    }

    @ConfigProperty(name = "sagakeeper.retrieve.timeout-ms", defaultValue = "5000")
    long timeoutMillis;

    @ConfigProperty(name = "sagakeeper.retrieve.surprise-seed")
    Optional<Long> surpriseSeed;

    @Inject
    StoryIndex index;

    Random random;

    private ExecutorService executor;

    @PostConstruct
    void init() {
        if (random == null) {
            random = surpriseSeed == null || surpriseSeed.isEmpty()
                    ? new Random()
                    : new Random(surpriseSeed.get());
        }
        AtomicInteger count = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "story-retriever-" + count.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        this.executor = Executors.newFixedThreadPool(2, factory);
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public ContextBundle retrieveForPlanning(StoryView story, String currentArcId) {
        return retrieveForPlanning(story, currentArcId, DEFAULT_RECENT, DEFAULT_RELEVANT, DEFAULT_SURPRISE);
    }

    public ContextBundle retrieveForPlanning(StoryView story, String currentArcId,
            int nRecent, int nRelevant, int nSurprise) {
        List<Chapter> recent = story.recentChapters(nRecent);
        List<RecentChapter> recentChapters = recent.stream()
                .map(ch -> new RecentChapter(ch.chapterId(), ch.chapterNumber(), ch.title(), ch.summary(),
                        ch.cliffhanger()))
                .toList();

        List<RelevantChapter> relevantChapters = List.of();
        List<RelevantEvent> relevantEvents = List.of();
        if (story.chapters().size() > nRecent && nRelevant > 0) {
            String query = planningQuery(story, recent);
            Set<String> recentIds = recent.stream().map(Chapter::chapterId).collect(Collectors.toSet());

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
            Future<List<RelevantChapter>> chapters = submit(() -> relevantChapters(query, nRelevant, currentArcId, recentIds));
            Future<List<RelevantEvent>> events = submit(() -> relevantEvents(query, nRelevant));

            relevantChapters = await("relevant chapters", chapters, deadline);
            relevantEvents = await("relevant events", events, deadline);
        }

        List<SurpriseCallback> callbacks = surpriseCallbacks(story, nRecent, nSurprise);
        List<ActiveThread> threads = activeThreads(story);

        log.debugf("Retrieved context: %d recent, %d relevant chapters, %d relevant events, %d callbacks, %d threads",
                recentChapters.size(), relevantChapters.size(), relevantEvents.size(),
                callbacks.size(), threads.size());
        return new ContextBundle(recentChapters, relevantChapters, relevantEvents, callbacks, threads);
    }

    /** Past events that mention or involve a character. */
    public List<IndexHit> searchCharacterHistory(String characterName, int n) {
        return degrade("character history", () -> index.searchEvents(
                characterName + " character development moment action", n));
    }

    public List<IndexHit> findSimilarSituations(String situation, int n) {
        return degrade("similar situations", () -> index.searchEvents(situation, n));
    }

    /**
     * Developments of the thread with exactly this name, in the order they were recorded.
     * Each entry carries the chapter it happened in, when that chapter is known.
     */
    public List<ThreadHistoryEntry> threadHistory(String threadName, StoryView story) {
        Optional<PlotThread> thread = story.plotThreads().values().stream()
                .filter(t -> t.getName().equals(threadName))
                .findFirst();
        if (thread.isEmpty()) {
            return List.of();
        }
        return thread.get().getDevelopments().stream()
                .map(d -> new ThreadHistoryEntry(d.chapterId(), d.description(), story.chapters().get(d.chapterId())))
                .toList();
    }

    static String planningQuery(StoryView story, List<Chapter> recent) {
        if (recent.isEmpty()) {
            return story.sagaGoal() + " " + story.worldName();
        }
        Chapter newest = recent.get(0);
        List<String> events = newest.keyEvents().subList(0, Math.min(3, newest.keyEvents().size()));
        return newest.summary() + " " + String.join(" ", events);
    }

    /** 1 - distance, clamped to [0, 1]; an unknown or zero distance counts as a perfect match. */
    static double relevance(Double distance) {
        if (distance == null || distance == 0) {
            return 1.0;
        }
        if (distance > 1) {
            return 0;
        }
        return 1 - distance;
    }

    private List<RelevantChapter> relevantChapters(String query, int n, String arcId, Set<String> exclude) {
        return index.searchChapters(query, n, arcId).stream()
                .filter(hit -> !exclude.contains(hit.id()))
                .map(hit -> new RelevantChapter(hit.id(), hit.metaInt("chapterNumber"), hit.meta("title"),
                        hit.text(), relevance(hit.distance())))
                .toList();
    }

    private List<RelevantEvent> relevantEvents(String query, int n) {
        return index.searchEvents(query, n * 2).stream()
                .limit(n)
                .map(hit -> new RelevantEvent(hit.text(), hit.meta("chapterId"), hit.metaInt("chapterNumber"),
                        relevance(hit.distance())))
                .toList();
    }

    List<SurpriseCallback> surpriseCallbacks(StoryView story, int nRecent, int nSurprise) {
        if (nSurprise <= 0) {
            return List.of();
        }
        int cutoff = story.currentChapterNumber() - nRecent - SURPRISE_GAP;
        List<Chapter> old = story.chapters().values().stream()
                .filter(ch -> ch.chapterNumber() < cutoff)
                .sorted(Comparator.comparingInt(Chapter::chapterNumber))
                .collect(Collectors.toCollection(ArrayList::new));
        if (old.isEmpty()) {
            return List.of();
        }
        Collections.shuffle(old, random);
        return old.subList(0, Math.min(nSurprise, old.size())).stream()
                .map(ch -> new SurpriseCallback(ch.chapterId(), ch.chapterNumber(), ch.title(),
                        ch.keyEvents().isEmpty() ? "" : ch.keyEvents().get(random.nextInt(ch.keyEvents().size())),
                        CALLBACK_NOTE))
                .toList();
    }

    static List<ActiveThread> activeThreads(StoryView story) {
        return story.openThreads().stream()
                .sorted(Comparator.comparingInt((PlotThread t) -> t.getImportance().weight()).reversed())
                .limit(MAX_ACTIVE_THREADS)
                .map(t -> new ActiveThread(t.getThreadId(), t.getName(), t.getThreadType(),
                        t.getImportance().id(), t.getStatus().id()))
                .toList();
    }

    private <T> Future<List<T>> submit(Callable<List<T>> task) {
        if (!index.isAvailable()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return executor.submit(task);
    }

    /**
     * Wait for a strategy until the shared deadline. A strategy that is still running
     * then is cancelled, so it does not hold a worker past its own call.
     */
    private <T> List<T> await(String strategy, Future<List<T>> future, long deadline) {
        try {
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warnf("Retrieval of %s timed out after %d ms; continuing without it", strategy, timeoutMillis);
        } catch (ExecutionException e) {
            log.warnf(e.getCause(), "Retrieval of %s failed; continuing without it", strategy);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warnf("Retrieval of %s interrupted; continuing without it", strategy);
        }
        return List.of();
    }

    private <T> List<T> degrade(String strategy, Supplier<List<T>> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            log.warnf(e, "Search for %s failed", strategy);
            return List.of();
        }
    }
}

package dev.ebullient.sagakeeper.memory;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.sagakeeper.model.Chapter;
import dev.ebullient.sagakeeper.model.PlotThread;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;

/**
 * Append-only semantic index over chapter, event and thread fragments.
 * <p>
 * Each collection is searched through an in-memory embedding store and written
 * to {@code vectors/<collection>.json} as a list of fragments (id, text,
 * metadata, vector). A fragment becomes visible only after the file that holds
 * it has been written, so a failed write leaves nothing half-indexed.
 */
@Singleton
public class StoryIndex {
    private static final Logger log = Logger.getLogger(StoryIndex.class);

    private static final TypeReference<List<Fragment>> FRAGMENTS = new TypeReference<>() {
    };

    /** One indexed text with its embedding, as written to disk. */
    record Fragment(String id, String text, Map<String, Object> metadata, float[] vector) {

        static Fragment of(String id, TextSegment segment, Embedding embedding) {
            return new Fragment(id, segment.text(), segment.metadata().toMap(), embedding.vector());
        }

        TextSegment segment() {
            return TextSegment.from(text, StoryIndex.metadata(metadata));
        }
    }

    @ConfigProperty(name = "sagakeeper.memory.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "sagakeeper.data.dir", defaultValue = "${user.home}/.sagakeeper")
    String dataDir;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    EmbeddingModel embeddingModel;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<IndexCollection, InMemoryEmbeddingStore<TextSegment>> stores = new EnumMap<>(IndexCollection.class);
    private final Map<IndexCollection, Map<String, Fragment>> fragments = new EnumMap<>(IndexCollection.class);

    @PostConstruct
    void init() {
        lock.writeLock().lock();
        try {
            for (IndexCollection collection : IndexCollection.values()) {
                InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
                Map<String, Fragment> known = new LinkedHashMap<>();
                for (Fragment fragment : readFragments(collection)) {
                    if (known.putIfAbsent(fragment.id(), fragment) == null) {
                        store.add(fragment.id(), Embedding.from(fragment.vector()), fragment.segment());
                    }
                }
                stores.put(collection, store);
                fragments.put(collection, known);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.debugf("StoryIndex isAvailable=%s, %s", isAvailable(), stats());
    }

    public boolean isAvailable() {
        return enabled;
    }

    /** True if a fragment with this ID is already indexed in the collection. */
    public boolean contains(IndexCollection collection, String id) {
        lock.readLock().lock();
        try {
            return fragments.get(collection).containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Embed and append one fragment. A fragment ID that is already indexed is ignored.
     */
    public void indexFragment(IndexCollection collection, String id, String text, Map<String, ?> metadata) {
        if (!isAvailable()) {
            return;
        }
        if (contains(collection, id)) {
            log.debugf("Fragment %s already indexed in %s", id, collection.id());
            return;
        }
        TextSegment segment = TextSegment.from(text, metadata(metadata));
        Embedding embedding = embeddingModel.embed(segment).content();

        publish(Map.of(collection, List.of(Fragment.of(id, segment, embedding))));
    }

    /**
     * Index a chapter and each of its key events. Every embedding is computed first;
     * the chapter and its events then become visible together.
     */
    public void indexChapter(Chapter chapter) {
        if (!isAvailable()) {
            return;
        }
        if (contains(IndexCollection.CHAPTERS, chapter.chapterId())) {
            log.debugf("Chapter %s already indexed", chapter.chapterId());
            return;
        }

        Map<String, Object> chapterMeta = new LinkedHashMap<>();
        chapterMeta.put("chapterNumber", chapter.chapterNumber());
        chapterMeta.put("arcId", chapter.arcId());
        chapterMeta.put("title", chapter.title());
        chapterMeta.put("cliffhangerType", chapter.cliffhangerType());
        TextSegment chapterSegment = TextSegment.from(chapter.indexText(), metadata(chapterMeta));

        List<String> eventIds = new ArrayList<>();
        List<TextSegment> eventSegments = new ArrayList<>();
        for (int i = 0; i < chapter.keyEvents().size(); i++) {
            String event = chapter.keyEvents().get(i);
            if (event.isBlank()) {
                continue;
            }
            Map<String, Object> eventMeta = new LinkedHashMap<>();
            eventMeta.put("chapterId", chapter.chapterId());
            eventMeta.put("chapterNumber", chapter.chapterNumber());
            eventMeta.put("eventIndex", i);
            eventIds.add(chapter.chapterId() + "_event_" + i);
            eventSegments.add(TextSegment.from(event, metadata(eventMeta)));
        }

        List<TextSegment> all = new ArrayList<>(eventSegments.size() + 1);
        all.add(chapterSegment);
        all.addAll(eventSegments);
        List<Embedding> embeddings = embeddingModel.embedAll(all).content();
        if (embeddings == null || embeddings.size() != all.size()) {
            throw new IllegalStateException("Embedding count mismatch for %s: %d embeddings for %d segments"
                    .formatted(chapter.chapterId(), embeddings == null ? 0 : embeddings.size(), all.size()));
        }

        List<Fragment> events = new ArrayList<>(eventIds.size());
        for (int i = 0; i < eventIds.size(); i++) {
            events.add(Fragment.of(eventIds.get(i), eventSegments.get(i), embeddings.get(i + 1)));
        }
        // events are written before the chapter: a chapter on disk always has its events
        Map<IndexCollection, List<Fragment>> additions = new LinkedHashMap<>();
        additions.put(IndexCollection.EVENTS, events);
        additions.put(IndexCollection.CHAPTERS, List.of(Fragment.of(chapter.chapterId(), chapterSegment, embeddings.get(0))));
        if (publish(additions)) {
            log.infof("Indexed chapter %s with %d events", chapter.chapterId(), eventIds.size());
        }
    }

    public void indexThread(PlotThread thread) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("threadType", thread.getThreadType());
        meta.put("status", thread.getStatus().id());
        meta.put("importance", thread.getImportance().id());
        String text = thread.getName() + "\n" + (thread.getSetupDescription() == null ? "" : thread.getSetupDescription());
        indexFragment(IndexCollection.THREADS, thread.getThreadId(), text.trim(), meta);
    }

    /**
     * Nearest fragments to {@code text}, closest first.
     *
     * @param filter equality constraints on metadata values, may be null or empty
     */
    public List<IndexHit> query(IndexCollection collection, String text, int k, Map<String, String> filter) {
        if (!isAvailable() || k <= 0 || text == null || text.isBlank()) {
            return List.of();
        }
        InMemoryEmbeddingStore<TextSegment> store;
        lock.readLock().lock();
        try {
            if (fragments.get(collection).isEmpty()) {
                return List.of();
            }
            store = stores.get(collection);
        } finally {
            lock.readLock().unlock();
        }

        Embedding queryEmbedding = embeddingModel.embed(text).content();
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding)
                .maxResults(k)
                .filter(toFilter(filter))
                .build();

        EmbeddingSearchResult<TextSegment> result;
        lock.readLock().lock();
        try {
            result = store.search(request);
        } finally {
            lock.readLock().unlock();
        }

        List<IndexHit> hits = new ArrayList<>();
        for (EmbeddingMatch<TextSegment> match : result.matches()) {
            TextSegment segment = match.embedded();
            hits.add(new IndexHit(
                    match.embeddingId(),
                    segment == null ? "" : segment.text(),
                    segment == null ? Map.of() : toStringMap(segment.metadata()),
                    match.score() == null ? null : toDistance(match.score())));
        }
        return hits;
    }

    public List<IndexHit> searchChapters(String text, int k, String arcId) {
        return query(IndexCollection.CHAPTERS, text, k, arcId == null || arcId.isBlank() ? null : Map.of("arcId", arcId));
    }

    public List<IndexHit> searchEvents(String text, int k) {
        return query(IndexCollection.EVENTS, text, k, null);
    }

    public List<IndexHit> searchThreads(String text, int k, String status) {
        return query(IndexCollection.THREADS, text, k, status == null || status.isBlank() ? null : Map.of("status", status));
    }

    public IndexStats stats() {
        lock.readLock().lock();
        try {
            return new IndexStats(
                    fragments.get(IndexCollection.CHAPTERS).size(),
                    fragments.get(IndexCollection.EVENTS).size(),
                    fragments.get(IndexCollection.THREADS).size());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Drop every fragment in every collection. */
    public void reset() {
        lock.writeLock().lock();
        try {
            for (IndexCollection collection : IndexCollection.values()) {
                writeFragments(collection, List.of());
                stores.put(collection, new InMemoryEmbeddingStore<>());
                fragments.get(collection).clear();
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Story index reset");
    }

    /** Score is (cosine + 1) / 2; distance is 1 - cosine. */
    static double toDistance(double score) {
        return Math.max(0, Math.min(2, 2 * (1 - score)));
    }

    private static Filter toFilter(Map<String, String> filter) {
        if (filter == null) {
            return null;
        }
        Filter result = null;
        for (Map.Entry<String, String> e : filter.entrySet()) {
            Filter next = metadataKey(e.getKey()).isEqualTo(e.getValue());
            result = result == null ? next : result.and(next);
        }
        return result;
    }

    private static Metadata metadata(Map<String, ?> values) {
        Metadata metadata = new Metadata();
        if (values == null) {
            return metadata;
        }
        values.forEach((key, value) -> {
            if (value instanceof Integer i) {
                metadata.put(key, i);
            } else if (value instanceof Long l) {
                metadata.put(key, l);
            } else if (value instanceof Double d) {
                metadata.put(key, d);
            } else if (value != null) {
                metadata.put(key, value.toString());
            }
        });
        return metadata;
    }

    private static Map<String, String> toStringMap(Metadata metadata) {
        Map<String, String> result = new LinkedHashMap<>();
        metadata.toMap().forEach((key, value) -> result.put(key, String.valueOf(value)));
        return result;
    }

    // --- persistence ---

    /**
     * Write each collection with its new fragments, then make them visible.
     * Collections are written in the iteration order of {@code additions}; nothing
     * is published unless every write succeeded.
     *
     * @return false if every fragment was already indexed
     */
    private boolean publish(Map<IndexCollection, List<Fragment>> additions) {
        lock.writeLock().lock();
        try {
            Map<IndexCollection, List<Fragment>> fresh = new LinkedHashMap<>();
            additions.forEach((collection, list) -> {
                Map<String, Fragment> known = fragments.get(collection);
                List<Fragment> added = list.stream()
                        .filter(f -> !known.containsKey(f.id()))
                        .toList();
                if (!added.isEmpty()) {
                    fresh.put(collection, added);
                }
            });
            if (fresh.isEmpty()) {
                return false;
            }
            for (Map.Entry<IndexCollection, List<Fragment>> e : fresh.entrySet()) {
                List<Fragment> all = new ArrayList<>(fragments.get(e.getKey()).values());
                all.addAll(e.getValue());
                writeFragments(e.getKey(), all);
            }
            fresh.forEach((collection, added) -> {
                for (Fragment fragment : added) {
                    fragments.get(collection).put(fragment.id(), fragment);
                    stores.get(collection).add(fragment.id(), Embedding.from(fragment.vector()), fragment.segment());
                }
            });
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Path vectorDir() {
        Path dir = Path.of(dataDir).resolve("vectors");
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create vector directory: " + dir, e);
            }
        }
        return dir;
    }

    private Path collectionPath(IndexCollection collection) {
        return vectorDir().resolve(collection.id() + ".json");
    }

    private void writeFragments(IndexCollection collection, List<Fragment> list) {
        Path path = collectionPath(collection);
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.writeString(temp, objectMapper.writeValueAsString(list), StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write index collection " + path, e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.debugf(e, "Failed to remove temporary file %s", temp);
            }
        }
    }

    private List<Fragment> readFragments(IndexCollection collection) {
        Path path = collectionPath(collection);
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            List<Fragment> list = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8), FRAGMENTS);
            return list == null ? List.of() : list;
        } catch (IOException e) {
            log.warnf(e, "Failed to read index collection %s; it will be rebuilt from the story", path);
            return List.of();
        }
    }
}

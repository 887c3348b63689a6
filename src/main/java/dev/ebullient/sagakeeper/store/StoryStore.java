package dev.ebullient.sagakeeper.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.sagakeeper.model.StoryMemory;

/**
 * Durable home of the story state: one JSON document for the whole
 * {@link StoryMemory}, timestamped backup copies, and one markdown file per chapter body.
 */
@Singleton
public class StoryStore {
    private static final Logger log = Logger.getLogger(StoryStore.class);

    static final String MEMORY_FILE = "story_memory.json";
    static final String BACKUP_PREFIX = "story_memory_";
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");
    private static final Pattern BACKUP_NAME = Pattern.compile(
            Pattern.quote(BACKUP_PREFIX) + "(\\d{8}_\\d{6}_\\d{3})(?:_(\\d{1,9}))?\\.json");

    /** Timestamp first, then the collision counter as a number. */
    static final Comparator<String> NEWEST_FIRST = Comparator.<String, String> comparing(StoryStore::backupStamp)
            .thenComparingInt(StoryStore::backupSequence)
            .reversed();

    @ConfigProperty(name = "sagakeeper.data.dir", defaultValue = "${user.home}/.sagakeeper")
    String dataDir;

    @Inject
    ObjectMapper objectMapper;

    private Path ensureDir(Path dir) {
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create directory: " + dir, e);
            }
        }
        return dir;
    }

    private Path dataPath() {
        return ensureDir(Path.of(dataDir));
    }

    private Path memoryPath() {
        return dataPath().resolve(MEMORY_FILE);
    }

    private Path backupDir() {
        return ensureDir(dataPath().resolve("backups"));
    }

    private Path chaptersDir() {
        return ensureDir(dataPath().resolve("chapters"));
    }

    public boolean exists() {
        return Files.exists(memoryPath());
    }

    public StoryMemory initializeNewStory(String storyTitle, String worldName, String sagaGoal) {
        StoryMemory memory = new StoryMemory(storyTitle, worldName, sagaGoal);
        log.infof("Initialized new story: %s (world: %s)", storyTitle, worldName);
        return memory;
    }

    /**
     * Load the current story.
     *
     * @return empty if no story has been saved yet
     * @throws CorruptStateException if the stored document can not be read
     */
    public Optional<StoryMemory> load() {
        Path path = memoryPath();
        if (!Files.exists(path)) {
            log.infof("No existing story found at %s", path);
            return Optional.empty();
        }
        StoryMemory memory = read(path);
        log.infof("Loaded story '%s' from %s: %d chapters, %d characters, current chapter %d",
                memory.getStoryTitle(), path, memory.getChapters().size(),
                memory.getCharacters().size(), memory.getCurrentChapterNumber());
        return Optional.of(memory);
    }

    /**
     * Save the story. The new document is written next to the old one and moved
     * into place, so an interrupted write leaves the previous copy intact.
     */
    public synchronized void save(StoryMemory memory, boolean makeBackup) {
        memory.setLastUpdated(System.currentTimeMillis());
        Path path = memoryPath();
        if (makeBackup) {
            createBackup();
        }

        Path temp = path.resolveSibling(MEMORY_FILE + ".tmp");
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(memory);
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            moveIntoPlace(temp, path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save story memory: " + path, e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.debugf(e, "Failed to remove temporary file %s", temp);
            }
        }
        log.debugf("Saved story memory to %s", path);
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Copy the current document into the backup directory.
     *
     * @return the backup id, or empty if there is no saved story to back up
     */
    public synchronized Optional<String> createBackup() {
        Path path = memoryPath();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        Path dir = backupDir();
        String stamp = LocalDateTime.now().format(BACKUP_STAMP);
        String name = BACKUP_PREFIX + stamp + ".json";
        int n = 1;
        while (Files.exists(dir.resolve(name))) {
            name = BACKUP_PREFIX + stamp + "_" + n++ + ".json";
        }
        try {
            Files.copy(path, dir.resolve(name));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create backup of " + path, e);
        }
        log.infof("Created backup: %s", name);
        return Optional.of(name);
    }

    /** Backup ids, newest first. */
    public List<String> listBackups() {
        Path dir = backupDir();
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.startsWith(BACKUP_PREFIX) && name.endsWith(".json"))
                    .sorted(NEWEST_FIRST)
                    .toList();
        } catch (IOException e) {
            log.errorf(e, "Failed to list backups in %s", dir);
            return List.of();
        }
    }

    /**
     * Read a backup as a complete replacement for the in-memory story.
     * Nothing is merged and the current document is left untouched.
     *
     * @return empty if no backup with that id exists
     */
    public Optional<StoryMemory> restoreBackup(String backupId) {
        if (backupId == null || backupId.isBlank()
                || backupId.contains("/") || backupId.contains("\\") || backupId.contains("..")) {
            return Optional.empty();
        }
        Path path = backupDir().resolve(backupId);
        if (!Files.exists(path)) {
            log.warnf("Backup not found: %s", backupId);
            return Optional.empty();
        }
        StoryMemory memory = read(path);
        log.infof("Restored story from backup: %s", backupId);
        return Optional.of(memory);
    }

    public void saveChapterText(String chapterId, String content) {
        Path path = chaptersDir().resolve(chapterId + ".md");
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save chapter text: " + path, e);
        }
        log.debugf("Saved chapter text to %s", path);
    }

    public Optional<String> loadChapterText(String chapterId) {
        Path path = chaptersDir().resolve(chapterId + ".md");
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read chapter text: " + path, e);
        }
    }

    static String backupStamp(String backupId) {
        Matcher m = BACKUP_NAME.matcher(backupId);
        return m.matches() ? m.group(1) : backupId;
    }

    static int backupSequence(String backupId) {
        Matcher m = BACKUP_NAME.matcher(backupId);
        return m.matches() && m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
    }

    private StoryMemory read(Path path) {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read story memory: " + path, e);
        }
        StoryMemory memory;
        try {
            memory = objectMapper.readValue(json, StoryMemory.class);
        } catch (IOException | RuntimeException e) {
            throw new CorruptStateException(path, "Story memory could not be parsed", e);
        }
        if (memory == null) {
            throw new CorruptStateException(path, "Story memory document is empty", null);
        }
        return memory;
    }
}

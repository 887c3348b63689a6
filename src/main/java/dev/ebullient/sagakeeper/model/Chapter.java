package dev.ebullient.sagakeeper.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A finished chapter. Chapters are never edited after they have been merged;
 * the body text lives in its own markdown file next to the story document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chapter(
        String chapterId,
        int chapterNumber,
        String arcId,
        String title,
        String summary,
        List<String> keyEvents,
        List<String> charactersPresent,
        List<String> locations,
        String cliffhanger,
        String cliffhangerType,
        List<String> themes,
        String tone,
        int wordCount,
        long createdAt) {

    public Chapter {
        Objects.requireNonNull(chapterId, "chapterId");
        title = Objects.requireNonNullElse(title, "");
        summary = Objects.requireNonNullElse(summary, "");
        cliffhanger = Objects.requireNonNullElse(cliffhanger, "");
        cliffhangerType = Objects.requireNonNullElse(cliffhangerType, "");
        tone = Objects.requireNonNullElse(tone, "balanced");
        keyEvents = copyOf(keyEvents);
        charactersPresent = copyOf(charactersPresent);
        locations = copyOf(locations);
        themes = copyOf(themes);
    }

    public static Chapter of(String chapterId, int chapterNumber, String arcId, String title,
            String summary, List<String> keyEvents) {
        return new Chapter(chapterId, chapterNumber, arcId, title, summary, keyEvents,
                List.of(), List.of(), "", "", List.of(), "balanced", 0, System.currentTimeMillis());
    }

    /** Text submitted to the semantic index for this chapter. */
    public String indexText() {
        StringBuilder sb = new StringBuilder();
        sb.append(title).append('\n').append(summary);
        for (String event : keyEvents) {
            sb.append('\n').append(event);
        }
        return sb.toString().trim();
    }

    private static List<String> copyOf(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }
}

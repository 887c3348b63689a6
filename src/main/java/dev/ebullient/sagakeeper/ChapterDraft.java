package dev.ebullient.sagakeeper;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import dev.ebullient.sagakeeper.merge.FactBatch;

/**
 * A finished chapter as handed over by the writer. Number and ID are assigned by the session.
 *
 * @param content chapter body, stored as markdown and used for fact extraction
 * @param facts already extracted facts; when null they are extracted from the content
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChapterDraft(
        String title,
        String summary,
        List<String> keyEvents,
        List<String> charactersPresent,
        List<String> locations,
        String cliffhanger,
        String cliffhangerType,
        List<String> themes,
        String tone,
        String content,
        FactBatch facts) {

    public ChapterDraft {
        title = Objects.requireNonNullElse(title, "");
        content = Objects.requireNonNullElse(content, "");
    }

    public int wordCount() {
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}

package dev.ebullient.sagakeeper.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of merging one chapter's facts.
 *
 * @param skipped the chapter had already been merged; nothing was changed
 * @param indexed the chapter reached the semantic index
 */
public record MergeReport(
        String chapterId,
        boolean skipped,
        List<String> createdCharacters,
        List<String> createdThreads,
        List<String> warnings,
        boolean indexed) {

    public MergeReport {
        createdCharacters = List.copyOf(createdCharacters);
        createdThreads = List.copyOf(createdThreads);
        warnings = List.copyOf(warnings);
    }

    static MergeReport skipped(String chapterId) {
        return new MergeReport(chapterId, true, List.of(), List.of(),
                List.of("Chapter " + chapterId + " was already merged"), false);
    }

    MergeReport withIndexResult(boolean indexed, String warning) {
        List<String> all = new ArrayList<>(warnings);
        if (warning != null) {
            all.add(warning);
        }
        return new MergeReport(chapterId, skipped, createdCharacters, createdThreads, all, indexed);
    }
}

package dev.ebullient.sagakeeper.chat;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.sagakeeper.merge.FactBatch;
import dev.ebullient.sagakeeper.model.Chapter;

/**
 * Asks the generation service for the state changes in a finished chapter.
 * Output that is not valid JSON yields an empty batch rather than an error.
 */
@Singleton
public class FactExtractor {
    private static final Logger log = Logger.getLogger(FactExtractor.class);

    static final double TEMPERATURE = 0.3;
    static final int MAX_TOKENS = 2000;

    static final String SYSTEM_PROMPT = """
            You are a story analysis expert. Extract factual state changes from narrative text.
            Focus on concrete, verifiable changes like:
            - New characters introduced (named characters who appear or speak)
            - Character injuries, captures, or status changes
            - Locations discovered, destroyed, or modified
            - Plot threads introduced, advanced, or resolved

            For new characters, only include those with names or significant roles (not unnamed "townspeople" or "guards").
            Be conservative: only report changes explicitly stated or strongly implied in the text.
            """;

    static final String PROMPT = """
            Analyze this chapter and extract state changes.

            CHAPTER: %s
            CONTENT:
            %s

            Extract the following information in JSON format:

            1. NEW CHARACTERS: Characters introduced or mentioned for the first time
               Format: [{"name": "Name", "role": "protagonist/antagonist/ally/mentor/neutral", "personality": "brief description", "first_description": "how they were introduced"}]

            2. CHARACTER UPDATES: Changes to existing character states, locations, or possessions
               Format: [{"character_name": "Name", "updates": {"status": "injured/captured/etc", "location": "new location", "items_gained": ["item"], "items_lost": ["item"]}}]

            3. LOCATION UPDATES: Changes to locations (destroyed, modified, discovered)
               Format: [{"location_name": "Name", "change": "description of change", "status": "active/destroyed"}]

            4. THREAD UPDATES: Progress on existing plot threads or new threads introduced
               Format: [{"action": "progress/resolve/introduce", "thread_name": "Name", "description": "what happened"}]

            5. RELATIONSHIPS: Character relationships mentioned or established
               Format: [{"character_a": "Name", "character_b": "Name", "type": "ally/friend/rival/enemy/mentor/family", "description": "context"}]

            6. MAJOR EVENTS: Significant events worth tracking in timeline
               Format: [{"description": "what happened", "type": "battle/discovery/death/alliance/betrayal/revelation", "impact": "minor/moderate/major/critical"}]

            Return ONLY valid JSON in this format:
            {
              "new_characters": [...],
              "character_updates": [...],
              "location_updates": [...],
              "thread_updates": [...],
              "relationships": [...],
              "major_events": [...]
            }

            If no changes in a category, use empty array [].
            """;

    @Inject
    GenerationService generationService;

    @Inject
    ObjectMapper objectMapper;

    /**
     * @throws GenerationException if the generation service could not be reached
     */
    public FactBatch extract(Chapter chapter, String content) {
        String prompt = PROMPT.formatted(chapter.title(), content == null ? "" : content);
        String response = generationService.generate(prompt, SYSTEM_PROMPT, TEMPERATURE, MAX_TOKENS);
        return parse(chapter.chapterId(), response);
    }

    FactBatch parse(String chapterId, String response) {
        String json = stripCodeFence(response);
        if (json.isBlank()) {
            log.warnf("Empty fact extraction for %s; using empty changes", chapterId);
            return FactBatch.empty();
        }
        try {
            FactBatch batch = objectMapper.readValue(json, FactBatch.class);
            return batch == null ? FactBatch.empty() : batch;
        } catch (JsonProcessingException e) {
            log.warnf("Failed to parse state changes for %s (%s); using empty changes",
                    chapterId, e.getOriginalMessage());
            return FactBatch.empty();
        }
    }

    /** Return the body of the first fenced block, or the trimmed text when it is not fenced. */
    static String stripCodeFence(String response) {
        if (response == null) {
            return "";
        }
        String text = response.trim();
        if (!text.startsWith("```")) {
            return text;
        }
        String[] lines = text.split("\n");
        StringBuilder body = new StringBuilder();
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].trim().startsWith("```")) {
                break;
            }
            body.append(lines[i]).append('\n');
        }
        return body.toString().trim();
    }
}

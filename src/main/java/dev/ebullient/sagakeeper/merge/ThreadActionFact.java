package dev.ebullient.sagakeeper.merge;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Introduce, progress or resolve a plot thread.
 * Type and importance are only used when a thread is introduced.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ThreadActionFact(
        @JsonProperty("action") String action,
        @JsonProperty("thread_name") String threadName,
        @JsonProperty("description") String description,
        @JsonProperty("thread_type") String threadType,
        @JsonProperty("importance") String importance) {

    public static final String INTRODUCE = "introduce";
    public static final String PROGRESS = "progress";
    public static final String RESOLVE = "resolve";

    public ThreadActionFact {
        action = Objects.requireNonNullElse(action, "").trim().toLowerCase(Locale.ROOT);
        threadName = Objects.requireNonNullElse(threadName, "");
        description = Objects.requireNonNullElse(description, "");
    }

    public static ThreadActionFact introduce(String threadName, String description) {
        return new ThreadActionFact(INTRODUCE, threadName, description, null, null);
    }

    public static ThreadActionFact progress(String threadName, String description) {
        return new ThreadActionFact(PROGRESS, threadName, description, null, null);
    }

    public static ThreadActionFact resolve(String threadName, String description) {
        return new ThreadActionFact(RESOLVE, threadName, description, null, null);
    }
}

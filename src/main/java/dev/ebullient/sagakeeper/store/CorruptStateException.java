package dev.ebullient.sagakeeper.store;

import java.nio.file.Path;

/**
 * Persisted story state could not be read back into the model.
 * Callers should fall back to a backup or stop generating for this run.
 */
public class CorruptStateException extends RuntimeException {
    private final Path path;

    public CorruptStateException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}

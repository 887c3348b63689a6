package dev.ebullient.sagakeeper.chat;

/**
 * The text generation service kept failing after every retry.
 */
public class GenerationException extends RuntimeException {
    private final int attempts;

    public GenerationException(int attempts, Throwable cause) {
        super("Text generation failed after " + attempts + " attempt(s): " + cause.getMessage(), cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}

package io.github.eutro.scriptlift.core.extract;

/**
 * Thrown by an {@link ExtractionStrategy} that failed internally.
 */
public class ExtractionException extends RuntimeException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}

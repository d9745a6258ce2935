package io.resumable.core;

/**
 * Root of the engine's unchecked exceptions.
 */
public class BatchEngineException extends RuntimeException {
    public BatchEngineException(String message) {
        super(message);
    }

    public BatchEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}

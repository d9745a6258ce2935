package io.resumable.checkpoint;

import io.resumable.core.BatchEngineException;

/**
 * The persistence backend could not read or write a record. The scheduler treats it as an abort without
 * mutation.
 */
public class CheckpointStoreException extends BatchEngineException {
    public CheckpointStoreException(String message) {
        super(message);
    }

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.resumable.checkpoint;

/**
 * A stored record could not be decoded or carries an unknown schema version.
 */
public class CheckpointCorruptedException extends CheckpointStoreException {
    public CheckpointCorruptedException(String message) {
        super(message);
    }

    public CheckpointCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}

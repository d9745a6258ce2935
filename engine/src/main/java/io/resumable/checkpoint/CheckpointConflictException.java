package io.resumable.checkpoint;

public class CheckpointConflictException extends CheckpointStoreException {
    private final long storedOffset;
    private final long attemptedOffset;

    public CheckpointConflictException(String jobId, long storedOffset, long attemptedOffset) {
        super("refusing to move job " + jobId + " back from offset " + storedOffset + " to " + attemptedOffset);
        this.storedOffset = storedOffset;
        this.attemptedOffset = attemptedOffset;
    }

    public long storedOffset() { return storedOffset; }
    public long attemptedOffset() { return attemptedOffset; }
}

package io.resumable.checkpoint;

import java.util.Optional;

/**
 * Durable job progress. Implementations must make {@link #save} an atomic upsert; concurrent writers for the
 * same job are excluded by the scheduler's lock, not by the store.
 */
public interface CheckpointStore {
    Optional<Checkpoint> load(String jobId);

    /**
     * Upserts the checkpoint.
     *
     * @throws CheckpointConflictException if it would move {@code lastCompletedOffset} backwards
     */
    void save(Checkpoint checkpoint);

    void delete(String jobId);

    /** Keeps a completed checkpoint under an archive key and removes the live record. */
    void archive(Checkpoint checkpoint);

    Optional<Checkpoint> loadArchived(String jobId);

    void deleteArchived(String jobId);
}

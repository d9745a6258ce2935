package io.resumable.checkpoint;

import io.resumable.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link CheckpointStore} over a byte-oriented {@link KeyValueStore}. Live records live under
 * {@code checkpoint:<jobId>}, archived ones under {@code checkpoint-archive:<jobId>}.
 */
public class KeyValueCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(KeyValueCheckpointStore.class);

    static final String LIVE_PREFIX = "checkpoint:";
    static final String ARCHIVE_PREFIX = "checkpoint-archive:";

    private final KeyValueStore backend;
    private final CheckpointCodec codec;

    public KeyValueCheckpointStore(KeyValueStore backend) {
        this(backend, new CheckpointCodec(backend.maxValueBytes()));
    }

    public KeyValueCheckpointStore(KeyValueStore backend, CheckpointCodec codec) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public Optional<Checkpoint> load(String jobId) {
        return read(LIVE_PREFIX + jobId);
    }

    @Override
    public void save(Checkpoint checkpoint) {
        String key = LIVE_PREFIX + checkpoint.jobId();
        Optional<Checkpoint> stored = read(key);
        if (stored.isPresent() && stored.get().lastCompletedOffset() > checkpoint.lastCompletedOffset()) {
            throw new CheckpointConflictException(checkpoint.jobId(), stored.get().lastCompletedOffset(), checkpoint.lastCompletedOffset());
        }
        backend.set(key, codec.encode(checkpoint));
        log.debug("Saved checkpoint job={} offset={} status={}", checkpoint.jobId(), checkpoint.lastCompletedOffset(), checkpoint.status());
    }

    @Override
    public void delete(String jobId) {
        backend.delete(LIVE_PREFIX + jobId);
    }

    @Override
    public void archive(Checkpoint checkpoint) {
        backend.set(ARCHIVE_PREFIX + checkpoint.jobId(), codec.encode(checkpoint));
        backend.delete(LIVE_PREFIX + checkpoint.jobId());
    }

    @Override
    public Optional<Checkpoint> loadArchived(String jobId) {
        return read(ARCHIVE_PREFIX + jobId);
    }

    @Override
    public void deleteArchived(String jobId) {
        backend.delete(ARCHIVE_PREFIX + jobId);
    }

    private Optional<Checkpoint> read(String key) {
        byte[] bytes = backend.get(key);
        if (bytes == null) return Optional.empty();
        return Optional.of(codec.decode(key, bytes));
    }
}

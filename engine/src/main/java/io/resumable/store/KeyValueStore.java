package io.resumable.store;

/**
 * Minimal persistence backend: opaque bytes by string key. Implementations throw
 * {@link io.resumable.checkpoint.CheckpointStoreException} when the backend itself fails.
 */
public interface KeyValueStore extends AutoCloseable {
    /** Returns the stored bytes or null when the key is absent. */
    byte[] get(String key);

    void set(String key, byte[] value);

    void delete(String key);

    /** Largest value the backend accepts, or 0 for no limit. */
    default int maxValueBytes() { return 0; }

    @Override
    default void close() {}
}

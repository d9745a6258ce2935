package io.resumable.store;

import io.resumable.checkpoint.CheckpointStoreException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentMap<String, byte[]> values = new ConcurrentHashMap<>();
    private final int maxValueBytes;

    public InMemoryKeyValueStore() {
        this(0);
    }

    public InMemoryKeyValueStore(int maxValueBytes) {
        this.maxValueBytes = Math.max(0, maxValueBytes);
    }

    @Override
    public byte[] get(String key) {
        byte[] v = values.get(key);
        return v == null ? null : v.clone();
    }

    @Override
    public void set(String key, byte[] value) {
        if (maxValueBytes > 0 && value.length > maxValueBytes) {
            throw new CheckpointStoreException("value for " + key + " exceeds " + maxValueBytes + " bytes");
        }
        values.put(key, value.clone());
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    @Override
    public int maxValueBytes() {
        return maxValueBytes;
    }

    public Set<String> keys() {
        return Set.copyOf(values.keySet());
    }
}

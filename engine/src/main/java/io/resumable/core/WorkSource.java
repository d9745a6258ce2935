package io.resumable.core;

import java.util.List;

/**
 * An ordered, indexable sequence of work items. {@link #size()} is re-read on every run so a source
 * that shrank between runs is detected.
 */
public interface WorkSource<T> {
    long size() throws Exception;

    T get(long offset) throws Exception;

    static <T> WorkSource<T> of(List<T> items) {
        List<T> copy = List.copyOf(items);
        return new WorkSource<>() {
            @Override public long size() { return copy.size(); }
            @Override public T get(long offset) { return copy.get(Math.toIntExact(offset)); }
        };
    }
}

package io.resumable.core;

import java.util.Objects;

/**
 * Everything needed to (re)start a job from nothing but its id.
 */
public record JobDefinition<T>(String id, WorkSource<T> source, WorkItem<T> work, JobOptions options) {
    public JobDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(work, "work");
        Objects.requireNonNull(options, "options");
        if (id.isBlank()) throw new IllegalArgumentException("job id must not be blank");
    }

    public static <T> JobDefinition<T> of(String id, WorkSource<T> source, WorkItem<T> work) {
        return new JobDefinition<>(id, source, work, JobOptions.defaults());
    }

    public JobDefinition<T> withOptions(JobOptions opts) {
        return new JobDefinition<>(id, source, work, opts);
    }
}

package io.resumable.scheduler;

import io.resumable.core.JobDefinition;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job definitions by id, so a resumption carrying nothing but an id can find the work again.
 */
public class JobRegistry {
    private final Map<String, JobDefinition<?>> jobs = new ConcurrentHashMap<>();

    public void register(JobDefinition<?> job) {
        jobs.put(job.id(), job);
    }

    public Optional<JobDefinition<?>> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public void unregister(String jobId) {
        jobs.remove(jobId);
    }

    public Set<String> ids() {
        return Set.copyOf(jobs.keySet());
    }
}

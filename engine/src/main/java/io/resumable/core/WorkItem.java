package io.resumable.core;

/**
 * Performs one unit of work against an external resource. Errors are classified by the job's
 * {@link io.resumable.retry.ErrorClassifier}.
 */
@FunctionalInterface
public interface WorkItem<T> {
    void process(long offset, T item) throws Exception;
}

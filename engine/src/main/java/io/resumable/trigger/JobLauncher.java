package io.resumable.trigger;

@FunctionalInterface
public interface JobLauncher {
    void launch(String jobId) throws Exception;
}

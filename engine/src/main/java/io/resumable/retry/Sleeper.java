package io.resumable.retry;

@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;

    static Sleeper system() {
        return Thread::sleep;
    }
}

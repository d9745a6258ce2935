package io.resumable.error;

public interface DeadLetterSink extends AutoCloseable {
    void acceptFailure(DeadLetter letter);

    @Override default void close() {}
}

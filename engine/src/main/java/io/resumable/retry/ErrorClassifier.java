package io.resumable.retry;

@FunctionalInterface
public interface ErrorClassifier {
    ErrorClass classify(Throwable error);
}

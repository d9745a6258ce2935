package io.resumable.retry;

public enum ErrorClass {
    RETRYABLE,
    FATAL
}

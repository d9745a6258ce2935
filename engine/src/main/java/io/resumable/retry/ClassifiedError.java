package io.resumable.retry;

/**
 * Implemented by exceptions that know whether they are worth retrying. {@link DefaultErrorClassifier}
 * honours it before looking at the exception type.
 */
public interface ClassifiedError {
    ErrorClass errorClass();
}

package io.resumable.retry;

import io.resumable.quota.QuotaExceededException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Network, timeout and throttling errors are retryable; bad input, permission and not-found errors are
 * fatal. Anything unrecognised is fatal so a bug never turns into a retry storm.
 */
public class DefaultErrorClassifier implements ErrorClassifier {
    public static final DefaultErrorClassifier INSTANCE = new DefaultErrorClassifier();

    @Override
    public ErrorClass classify(Throwable error) {
        Throwable e = unwrap(error);
        if (e instanceof ClassifiedError ce) return ce.errorClass();
        if (e instanceof QuotaExceededException) return ErrorClass.FATAL;
        // IOException subtypes that mean "not there" or "not allowed"
        if (e instanceof FileNotFoundException || e instanceof NoSuchFileException || e instanceof AccessDeniedException) {
            return ErrorClass.FATAL;
        }
        if (e instanceof IOException || e instanceof TimeoutException) return ErrorClass.RETRYABLE;
        return ErrorClass.FATAL;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable e = error;
        while ((e instanceof ExecutionException || e instanceof CompletionException || e instanceof UncheckedIOException)
                && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}

package io.resumable.retry;

import io.resumable.quota.QuotaExceededException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class DefaultErrorClassifierTest {
    private final DefaultErrorClassifier classifier = DefaultErrorClassifier.INSTANCE;

    @Test
    void network_errors_are_retryable() {
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new SocketTimeoutException("read timed out")));
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new ExecutionException(new IOException("reset"))));
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new UncheckedIOException(new IOException("reset"))));
    }

    @Test
    void missing_resources_and_bugs_are_fatal() {
        assertEquals(ErrorClass.FATAL, classifier.classify(new NoSuchFileException("/nope")));
        assertEquals(ErrorClass.FATAL, classifier.classify(new IllegalStateException("bug")));
        assertEquals(ErrorClass.FATAL, classifier.classify(new QuotaExceededException("api", Instant.EPOCH, "remote quota gone")));
    }

    @Test
    void classified_errors_speak_for_themselves() {
        assertEquals(ErrorClass.RETRYABLE, classifier.classify(new TransientWorkException("busy")));
        assertEquals(ErrorClass.FATAL, classifier.classify(new PermanentWorkException("bad row")));
    }
}

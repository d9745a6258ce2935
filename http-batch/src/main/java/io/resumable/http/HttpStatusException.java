package io.resumable.http;

import io.resumable.core.BatchEngineException;
import io.resumable.retry.ClassifiedError;
import io.resumable.retry.ErrorClass;

/**
 * A non-2xx answer from the target. Throttling, timeouts and server errors are worth retrying; client errors
 * mean the line itself is bad.
 */
public class HttpStatusException extends BatchEngineException implements ClassifiedError {
    private final int status;

    public HttpStatusException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }

    @Override
    public ErrorClass errorClass() {
        return classify(status);
    }

    static ErrorClass classify(int status) {
        return switch (status) {
            case 408, 425, 429 -> ErrorClass.RETRYABLE;
            default -> status >= 500 ? ErrorClass.RETRYABLE : ErrorClass.FATAL;
        };
    }
}

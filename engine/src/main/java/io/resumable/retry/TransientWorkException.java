package io.resumable.retry;

import io.resumable.core.BatchEngineException;

/**
 * Temporary unavailability, throttling or a timeout reported by a work function.
 */
public class TransientWorkException extends BatchEngineException implements ClassifiedError {
    public TransientWorkException(String message) {
        super(message);
    }

    public TransientWorkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorClass errorClass() {
        return ErrorClass.RETRYABLE;
    }
}

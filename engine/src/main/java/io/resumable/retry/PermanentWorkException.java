package io.resumable.retry;

import io.resumable.core.BatchEngineException;

/**
 * Malformed input, missing permission or a missing target: retrying will not help.
 */
public class PermanentWorkException extends BatchEngineException implements ClassifiedError {
    public PermanentWorkException(String message) {
        super(message);
    }

    public PermanentWorkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorClass errorClass() {
        return ErrorClass.FATAL;
    }
}

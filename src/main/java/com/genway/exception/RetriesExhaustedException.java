package com.genway.exception;

import com.genway.model.ErrorKind;

/**
 * Terminal failure after every allowed attempt failed with a retryable error.
 */
public class RetriesExhaustedException extends GatewayException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super(ErrorKind.RETRIES_EXHAUSTED,
                "Maximum retry attempts exceeded (" + attempts + "): "
                        + (lastFailure != null ? lastFailure.getMessage() : "unknown error"),
                lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}

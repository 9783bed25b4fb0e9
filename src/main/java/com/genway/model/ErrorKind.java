package com.genway.model;

/**
 * Classification of a failed call, used for retry decisions and reporting.
 */
public enum ErrorKind {
    CONFIGURATION,       // missing preset / provider config / unsupported provider
    RATE_LIMITED,        // local admission denial
    CLIENT_ERROR,        // upstream 4xx other than 408/429
    TOO_MANY_REQUESTS,   // upstream 429
    SERVER_ERROR,        // upstream 5xx
    TIMEOUT,
    CONNECTION,
    MALFORMED_RESPONSE,
    RETRIES_EXHAUSTED,
    INTERNAL;

    /**
     * Map an upstream HTTP status to an error kind.
     */
    public static ErrorKind fromStatus(int status) {
        if (status == 408) {
            return TIMEOUT;
        }
        if (status == 429) {
            return TOO_MANY_REQUESTS;
        }
        if (status >= 500) {
            return SERVER_ERROR;
        }
        return CLIENT_ERROR;
    }
}

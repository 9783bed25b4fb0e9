package com.genway.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Exponential backoff policy: the delay before attempt n+1 is
 * {@code initialDelay * multiplier^(n-1)}, optionally spread by +/- jitter.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    public static final Set<ErrorKind> DEFAULT_RETRYABLE = EnumSet.of(
            ErrorKind.TIMEOUT,
            ErrorKind.CONNECTION,
            ErrorKind.TOO_MANY_REQUESTS,
            ErrorKind.SERVER_ERROR);

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofMillis(1000);

    @Builder.Default
    double multiplier = 2.0;

    /**
     * Fraction in [0, 1); 0 disables jitter.
     */
    @Builder.Default
    double jitter = 0.0;

    @Builder.Default
    Set<ErrorKind> retryableErrorKinds = DEFAULT_RETRYABLE;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public boolean isRetryable(ErrorKind kind) {
        return kind != null && retryableErrorKinds.contains(kind);
    }

    /**
     * Base delay after the given failed attempt (1-based), without jitter.
     */
    public Duration baseDelayAfter(int failedAttempt) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return Duration.ofMillis(Math.round(initialDelay.toMillis() * factor));
    }
}

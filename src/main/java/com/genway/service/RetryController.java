package com.genway.service;

import com.genway.exception.RetriesExhaustedException;
import com.genway.model.ErrorKind;
import com.genway.model.RetryPolicy;
import com.genway.service.retry.ErrorClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Runs an operation with exponential backoff.
 *
 * Each failure is classified; non-retryable kinds propagate at once, retryable ones wait
 * {@code initialDelay * multiplier^(n-1)} before attempt n+1. A retryable failure on the last
 * attempt becomes {@link RetriesExhaustedException}. Waiting is a Reactor timer, so cancelling
 * the subscription cancels the backoff.
 */
@Slf4j
@Service
public class RetryController {

    private final RetryPolicy defaultPolicy;
    private final ErrorClassifier errorClassifier;

    public RetryController(RetryPolicy defaultPolicy, ErrorClassifier errorClassifier) {
        this.defaultPolicy = defaultPolicy;
        this.errorClassifier = errorClassifier;
    }

    public <T> Mono<T> execute(Supplier<Mono<T>> operation) {
        return execute(operation, defaultPolicy);
    }

    public <T> Mono<T> execute(Supplier<Mono<T>> operation, RetryPolicy policy) {
        return Mono.defer(operation)
                .retryWhen(Retry.from(signals -> signals
                        .map(Retry.RetrySignal::copy)
                        .concatMap(signal -> {
                            int failedAttempt = (int) signal.totalRetries() + 1;
                            Throwable failure = signal.failure();
                            ErrorKind kind = errorClassifier.classify(failure);

                            if (!policy.isRetryable(kind)) {
                                return Mono.<Long>error(failure);
                            }
                            if (failedAttempt >= policy.getMaxAttempts()) {
                                log.error("Giving up after {} attempts: {}", failedAttempt, failure.getMessage());
                                return Mono.<Long>error(new RetriesExhaustedException(failedAttempt, failure));
                            }

                            Duration delay = delayAfter(failedAttempt, policy);
                            log.warn("Attempt {}/{} failed ({}), retrying in {}ms",
                                    failedAttempt, policy.getMaxAttempts(), kind, delay.toMillis());
                            return Mono.delay(delay);
                        })));
    }

    Duration delayAfter(int failedAttempt, RetryPolicy policy) {
        Duration base = policy.baseDelayAfter(failedAttempt);
        if (policy.getJitter() <= 0) {
            return base;
        }
        double spread = policy.getJitter() * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        return Duration.ofMillis(Math.max(0, Math.round(base.toMillis() * (1 + spread))));
    }
}

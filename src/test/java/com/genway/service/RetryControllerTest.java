package com.genway.service;

import com.genway.exception.ProviderRequestException;
import com.genway.exception.RetriesExhaustedException;
import com.genway.model.ErrorKind;
import com.genway.model.RetryPolicy;
import com.genway.service.retry.ErrorClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryControllerTest {

    private RetryController controller;
    private AtomicInteger attempts;

    @BeforeEach
    void setUp() {
        controller = new RetryController(RetryPolicy.defaults(), new ErrorClassifier());
        attempts = new AtomicInteger();
    }

    @Test
    void testThreeAttemptsWithBackoffThenExhausted() {
        StepVerifier.withVirtualTime(() -> controller.execute(() -> {
                    attempts.incrementAndGet();
                    return Mono.<String>error(ProviderRequestException.httpStatus("openai", 503, "unavailable"));
                }))
                .expectSubscription()
                .then(() -> assertEquals(1, attempts.get()))
                .thenAwait(Duration.ofMillis(999))
                .then(() -> assertEquals(1, attempts.get()))
                .thenAwait(Duration.ofMillis(1))
                .then(() -> assertEquals(2, attempts.get()))
                .thenAwait(Duration.ofMillis(1999))
                .then(() -> assertEquals(2, attempts.get()))
                .thenAwait(Duration.ofMillis(1))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(RetriesExhaustedException.class, error);
                    assertEquals(ErrorKind.RETRIES_EXHAUSTED, ((RetriesExhaustedException) error).getKind());
                    assertEquals(3, ((RetriesExhaustedException) error).getAttempts());
                    assertInstanceOf(ProviderRequestException.class, error.getCause());
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(3, attempts.get());
    }

    @Test
    void testNonRetryableErrorFailsImmediately() {
        StepVerifier.create(controller.execute(() -> {
                    attempts.incrementAndGet();
                    return Mono.<String>error(ProviderRequestException.httpStatus("openai", 401, "bad key"));
                }))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(ProviderRequestException.class, error);
                    assertEquals(ErrorKind.CLIENT_ERROR, ((ProviderRequestException) error).getKind());
                })
                .verify(Duration.ofSeconds(5));

        assertEquals(1, attempts.get());
    }

    @Test
    void testRecoversOnRetry() {
        RetryPolicy fast = RetryPolicy.builder().initialDelay(Duration.ofMillis(1)).build();

        StepVerifier.create(controller.execute(() -> attempts.incrementAndGet() < 2
                        ? Mono.<String>error(ProviderRequestException.httpStatus("claude", 429, "slow down"))
                        : Mono.just("ok"), fast))
                .expectNext("ok")
                .verifyComplete();

        assertEquals(2, attempts.get());
    }

    @Test
    void testRetryableKindsAreConfigurable() {
        RetryPolicy timeoutsOnly = RetryPolicy.builder()
                .initialDelay(Duration.ofMillis(1))
                .retryableErrorKinds(EnumSet.of(ErrorKind.TIMEOUT))
                .build();

        StepVerifier.create(controller.execute(() -> {
                    attempts.incrementAndGet();
                    return Mono.<String>error(ProviderRequestException.httpStatus("gemini", 500, ""));
                }, timeoutsOnly))
                .expectError(ProviderRequestException.class)
                .verify(Duration.ofSeconds(5));

        assertEquals(1, attempts.get());
    }

    @Test
    void testDelayGrowsExponentially() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(Duration.ofMillis(1000), controller.delayAfter(1, policy));
        assertEquals(Duration.ofMillis(2000), controller.delayAfter(2, policy));
        assertEquals(Duration.ofMillis(4000), controller.delayAfter(3, policy));
    }

    @Test
    void testJitterStaysWithinBounds() {
        RetryPolicy policy = RetryPolicy.builder().jitter(0.25).build();

        for (int i = 0; i < 100; i++) {
            long delay = controller.delayAfter(2, policy).toMillis();
            assertTrue(delay >= 1500 && delay <= 2500, "delay " + delay);
        }
    }
}

package com.genway.service;

import com.genway.config.GenwayProperties;
import com.genway.logging.RequestLogger;
import com.genway.model.CachedResponse;
import com.genway.model.NormalizedResponse;
import com.genway.model.RateLimitDecision;
import com.genway.model.RequestSpec;
import com.genway.model.ResolvedConfig;
import com.genway.provider.ProviderReply;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Executes generation requests end to end.
 *
 * Flow:
 * 1. Resolve preset, defaults and options
 * 2. Serve from cache when possible
 * 3. Check rate limits for the caller
 * 4. Dispatch with retry
 * 5. Price, cache and record the reply
 *
 * The returned Mono never errors: every failure becomes a response with {@code error} set.
 * Each call is logged exactly once, with the response that is returned.
 */
@Slf4j
@Service
public class RequestPipeline {

    private final ConfigResolver configResolver;
    private final ResponseCacheManager cacheManager;
    private final RateLimiter rateLimiter;
    private final ProviderDispatcher dispatcher;
    private final RetryController retryController;
    private final ResponseNormalizer normalizer;
    private final CostCalculator costCalculator;
    private final RequestLogger requestLogger;
    private final GenwayProperties.BatchConfig batchConfig;

    public RequestPipeline(ConfigResolver configResolver,
                           ResponseCacheManager cacheManager,
                           RateLimiter rateLimiter,
                           ProviderDispatcher dispatcher,
                           RetryController retryController,
                           ResponseNormalizer normalizer,
                           CostCalculator costCalculator,
                           RequestLogger requestLogger,
                           GenwayProperties properties) {
        this.configResolver = configResolver;
        this.cacheManager = cacheManager;
        this.rateLimiter = rateLimiter;
        this.dispatcher = dispatcher;
        this.retryController = retryController;
        this.normalizer = normalizer;
        this.costCalculator = costCalculator;
        this.requestLogger = requestLogger;
        this.batchConfig = properties.getBatch();
    }

    public Mono<NormalizedResponse> execute(RequestSpec request) {
        return Mono.defer(() -> {
                    long startNanos = System.nanoTime();
                    ResolvedConfig config;
                    try {
                        config = configResolver.resolve(request);
                    } catch (RuntimeException e) {
                        return Mono.just(normalizer.failure(e, request.getProvider(), request.getModel(),
                                elapsedMs(startNanos)));
                    }
                    return Mono.defer(() -> process(request, config, startNanos))
                            .onErrorResume(error -> Mono.just(normalizer.failure(error, config.getProvider(),
                                    config.getModel(), elapsedMs(startNanos))));
                })
                .map(response -> logAndReturn(request, response));
    }

    /**
     * Run requests concurrently; results keep the input order and one failure never affects another slot.
     */
    public Mono<List<NormalizedResponse>> executeBatch(List<RequestSpec> requests) {
        Duration timeout = batchConfig.getTimeout();
        int concurrency = Math.max(1, batchConfig.getConcurrency());

        return Flux.fromIterable(requests)
                .flatMapSequential(request -> execute(request)
                        .timeout(timeout)
                        .onErrorResume(error -> Mono.just(logAndReturn(request, normalizer.failure(
                                error, request.getProvider(), request.getModel(), timeout.toMillis())))),
                        concurrency)
                .collectList();
    }

    private Mono<NormalizedResponse> process(RequestSpec request, ResolvedConfig config, long startNanos) {
        Optional<CachedResponse> cached = cacheManager.get(config);
        if (cached.isPresent()) {
            log.debug("Serving cached response for {}/{}", config.getProvider(), config.getModel());
            return Mono.just(normalizer.fromCache(cached.get(), elapsedMs(startNanos)));
        }

        RateLimitDecision decision = rateLimiter.check(config.getProvider(), config.getModel(),
                estimateTokens(config.getPrompt()), request.getCallerId());
        if (!decision.isAllowed()) {
            return Mono.just(normalizer.rateLimited(decision, config.getProvider(), config.getModel(),
                    elapsedMs(startNanos)));
        }

        return cacheManager.deduplicate(config, () -> retryController.execute(() -> dispatcher.dispatch(config)))
                .map(reply -> complete(request, config, reply, startNanos));
    }

    private NormalizedResponse complete(RequestSpec request, ResolvedConfig config, ProviderReply reply,
                                        long startNanos) {
        BigDecimal cost = costCalculator.calculate(config.getModel(), reply.getUsage(), config.getOptions());
        NormalizedResponse response = normalizer.success(config, reply, cost, elapsedMs(startNanos));

        cacheManager.put(config, response);
        rateLimiter.record(config.getProvider(), config.getModel(), reply.getUsage().getTotalTokens(),
                request.getCallerId());
        return response;
    }

    private NormalizedResponse logAndReturn(RequestSpec request, NormalizedResponse response) {
        try {
            requestLogger.logRequest(request, response, response.getProvider(), response.getModel(),
                    response.getResponseTimeMs(), response.getError());
        } catch (RuntimeException e) {
            log.warn("Request logger failed", e);
        }
        return response;
    }

    /**
     * Rough token estimate used for admission: four characters per token.
     */
    static int estimateTokens(String prompt) {
        return prompt == null ? 0 : prompt.length() / 4;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}

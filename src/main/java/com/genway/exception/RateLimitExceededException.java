package com.genway.exception;

import com.genway.model.ErrorKind;
import com.genway.model.RateLimitDecision;
import com.genway.model.RateLimitDimension;

/**
 * Raised only by callers that choose to turn a denial into an exception;
 * the pipeline itself reports denials as failed responses.
 */
public class RateLimitExceededException extends GatewayException {

    private final transient RateLimitDecision decision;

    public RateLimitExceededException(String message) {
        super(ErrorKind.RATE_LIMITED, message);
        this.decision = null;
    }

    public RateLimitExceededException(RateLimitDecision decision) {
        super(ErrorKind.RATE_LIMITED, describe(decision));
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    static String describe(RateLimitDecision decision) {
        return "Rate limit exceeded. Requests remaining: "
                + orNa(decision.remainingFor(RateLimitDimension.REQUESTS_PER_MINUTE))
                + ", Tokens remaining: "
                + orNa(decision.remainingFor(RateLimitDimension.TOKENS_PER_MINUTE))
                + ", Daily requests remaining: "
                + orNa(decision.remainingFor(RateLimitDimension.REQUESTS_PER_DAY));
    }

    private static String orNa(Long value) {
        return value == null ? "N/A" : value.toString();
    }
}

package com.genway.logging;

import com.genway.model.NormalizedResponse;
import com.genway.model.RequestSpec;

/**
 * Receives one record per pipeline call, hit, miss or failure.
 * Implementations must not throw; the pipeline ignores logger failures.
 */
public interface RequestLogger {

    void logRequest(RequestSpec request, NormalizedResponse response, String provider, String model,
                    long durationMs, String error);
}

package com.genway.logging;

import com.genway.model.NormalizedResponse;
import com.genway.model.RequestSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default request log: one line per call at info, failures at warn.
 */
@Slf4j
@Component
public class Slf4jRequestLogger implements RequestLogger {

    @Override
    public void logRequest(RequestSpec request, NormalizedResponse response, String provider, String model,
                           long durationMs, String error) {
        if (error != null) {
            log.warn("GenAI request failed: preset={}, caller={}, provider={}, model={}, duration={}ms, kind={}, error={}",
                    request.getPresetName(), request.getCallerId(), provider, model, durationMs,
                    response.getErrorKind(), error);
            return;
        }
        log.info("GenAI request: preset={}, caller={}, provider={}, model={}, duration={}ms, cached={}, "
                        + "tokens={}/{}, cost={}",
                request.getPresetName(), request.getCallerId(), provider, model, durationMs,
                response.isCached(), response.getUsage().getInputTokens(), response.getUsage().getOutputTokens(),
                response.getCost());
    }
}

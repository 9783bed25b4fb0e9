package com.genway.service;

import com.genway.exception.GatewayException;
import com.genway.model.NormalizedResponse;
import com.genway.model.RequestSpec;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Convenience entry points over {@link RequestPipeline}.
 */
@Service
public class GenerationService {

    private final RequestPipeline pipeline;

    public GenerationService(RequestPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Content of a default-preset answer; a failed response is signalled as a {@link GatewayException}.
     */
    public Mono<String> ask(String prompt) {
        return ask(RequestSpec.of(prompt));
    }

    public Mono<String> ask(String prompt, String presetName) {
        return ask(RequestSpec.builder().prompt(prompt).presetName(presetName).build());
    }

    public Mono<String> ask(RequestSpec request) {
        return pipeline.execute(request).flatMap(response -> response.isSuccess()
                ? Mono.just(response.getContent())
                : Mono.error(new GatewayException(response.getErrorKind(), response.getError())));
    }

    public Mono<NormalizedResponse> generate(RequestSpec request) {
        return pipeline.execute(request);
    }

    public Mono<List<NormalizedResponse>> batch(List<RequestSpec> requests) {
        return pipeline.executeBatch(requests);
    }
}

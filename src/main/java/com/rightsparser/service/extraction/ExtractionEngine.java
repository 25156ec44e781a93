package com.rightsparser.service.extraction;

import reactor.core.publisher.Mono;

/**
 * Text generation backend used to extract structured rights data.
 */
public interface ExtractionEngine {

    /**
     * Run one generation call.
     *
     * @param prompt Complete prompt including the agreement text
     * @return Raw model output, expected to contain a JSON object
     */
    Mono<String> generate(String prompt);

    /**
     * Identifier of the model that answers {@link #generate(String)}.
     */
    String modelId();
}

package com.rightsparser.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.ExtractionFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Extraction engine backed by an Ollama server.
 */
@Slf4j
@Service
public class OllamaExtractionEngine implements ExtractionEngine {

    private final WebClient webClient;
    private final RightsParserProperties.ExtractionConfig config;

    public OllamaExtractionEngine(WebClient.Builder webClientBuilder, RightsParserProperties properties) {
        this.config = properties.getExtraction();
        this.webClient = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .build();
    }

    @Override
    public Mono<String> generate(String prompt) {
        Map<String, Object> requestBody = Map.of(
                "model", config.getModel(),
                "prompt", prompt,
                "stream", false,
                "format", "json",
                "options", Map.of(
                        "num_predict", config.getNumPredict(),
                        "temperature", config.getTemperature()
                )
        );

        log.debug("Sending {} prompt characters to model {}", prompt.length(), config.getModel());

        return webClient.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    JsonNode text = response.get("response");
                    if (text == null || !text.isTextual()) {
                        throw new ExtractionFailure("Engine response has no 'response' text");
                    }
                    return text.asText();
                })
                .doOnError(error -> log.warn("Generation call to {} failed: {}", config.getBaseUrl(),
                        error.getMessage()));
    }

    @Override
    public String modelId() {
        return config.getModel();
    }
}

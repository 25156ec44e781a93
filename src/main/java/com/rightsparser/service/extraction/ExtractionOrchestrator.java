package com.rightsparser.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.ExtractionFailure;
import com.rightsparser.model.ExtractionResult;
import com.rightsparser.util.DateNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns agreement text into a validated structured payload.
 *
 * Each attempt prompts the engine, strips anything around the outermost JSON object and
 * checks that a non-empty object came back. Failed attempts are retried up to the
 * configured attempt budget before an {@link ExtractionFailure} is raised.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionOrchestrator {

    private final ExtractionEngine extractionEngine;
    private final ObjectMapper objectMapper;
    private final RightsParserProperties properties;

    /**
     * Extract the structured rights payload from agreement text.
     *
     * @param text Plain agreement text
     * @return Payload with every required key present
     */
    public Mono<ExtractionResult> extract(String text) {
        RightsParserProperties.ExtractionConfig config = properties.getExtraction();
        String prompt = buildPrompt(text);
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        AtomicInteger attempts = new AtomicInteger();

        return Mono.defer(() -> {
                    int attempt = attempts.incrementAndGet();
                    log.debug("Extraction attempt {}/{}", attempt, maxAttempts);
                    return extractionEngine.generate(prompt)
                            .timeout(config.getAttemptTimeout())
                            .switchIfEmpty(Mono.error(new ExtractionFailure("Engine returned no output")))
                            .map(this::parsePayload)
                            .doOnError(error -> log.warn("Extraction attempt {}/{} failed: {}", attempt,
                                    maxAttempts, error.getMessage()));
                })
                .retryWhen(Retry.max(maxAttempts - 1L)
                        .onRetryExhaustedThrow((retrySpec, signal) -> new ExtractionFailure(String.format(
                                "Extraction failed after %d attempts: %s", maxAttempts,
                                signal.failure().getMessage()), signal.failure())))
                .map(payload -> ExtractionResult.builder()
                        .payload(payload)
                        .modelUsed(extractionEngine.modelId())
                        .attempts(attempts.get())
                        .build());
    }

    String buildPrompt(String text) {
        int maxChars = properties.getExtraction().getMaxInputChars();
        String agreement = text;
        if (agreement.length() > maxChars) {
            log.info("Truncating agreement text from {} to {} characters", agreement.length(), maxChars);
            agreement = agreement.substring(0, maxChars);
        }

        StringBuilder prompt = new StringBuilder()
                .append("Extract the rights information from this media rights agreement.\n\n")
                .append("Return a single JSON object with exactly these top-level keys:\n");
        for (Map.Entry<String, String> field : ExtractionSchema.descriptions().entrySet()) {
            prompt.append("- ").append(field.getKey()).append(": ").append(field.getValue()).append('\n');
        }
        AgreementHints hints = AgreementHintExtractor.extract(agreement);
        if (!hints.isEmpty()) {
            prompt.append("\nFound in the document, use these values exactly:\n");
            appendHint(prompt, "parties.licensor", hints.getLicensor());
            appendHint(prompt, "parties.licensee", hints.getLicensee());
            appendHint(prompt, "content.title", hints.getTitle());
        }
        prompt.append("\nRules:\n")
                .append("- Use values found in the document, never placeholders such as \"string\" or \"YYYY-MM-DD\"\n")
                .append("- Write dates as YYYY-MM-DD\n")
                .append("- Keep amounts and durations as written in the document\n")
                .append("- Use null when a value is not present\n")
                .append("- Return only the JSON object\n\n")
                .append("Agreement text:\n")
                .append(agreement);
        return prompt.toString();
    }

    private static void appendHint(StringBuilder prompt, String field, String value) {
        if (value != null) {
            prompt.append("- ").append(field).append(": ").append(value).append('\n');
        }
    }

    ObjectNode parsePayload(String raw) {
        String json = sanitize(raw);
        JsonNode root;
        try {
            root = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractionFailure("Engine output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || root.isEmpty()) {
            throw new ExtractionFailure("Engine output is not a non-empty JSON object");
        }

        ObjectNode payload = (ObjectNode) root;
        for (String key : ExtractionSchema.REQUIRED_KEYS) {
            if (!payload.has(key)) {
                payload.set(key, NullNode.getInstance());
            }
        }
        normalizeDates(payload);
        return payload;
    }

    /**
     * Strips code fences and any text before the first '{' or after the last '}'.
     */
    static String sanitize(String raw) {
        if (raw == null) {
            throw new ExtractionFailure("Engine returned no output");
        }
        String text = raw.replace("```json", "").replace("```", "").trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ExtractionFailure("Engine output contains no JSON object");
        }
        return text.substring(start, end + 1);
    }

    private void normalizeDates(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual()) {
                    DateNormalizer.normalize(field.getValue().asText())
                            .ifPresent(iso -> field.setValue(TextNode.valueOf(iso)));
                } else {
                    normalizeDates(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode element = array.get(i);
                if (element.isTextual()) {
                    int index = i;
                    DateNormalizer.normalize(element.asText()).ifPresent(iso -> array.set(index, TextNode.valueOf(iso)));
                } else {
                    normalizeDates(element);
                }
            }
        }
    }
}

package com.rightsparser.service.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.ExtractionFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ExtractionOrchestrator.
 */
@ExtendWith(MockitoExtension.class)
class ExtractionOrchestratorTest {

    private static final String SPIDER_MAN_RESPONSE = "Here is the extracted data:\n"
            + "```json\n"
            + "{\"parties\": {\"licensor\": \"Sony Pictures Entertainment\", \"licensee\": \"Star India\"},\n"
            + " \"content\": {\"title\": \"Spider-Man\", \"type\": \"film\"},\n"
            + " \"territory\": \"India\",\n"
            + " \"media_rights\": [\"theatrical\", \"television\"],\n"
            + " \"term\": {\"duration_years\": \"5\", \"start_date\": \"1 January 2025\"},\n"
            + " \"financial_terms\": {\"license_fee\": \"2,500,000\", \"currency\": \"USD\"},\n"
            + " \"governing_law\": \"India\"}\n"
            + "```";

    @Mock
    private ExtractionEngine engine;

    private RightsParserProperties properties;
    private ExtractionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new RightsParserProperties();
        properties.getExtraction().setAttemptTimeout(Duration.ofSeconds(2));
        orchestrator = new ExtractionOrchestrator(engine, new ObjectMapper(), properties);
        lenient().when(engine.modelId()).thenReturn("test-model");
    }

    @Test
    void extract_FencedResponse_ProducesCompletePayload() {
        when(engine.generate(anyString())).thenReturn(Mono.just(SPIDER_MAN_RESPONSE));

        StepVerifier.create(orchestrator.extract("Sony licenses Spider-Man in India"))
                .assertNext(result -> {
                    assertThat(result.getModelUsed()).isEqualTo("test-model");
                    assertThat(result.getAttempts()).isEqualTo(1);
                    assertThat(result.getPayload().get("territory").asText()).isEqualTo("India");
                    assertThat(result.getPayload().at("/financial_terms/license_fee").asText()).isEqualTo("2,500,000");
                    assertThat(result.getPayload().at("/term/duration_years").asText()).isEqualTo("5");
                    assertThat(result.getPayload().at("/term/start_date").asText()).isEqualTo("2025-01-01");
                    for (String key : ExtractionSchema.REQUIRED_KEYS) {
                        assertThat(result.getPayload().has(key)).as(key).isTrue();
                    }
                    assertThat(result.getPayload().get("deliverables").isNull()).isTrue();
                    assertThat(result.getPayload().get("signatories").isNull()).isTrue();
                })
                .verifyComplete();
    }

    @Test
    void extract_RetriesAfterMalformedOutput() {
        when(engine.generate(anyString()))
                .thenReturn(Mono.just("I cannot help with that"))
                .thenReturn(Mono.just("{\"territory\": \"India\"}"));

        StepVerifier.create(orchestrator.extract("agreement"))
                .assertNext(result -> {
                    assertThat(result.getAttempts()).isEqualTo(2);
                    assertThat(result.getPayload().get("territory").asText()).isEqualTo("India");
                })
                .verifyComplete();
    }

    @Test
    void extract_ExhaustedAttempts_Fails() {
        when(engine.generate(anyString())).thenReturn(Mono.just("{not json at all"));

        StepVerifier.create(orchestrator.extract("agreement"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ExtractionFailure.class);
                    assertThat(error.getMessage()).contains("after 3 attempts");
                })
                .verify();
        verify(engine, times(3)).generate(anyString());
    }

    @Test
    void extract_EngineErrorsAreRetried() {
        when(engine.generate(anyString()))
                .thenReturn(Mono.error(new IllegalStateException("connection reset")))
                .thenReturn(Mono.just("{\"territory\": \"India\"}"));

        StepVerifier.create(orchestrator.extract("agreement"))
                .expectNextMatches(result -> result.getAttempts() == 2)
                .verifyComplete();
    }

    @Test
    void extract_SlowEngineTimesOut() {
        properties.getExtraction().setAttemptTimeout(Duration.ofMillis(50));
        properties.getExtraction().setMaxAttempts(1);
        when(engine.generate(anyString())).thenReturn(Mono.never());

        StepVerifier.create(orchestrator.extract("agreement"))
                .expectError(ExtractionFailure.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void extract_PromptIsTruncated() {
        properties.getExtraction().setMaxInputChars(100);
        when(engine.generate(anyString())).thenReturn(Mono.just("{\"territory\": \"India\"}"));

        orchestrator.extract("x".repeat(500)).block();

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(engine).generate(prompt.capture());
        assertThat(prompt.getValue()).contains("x".repeat(100)).doesNotContain("x".repeat(101));
        for (String key : ExtractionSchema.REQUIRED_KEYS) {
            assertThat(prompt.getValue()).contains(key);
        }
    }

    @Test
    void parsePayload_RejectsEmptyAndNonObjectRoots() {
        assertThatThrownBy(() -> orchestrator.parsePayload("{}")).isInstanceOf(ExtractionFailure.class);
        assertThatThrownBy(() -> orchestrator.parsePayload("[1, 2]")).isInstanceOf(ExtractionFailure.class);
        assertThatThrownBy(() -> orchestrator.parsePayload("")).isInstanceOf(ExtractionFailure.class);
    }

    @Test
    void parsePayload_RejectsTrailingContent() {
        assertThatThrownBy(() -> orchestrator.parsePayload(
                "{\"territory\": \"India\"} \"financial_terms\": {\"fee\": }"))
                .isInstanceOf(ExtractionFailure.class);
        assertThatThrownBy(() -> orchestrator.parsePayload("{\"territory\": \"India\"}}"))
                .isInstanceOf(ExtractionFailure.class);
    }

    @Test
    void extract_TrailingContentIsRetried() {
        when(engine.generate(anyString()))
                .thenReturn(Mono.just("{\"territory\": \"India\"}}"), Mono.just(SPIDER_MAN_RESPONSE));

        StepVerifier.create(orchestrator.extract("Sony licenses Spider-Man in India"))
                .assertNext(result -> assertThat(result.getAttempts()).isEqualTo(2))
                .verifyComplete();
    }

    @Test
    void buildPrompt_IncludesPartyAndTitleHints() {
        String prompt = orchestrator.buildPrompt("1. Sony Pictures Entertainment, a Delaware company\n"
                + "And\n2. Star India Private Limited, a company in Mumbai\n"
                + "Assigned Film(s): Spider-Man\n");

        assertThat(prompt)
                .contains("- parties.licensor: Sony Pictures Entertainment")
                .contains("- parties.licensee: Star India Private Limited")
                .contains("- content.title: Spider-Man");
        assertThat(orchestrator.buildPrompt("plain text")).doesNotContain("use these values exactly");
    }

    @Test
    void sanitize_KeepsOutermostObject() {
        assertThat(ExtractionOrchestrator.sanitize("Sure! {\"a\": {\"b\": 1}} Hope this helps"))
                .isEqualTo("{\"a\": {\"b\": 1}}");
    }
}

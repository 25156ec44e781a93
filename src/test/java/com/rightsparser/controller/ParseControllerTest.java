package com.rightsparser.controller;

import com.rightsparser.config.ClockConfig;
import com.rightsparser.config.SecurityConfig;
import com.rightsparser.exception.ApiKeyRejectedException;
import com.rightsparser.exception.ApiKeyRejectedException.Reason;
import com.rightsparser.exception.BadRequestException;
import com.rightsparser.model.AuthenticatedKey;
import com.rightsparser.model.dto.JobResponse;
import com.rightsparser.model.entity.Job;
import com.rightsparser.model.entity.JobStatus;
import com.rightsparser.model.entity.UsageLog;
import com.rightsparser.service.ApiKeyService;
import com.rightsparser.service.JobService;
import com.rightsparser.service.UsageLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Integration tests for ParseController, including API key admission.
 */
@WebFluxTest(controllers = ParseController.class)
@Import({SecurityConfig.class, ClockConfig.class})
class ParseControllerTest {

    private static final String API_KEY = "rp_test_key";

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ApiKeyService apiKeyService;

    @MockBean
    private JobService jobService;

    @MockBean
    private UsageLogService usageLogService;

    private AuthenticatedKey key;
    private Job pending;

    @BeforeEach
    void setUp() {
        when(usageLogService.record(any())).thenReturn(Mono.empty());
        key = AuthenticatedKey.builder()
                .apiKeyId(UUID.randomUUID())
                .keyHash("hash-1")
                .keyPrefix("rp_test_")
                .build();
        pending = Job.builder()
                .id(UUID.randomUUID())
                .fileName("deal.txt")
                .fileSize(42L)
                .status(JobStatus.PENDING)
                .retryCount(0)
                .createdAt(LocalDateTime.of(2025, 1, 1, 0, 0))
                .build();
    }

    @Test
    void parse_AcceptsUpload() {
        when(apiKeyService.authorize(API_KEY)).thenReturn(Mono.just(key));
        when(jobService.submit(any(FilePart.class), eq(key), isNull(), isNull())).thenReturn(Mono.just(pending));

        webTestClient.post()
                .uri("/api/parse")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("file")))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.job_id").isEqualTo(pending.getId().toString())
                .jsonPath("$.status").isEqualTo("pending")
                .jsonPath("$.status_url").isEqualTo("/api/jobs/" + pending.getId());

        ArgumentCaptor<UsageLog> usage = ArgumentCaptor.forClass(UsageLog.class);
        verify(usageLogService, timeout(2000)).record(usage.capture());
        assertThat(usage.getValue().getEndpoint()).isEqualTo("/api/parse");
        assertThat(usage.getValue().getJobId()).isEqualTo(pending.getId());
        assertThat(usage.getValue().getApiKeyHash()).isEqualTo("hash-1");
        assertThat(usage.getValue().getStatusCode()).isEqualTo(202);
    }

    @Test
    void parse_AcceptsLegacyPdfFieldAndBearerToken() {
        when(apiKeyService.authorize(API_KEY)).thenReturn(Mono.just(key));
        when(jobService.submit(any(FilePart.class), eq(key), eq("https://hooks.example.com/done"), eq("user-7")))
                .thenReturn(Mono.just(pending));

        webTestClient.post()
                .uri(uri -> uri.path("/api/parse")
                        .queryParam("webhook_url", "https://hooks.example.com/done")
                        .queryParam("user_id", "user-7")
                        .build())
                .header("Authorization", "Bearer " + API_KEY)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("pdf")))
                .exchange()
                .expectStatus().isAccepted();
    }

    @Test
    void parse_WaitReturnsTerminalJob() {
        Job completed = Job.builder().id(pending.getId()).status(JobStatus.COMPLETED).build();
        when(apiKeyService.authorize(API_KEY)).thenReturn(Mono.just(key));
        when(jobService.submit(any(FilePart.class), eq(key), isNull(), isNull())).thenReturn(Mono.just(pending));
        when(jobService.awaitTerminal(pending)).thenReturn(Mono.just(completed));
        when(jobService.toResponse(completed)).thenReturn(JobResponse.builder()
                .id(completed.getId())
                .status(JobStatus.COMPLETED)
                .ipfsCid("bafy-result")
                .build());

        webTestClient.post()
                .uri("/api/parse?wait=true")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("file")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("completed")
                .jsonPath("$.ipfs_cid").isEqualTo("bafy-result");
    }

    @Test
    void parse_WaitTimesOutWhileRunning() {
        Job processing = Job.builder().id(pending.getId()).status(JobStatus.PROCESSING).build();
        when(apiKeyService.authorize(API_KEY)).thenReturn(Mono.just(key));
        when(jobService.submit(any(FilePart.class), eq(key), isNull(), isNull())).thenReturn(Mono.just(pending));
        when(jobService.awaitTerminal(pending)).thenReturn(Mono.just(processing));
        when(jobService.toResponse(processing)).thenReturn(JobResponse.builder()
                .id(processing.getId())
                .status(JobStatus.PROCESSING)
                .build());

        webTestClient.post()
                .uri("/api/parse?wait=true")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("file")))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.status").isEqualTo("processing");
    }

    @Test
    void parse_MissingFile() {
        when(apiKeyService.authorize(API_KEY)).thenReturn(Mono.just(key));
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("note", "no upload");

        webTestClient.post()
                .uri("/api/parse")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");

        verify(jobService, never()).submit(any(), any(), any(), any());
    }

    @Test
    void parse_RejectedUpload() {
        when(apiKeyService.authorize(API_KEY)).thenReturn(Mono.just(key));
        when(jobService.submit(any(FilePart.class), eq(key), any(), any()))
                .thenReturn(Mono.error(new BadRequestException("Unsupported file type: .docx")));

        webTestClient.post()
                .uri("/api/parse")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("file")))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("Unsupported file type: .docx");
    }

    @Test
    void parse_MissingApiKey() {
        when(apiKeyService.authorize(isNull()))
                .thenReturn(Mono.error(new ApiKeyRejectedException(Reason.UNAUTHORIZED, "Missing API key")));

        webTestClient.post()
                .uri("/api/parse")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("file")))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("unauthorized")
                .jsonPath("$.detail").isEqualTo("Missing API key")
                .jsonPath("$.trace_id").isNotEmpty();

        verify(jobService, never()).submit(any(), any(), any(), any());
    }

    @Test
    void parse_InactiveApiKey() {
        when(apiKeyService.authorize(anyString()))
                .thenReturn(Mono.error(new ApiKeyRejectedException(Reason.FORBIDDEN, "API key is inactive")));

        webTestClient.post()
                .uri("/api/parse")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("file")))
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.error").isEqualTo("forbidden");
    }

    @Test
    void parse_RateLimited() {
        when(apiKeyService.authorize(API_KEY)).thenReturn(Mono.error(
                new ApiKeyRejectedException(Reason.RATE_LIMITED, "Rate limit of 100 requests per hour exceeded")));

        webTestClient.post()
                .uri("/api/parse")
                .header("X-API-Key", API_KEY)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("file")))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.TOO_MANY_REQUESTS)
                .expectBody()
                .jsonPath("$.error").isEqualTo("rate_limited");

        ArgumentCaptor<UsageLog> usage = ArgumentCaptor.forClass(UsageLog.class);
        verify(usageLogService, timeout(2000)).record(usage.capture());
        assertThat(usage.getValue().getStatusCode()).isEqualTo(429);
        assertThat(usage.getValue().getJobId()).isNull();
    }

    private static MultiValueMap<String, HttpEntity<?>> upload(String field) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part(field, new ByteArrayResource("Licensor grants rights".getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return "deal.txt";
            }
        }).contentType(MediaType.TEXT_PLAIN);
        return builder.build();
    }
}

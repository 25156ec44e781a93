package com.rightsparser.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.BadRequestException;
import com.rightsparser.exception.JobNotReadyException;
import com.rightsparser.model.AuthenticatedKey;
import com.rightsparser.model.dto.JobResponse;
import com.rightsparser.model.dto.JobResultResponse;
import com.rightsparser.model.entity.Job;
import com.rightsparser.model.entity.JobStatus;
import com.rightsparser.service.storage.UploadStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;

/**
 * Service behind the job endpoints: submission, lookup and result retrieval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobService {

    private final JobStore jobStore;
    private final UploadStorage uploadStorage;
    private final ObjectMapper objectMapper;
    private final RightsParserProperties properties;

    /**
     * Store an uploaded agreement and queue it for processing.
     *
     * @param file Uploaded agreement
     * @param key Admitted API key, recorded as the job owner
     * @param webhookUrl Optional http(s) URL notified when the job ends
     * @param userId Optional caller supplied user id
     * @return The pending job
     */
    public Mono<Job> submit(FilePart file, AuthenticatedKey key, String webhookUrl, String userId) {
        String webhook = blankToNull(webhookUrl);
        if (webhook != null && !isHttpUrl(webhook)) {
            return Mono.error(new BadRequestException("webhook_url must be an absolute http or https URL"));
        }
        String owner = blankToNull(userId) != null ? userId.trim() : key.getUserId();

        return uploadStorage.store(file)
                .flatMap(stored -> jobStore.create(stored, key.getKeyHash(), owner, webhook));
    }

    /**
     * Wait until the job reaches a terminal state or the sync timeout elapses.
     *
     * @return The terminal job, or its latest state when the timeout elapsed first
     */
    public Mono<Job> awaitTerminal(Job job) {
        Duration timeout = properties.getApi().getSyncTimeout();
        Duration pollInterval = properties.getApi().getSyncPollInterval();

        return Flux.interval(Duration.ZERO, pollInterval)
                .concatMap(tick -> jobStore.find(job.getId()))
                .filter(current -> current.getStatus().isTerminal())
                .next()
                .timeout(timeout, Mono.defer(() -> {
                    log.info("Job {} still running after {}", job.getId(), timeout);
                    return jobStore.find(job.getId());
                }));
    }

    public Mono<JobResponse> getJob(UUID jobId, AuthenticatedKey key) {
        return jobStore.findForOwner(jobId, key.getKeyHash()).map(this::toResponse);
    }

    public Flux<JobResponse> recentJobs(AuthenticatedKey key) {
        return jobStore.recentForOwner(key.getKeyHash(), properties.getApi().getRecentJobsLimit())
                .map(this::toResponse);
    }

    /**
     * Result of a completed job.
     *
     * @throws JobNotReadyException (as an error signal) when the job has not completed
     */
    public Mono<JobResultResponse> getResult(UUID jobId, AuthenticatedKey key) {
        return jobStore.findForOwner(jobId, key.getKeyHash())
                .flatMap(job -> {
                    if (job.getStatus() != JobStatus.COMPLETED) {
                        return Mono.error(new JobNotReadyException(job.getId(), job.getStatus()));
                    }
                    return Mono.just(JobResultResponse.builder()
                            .jobId(job.getId())
                            .ipfsCid(job.getIpfsCid())
                            .encryptionKey(job.getEncryptionKey())
                            .parsedData(readPayload(job))
                            .metadata(JobResultResponse.Metadata.builder()
                                    .processingTimeMs(job.getProcessingTimeMs())
                                    .modelUsed(job.getModelUsed())
                                    .completedAt(job.getCompletedAt())
                                    .build())
                            .build());
                });
    }

    public JobResponse toResponse(Job job) {
        return JobResponse.builder()
                .id(job.getId())
                .fileName(job.getFileName())
                .fileSize(job.getFileSize())
                .status(job.getStatus())
                .ipfsCid(job.getIpfsCid())
                .parsedJson(readPayload(job))
                .errorMessage(job.getErrorMessage())
                .retryCount(job.getRetryCount())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .processingTimeMs(job.getProcessingTimeMs())
                .modelUsed(job.getModelUsed())
                .webhookUrl(job.getWebhookUrl())
                .webhookSent(job.getWebhookSent())
                .build();
    }

    private JsonNode readPayload(Job job) {
        if (job.getParsedJson() == null) {
            return null;
        }
        try {
            return objectMapper.readTree(job.getParsedJson());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload of job " + job.getId() + " is not valid JSON", e);
        }
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            return (scheme.equals("http") || scheme.equals("https")) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

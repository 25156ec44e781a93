package com.rightsparser.service;

import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.IllegalJobTransitionException;
import com.rightsparser.exception.ResourceNotFoundException;
import com.rightsparser.model.FileMetadata;
import com.rightsparser.model.JobResult;
import com.rightsparser.model.entity.Job;
import com.rightsparser.model.entity.JobStatus;
import com.rightsparser.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Durable job state machine.
 *
 * All transitions are conditional updates against the job's current status and
 * {@code lock_version}; no in-process lock is held. A job in PROCESSING belongs to the
 * worker whose claim produced the current {@code lock_version}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobStore {

    static final int CLAIM_CANDIDATES = 5;
    static final String STALE_CLAIM_MESSAGE = "Processing claim expired";

    private final JobRepository jobRepository;
    private final RightsParserProperties properties;
    private final Clock clock;

    /**
     * Create a pending job for an uploaded file.
     *
     * @param file Stored upload
     * @param apiKeyHash Hash of the owning API key
     * @param userId Optional caller supplied user id
     * @param webhookUrl Optional notification target
     * @return The saved job
     */
    public Mono<Job> create(FileMetadata file, String apiKeyHash, String userId, String webhookUrl) {
        Job job = Job.builder()
                .fileName(file.getFileName())
                .filePath(file.getFilePath())
                .fileSize(file.getFileSize())
                .apiKeyHash(apiKeyHash)
                .userId(userId)
                .status(JobStatus.PENDING)
                .lockVersion(0L)
                .retryCount(0)
                .createdAt(now())
                .modelUsed(properties.getExtraction().getModel())
                .webhookUrl(webhookUrl)
                .webhookSent(false)
                .build();

        return jobRepository.save(job)
                .doOnSuccess(saved -> log.info("Created job {} for file {} ({} bytes)",
                        saved.getId(), saved.getFileName(), saved.getFileSize()));
    }

    /**
     * Atomically take ownership of the oldest pending job.
     *
     * @param workerId Identity recorded on the claimed job
     * @return The claimed job, or empty when no pending job could be won
     */
    public Mono<Job> claim(String workerId) {
        return jobRepository.findClaimCandidates(CLAIM_CANDIDATES)
                .concatMap(candidate -> tryClaim(candidate, workerId), 1)
                .next();
    }

    private Mono<Job> tryClaim(Job candidate, String workerId) {
        LocalDateTime startedAt = now();
        return jobRepository.markProcessing(candidate.getId(), candidate.getLockVersion(), workerId, startedAt)
                .onErrorResume(this::isContention, e -> {
                    log.debug("Claim of job {} by {} lost to a concurrent update: {}",
                            candidate.getId(), workerId, e.getMessage());
                    return Mono.just(0);
                })
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.empty();
                    }
                    log.info("Job {} claimed by {}", candidate.getId(), workerId);
                    return jobRepository.findById(candidate.getId());
                });
    }

    /**
     * Record a successful result. Valid only for the current claim of a processing job.
     *
     * @param claimed The job as returned by {@link #claim(String)}
     * @param result Content address, key reference and payload
     * @return The completed job
     */
    public Mono<Job> complete(Job claimed, JobResult result) {
        if (result == null || isBlank(result.getContentId()) || isBlank(result.getEncryptionKey())
                || isBlank(result.getParsedJson())) {
            return Mono.error(new IllegalArgumentException(
                    "A completed job requires a content address, an encryption key and a payload"));
        }

        LocalDateTime completedAt = now();
        String modelUsed = result.getModelUsed() != null ? result.getModelUsed() : claimed.getModelUsed();
        return jobRepository.markCompleted(claimed.getId(), claimed.getLockVersion(), completedAt,
                        elapsedMillis(claimed, completedAt), result.getContentId(), result.getEncryptionKey(),
                        result.getParsedJson(), modelUsed)
                .flatMap(updated -> updated == 1
                        ? reload(claimed.getId())
                        : rejectTransition(claimed, JobStatus.COMPLETED))
                .doOnSuccess(job -> log.info("Job {} completed in {}ms (cid {})",
                        job.getId(), job.getProcessingTimeMs(), job.getIpfsCid()));
    }

    /**
     * Record a failed attempt.
     *
     * A retryable failure with retry budget left returns the job to PENDING and increments
     * {@code retry_count}; anything else moves it to FAILED with the message recorded.
     *
     * @param claimed The job as returned by {@link #claim(String)}
     * @param errorMessage Description of the failure
     * @param retryable Whether the failure class may succeed on a later attempt
     * @return The job after the transition
     */
    public Mono<Job> fail(Job claimed, String errorMessage, boolean retryable) {
        String message = isBlank(errorMessage) ? "Unknown error" : errorMessage;
        int maxRetries = properties.getWorker().getMaxRetries();

        Mono<Integer> requeued = retryable
                ? jobRepository.requeue(claimed.getId(), claimed.getLockVersion(), message, maxRetries)
                : Mono.just(0);

        return requeued.flatMap(updated -> {
            if (updated == 1) {
                log.warn("Job {} returned to queue after failure: {}", claimed.getId(), message);
                return reload(claimed.getId());
            }
            LocalDateTime completedAt = now();
            return jobRepository.markFailed(claimed.getId(), claimed.getLockVersion(), message, completedAt,
                            elapsedMillis(claimed, completedAt))
                    .flatMap(failed -> failed == 1
                            ? reload(claimed.getId())
                            : rejectTransition(claimed, JobStatus.FAILED))
                    .doOnSuccess(job -> log.error("Job {} failed permanently after {} retries: {}",
                            job.getId(), job.getRetryCount(), message));
        });
    }

    /**
     * Release claims held longer than the maximum processing duration.
     * Each expired claim counts as one retry; jobs without retry budget left fail.
     *
     * @return Jobs that reached FAILED through this sweep
     */
    public Flux<Job> recoverStaleClaims() {
        Duration maxDuration = properties.getWorker().getMaxProcessingDuration();
        LocalDateTime startedBefore = now().minus(maxDuration);

        return jobRepository.findStaleClaims(startedBefore)
                .concatMap(stale -> {
                    log.warn("Job {} claimed by {} since {} exceeded {}", stale.getId(), stale.getWorkerId(),
                            stale.getStartedAt(), maxDuration);
                    return fail(stale, STALE_CLAIM_MESSAGE, true)
                            .onErrorResume(IllegalJobTransitionException.class, e -> {
                                log.debug("Stale job {} changed concurrently: {}", stale.getId(), e.getMessage());
                                return Mono.empty();
                            });
                })
                .filter(job -> job.getStatus() == JobStatus.FAILED);
    }

    public Mono<Job> find(UUID jobId) {
        return reload(jobId);
    }

    /**
     * Find a job visible to the given API key. Jobs of other keys are reported as missing.
     */
    public Mono<Job> findForOwner(UUID jobId, String apiKeyHash) {
        return jobRepository.findByIdAndApiKeyHash(jobId, apiKeyHash)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Job", jobId.toString())));
    }

    public Flux<Job> recentForOwner(String apiKeyHash, int limit) {
        return jobRepository.findRecentByApiKeyHash(apiKeyHash, limit);
    }

    /**
     * Flag an acknowledged webhook delivery.
     *
     * @return true if this call set the flag, false if it was already set
     */
    public Mono<Boolean> markWebhookSent(UUID jobId) {
        return jobRepository.markWebhookSent(jobId).map(updated -> updated == 1);
    }

    private Mono<Job> reload(UUID jobId) {
        return jobRepository.findById(jobId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Job", jobId.toString())));
    }

    private Mono<Job> rejectTransition(Job claimed, JobStatus requested) {
        return reload(claimed.getId()).flatMap(current -> {
            if (current.getStatus() == JobStatus.PROCESSING) {
                return Mono.error(new IllegalJobTransitionException(String.format(
                        "Job '%s' is no longer held by %s (claim %d, current %d)", claimed.getId(),
                        claimed.getWorkerId(), claimed.getLockVersion(), current.getLockVersion())));
            }
            return Mono.error(new IllegalJobTransitionException(claimed.getId(), current.getStatus(), requested));
        });
    }

    private boolean isContention(Throwable error) {
        return error instanceof ConcurrencyFailureException || error instanceof TransientDataAccessException;
    }

    private long elapsedMillis(Job claimed, LocalDateTime end) {
        if (claimed.getStartedAt() == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(claimed.getStartedAt(), end).toMillis());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

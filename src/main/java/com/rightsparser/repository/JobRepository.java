package com.rightsparser.repository;

import com.rightsparser.model.entity.Job;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Repository for Job entities.
 *
 * Every status change is a conditional update guarded by the expected status and
 * {@code lock_version}. A result of 0 rows means another caller changed the job first.
 */
@Repository
public interface JobRepository extends ReactiveCrudRepository<Job, UUID> {

    /**
     * Oldest pending jobs, candidates for a claim.
     */
    @Query("SELECT * FROM jobs WHERE status = 'PENDING' ORDER BY created_at ASC LIMIT :limit")
    Flux<Job> findClaimCandidates(int limit);

    /**
     * Processing jobs whose claim started before the given instant.
     */
    @Query("SELECT * FROM jobs WHERE status = 'PROCESSING' AND started_at < :startedBefore")
    Flux<Job> findStaleClaims(LocalDateTime startedBefore);

    Mono<Job> findByIdAndApiKeyHash(UUID id, String apiKeyHash);

    @Query("SELECT * FROM jobs WHERE api_key_hash = :apiKeyHash ORDER BY created_at DESC LIMIT :limit")
    Flux<Job> findRecentByApiKeyHash(String apiKeyHash, int limit);

    @Modifying
    @Query("UPDATE jobs SET status = 'PROCESSING', started_at = :startedAt, worker_id = :workerId, " +
           "lock_version = lock_version + 1 " +
           "WHERE id = :id AND status = 'PENDING' AND lock_version = :lockVersion")
    Mono<Integer> markProcessing(UUID id, long lockVersion, String workerId, LocalDateTime startedAt);

    @Modifying
    @Query("UPDATE jobs SET status = 'COMPLETED', completed_at = :completedAt, processing_time_ms = :processingTimeMs, " +
           "ipfs_cid = :ipfsCid, encryption_key = :encryptionKey, parsed_json = :parsedJson, model_used = :modelUsed, " +
           "error_message = NULL, worker_id = NULL, lock_version = lock_version + 1 " +
           "WHERE id = :id AND status = 'PROCESSING' AND lock_version = :lockVersion")
    Mono<Integer> markCompleted(UUID id, long lockVersion, LocalDateTime completedAt, long processingTimeMs,
                                String ipfsCid, String encryptionKey, String parsedJson, String modelUsed);

    /**
     * Returns a claimed job to the queue while its retry budget allows it.
     */
    @Modifying
    @Query("UPDATE jobs SET status = 'PENDING', retry_count = retry_count + 1, error_message = :errorMessage, " +
           "started_at = NULL, worker_id = NULL, lock_version = lock_version + 1 " +
           "WHERE id = :id AND status = 'PROCESSING' AND lock_version = :lockVersion AND retry_count < :maxRetries")
    Mono<Integer> requeue(UUID id, long lockVersion, String errorMessage, int maxRetries);

    @Modifying
    @Query("UPDATE jobs SET status = 'FAILED', error_message = :errorMessage, completed_at = :completedAt, " +
           "processing_time_ms = :processingTimeMs, worker_id = NULL, lock_version = lock_version + 1 " +
           "WHERE id = :id AND status = 'PROCESSING' AND lock_version = :lockVersion")
    Mono<Integer> markFailed(UUID id, long lockVersion, String errorMessage, LocalDateTime completedAt,
                             long processingTimeMs);

    @Modifying
    @Query("UPDATE jobs SET webhook_sent = TRUE WHERE id = :id AND webhook_sent = FALSE")
    Mono<Integer> markWebhookSent(UUID id);
}

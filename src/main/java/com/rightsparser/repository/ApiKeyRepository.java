package com.rightsparser.repository;

import com.rightsparser.model.entity.ApiKey;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Repository for API Key entities and their rolling window request log.
 */
@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKey, UUID> {

    /**
     * Find API key by key hash.
     */
    Mono<ApiKey> findByKeyHash(String keyHash);

    /**
     * Count admitted requests after the given instant.
     */
    @Query("SELECT COUNT(*) FROM api_key_requests WHERE api_key_id = :apiKeyId AND requested_at > :since")
    Mono<Long> countRequestsSince(UUID apiKeyId, LocalDateTime since);

    /**
     * Increment the usage counter if nobody else did since it was read.
     */
    @Modifying
    @Query("UPDATE api_keys SET requests_count = requests_count + 1, last_used_at = :usedAt " +
           "WHERE id = :id AND requests_count = :expectedCount")
    Mono<Integer> incrementUsage(UUID id, long expectedCount, LocalDateTime usedAt);

    @Modifying
    @Query("INSERT INTO api_key_requests (api_key_id, requested_at) VALUES (:apiKeyId, :requestedAt)")
    Mono<Integer> recordRequest(UUID apiKeyId, LocalDateTime requestedAt);

    /**
     * Drop request rows that have left the rolling window.
     */
    @Modifying
    @Query("DELETE FROM api_key_requests WHERE api_key_id = :apiKeyId AND requested_at <= :cutoff")
    Mono<Integer> deleteRequestsBefore(UUID apiKeyId, LocalDateTime cutoff);
}

package com.rightsparser.service;

import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.ApiKeyRejectedException;
import com.rightsparser.exception.ApiKeyRejectedException.Reason;
import com.rightsparser.model.AuthenticatedKey;
import com.rightsparser.model.entity.ApiKey;
import com.rightsparser.repository.ApiKeyRepository;
import com.rightsparser.util.ApiKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Service for API key verification, rate limiting and key registration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyService {

    static final Duration RATE_WINDOW = Duration.ofHours(1);

    private final ApiKeyRepository apiKeyRepository;
    private final RightsParserProperties properties;
    private final Clock clock;

    /**
     * Verify an API key and admit one request against its rolling hourly limit.
     *
     * Rejected requests leave the key untouched. An admitted request increments
     * {@code requests_count}, stamps {@code last_used_at} and records the admission
     * in the rolling window, all within one transaction.
     *
     * @param rawKey The API key presented by the caller
     * @return Identity of the admitted key
     */
    @Transactional
    public Mono<AuthenticatedKey> authorize(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return Mono.error(new ApiKeyRejectedException(Reason.UNAUTHORIZED, "Missing API key"));
        }

        String keyHash = ApiKeyUtil.hashApiKey(rawKey.trim());
        return apiKeyRepository.findByKeyHash(keyHash)
                .switchIfEmpty(Mono.error(new ApiKeyRejectedException(Reason.UNAUTHORIZED, "Invalid API key")))
                .flatMap(key -> {
                    LocalDateTime now = LocalDateTime.now(clock);
                    if (!Boolean.TRUE.equals(key.getActive())) {
                        return Mono.error(new ApiKeyRejectedException(Reason.FORBIDDEN, "API key is inactive"));
                    }
                    if (key.isExpiredAt(now)) {
                        return Mono.error(new ApiKeyRejectedException(Reason.FORBIDDEN, "API key has expired"));
                    }
                    return admit(key, 1);
                });
    }

    private Mono<AuthenticatedKey> admit(ApiKey key, int attempt) {
        LocalDateTime now = LocalDateTime.now(clock);
        int limit = key.getRateLimit() != null ? key.getRateLimit() : properties.getAuth().getBootstrapRateLimit();
        long expectedCount = key.getRequestsCount() != null ? key.getRequestsCount() : 0L;

        return apiKeyRepository.countRequestsSince(key.getId(), now.minus(RATE_WINDOW))
                .flatMap(recent -> {
                    if (recent >= limit) {
                        log.warn("Rate limit reached for key {} ({} requests in the last hour)",
                                key.getKeyPrefix(), recent);
                        return Mono.error(new ApiKeyRejectedException(Reason.RATE_LIMITED,
                                String.format("Rate limit of %d requests per hour exceeded", limit)));
                    }
                    return apiKeyRepository.incrementUsage(key.getId(), expectedCount, now)
                            .flatMap(updated -> {
                                if (updated == 1) {
                                    return apiKeyRepository.recordRequest(key.getId(), now)
                                            .then(apiKeyRepository.deleteRequestsBefore(key.getId(),
                                                    now.minus(RATE_WINDOW)))
                                            .thenReturn(toAuthenticatedKey(key));
                                }
                                if (attempt >= properties.getAuth().getMaxAdmissionAttempts()) {
                                    return Mono.error(new ApiKeyRejectedException(Reason.RATE_LIMITED,
                                            "Too many concurrent requests for this API key"));
                                }
                                log.debug("Usage counter of key {} changed concurrently, attempt {}",
                                        key.getKeyPrefix(), attempt);
                                return apiKeyRepository.findById(key.getId())
                                        .flatMap(current -> admit(current, attempt + 1));
                            });
                });
    }

    /**
     * Register a new API key.
     *
     * @param rawKey The key to register, or null to generate one
     * @param name Display name of the key
     * @param rateLimit Admitted requests per rolling hour
     * @return The stored key
     */
    public Mono<ApiKey> issueKey(String rawKey, String name, int rateLimit) {
        String key = rawKey != null ? rawKey : ApiKeyUtil.generateApiKey();
        ApiKey apiKey = ApiKey.builder()
                .keyHash(ApiKeyUtil.hashApiKey(key))
                .keyPrefix(ApiKeyUtil.getKeyPrefix(key))
                .name(name)
                .active(true)
                .rateLimit(rateLimit)
                .requestsCount(0L)
                .createdAt(LocalDateTime.now(clock))
                .build();

        return apiKeyRepository.save(apiKey)
                .doOnSuccess(saved -> log.info("Registered API key {} ({})", saved.getKeyPrefix(), name));
    }

    /**
     * Register the configured bootstrap key unless a key with the same hash exists.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void registerBootstrapKey() {
        String bootstrapKey = properties.getAuth().getBootstrapKey();
        if (bootstrapKey == null || bootstrapKey.isBlank()) {
            return;
        }

        apiKeyRepository.findByKeyHash(ApiKeyUtil.hashApiKey(bootstrapKey))
                .hasElement()
                .flatMap(exists -> exists
                        ? Mono.empty()
                        : issueKey(bootstrapKey, "bootstrap", properties.getAuth().getBootstrapRateLimit()))
                .subscribe(
                        saved -> log.info("Bootstrap API key is ready"),
                        error -> log.error("Failed to register bootstrap API key", error));
    }

    private AuthenticatedKey toAuthenticatedKey(ApiKey key) {
        return AuthenticatedKey.builder()
                .apiKeyId(key.getId())
                .keyHash(key.getKeyHash())
                .keyPrefix(key.getKeyPrefix())
                .userId(key.getUserId())
                .build();
    }
}

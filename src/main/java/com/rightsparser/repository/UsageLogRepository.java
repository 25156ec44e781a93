package com.rightsparser.repository;

import com.rightsparser.model.entity.UsageLog;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Repository for UsageLog entities. Rows are only ever inserted.
 */
@Repository
public interface UsageLogRepository extends ReactiveCrudRepository<UsageLog, Long> {

    Flux<UsageLog> findByApiKeyHash(String apiKeyHash);
}

package com.rightsparser.service;

import com.rightsparser.model.entity.UsageLog;
import com.rightsparser.repository.UsageLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Service for the append-only request log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageLogService {

    private final UsageLogRepository usageLogRepository;
    private final Clock clock;

    /**
     * Append one usage row. The creation time is stamped here when absent.
     *
     * @param entry The request to record
     * @return The saved row
     */
    public Mono<UsageLog> record(UsageLog entry) {
        if (entry.getCreatedAt() == null) {
            entry.setCreatedAt(LocalDateTime.now(clock));
        }
        // Rows are never updated, a set id would turn the save into an update
        entry.setId(null);

        return usageLogRepository.save(entry)
                .doOnSuccess(saved -> log.debug("{} {} -> {} in {}ms", saved.getMethod(), saved.getEndpoint(),
                        saved.getStatusCode(), saved.getProcessingTimeMs()));
    }
}

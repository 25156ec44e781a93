package com.rightsparser.service.webhook;

import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.model.entity.Job;
import com.rightsparser.service.JobStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers terminal job notifications to caller supplied webhook URLs.
 *
 * Jobs are queued in memory and delivered asynchronously; a delivery is retried with
 * exponential backoff and, once acknowledged with a 2xx, recorded on the job so it is
 * not sent again. Failed deliveries never change the job's status.
 *
 * Only one delivery per job runs at a time in this process. Delivery is at-least-once:
 * a crash between the acknowledgement and {@code webhook_sent} being stored, or two
 * instances notifying the same job, can repeat a notification, so receivers should
 * deduplicate on {@code job_id}.
 */
@Slf4j
@Service
public class WebhookDispatcher {

    private static final int DELIVERY_CONCURRENCY = 8;
    private static final Duration EMIT_RETRY = Duration.ofMillis(100);

    private final WebClient webClient;
    private final JobStore jobStore;
    private final RightsParserProperties.WebhookConfig config;
    private final Clock clock;
    private final Sinks.Many<Job> queue = Sinks.many().unicast().onBackpressureBuffer();
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    private Disposable drain;

    public WebhookDispatcher(WebClient.Builder webClientBuilder, JobStore jobStore,
                             RightsParserProperties properties, Clock clock) {
        this.webClient = webClientBuilder.build();
        this.jobStore = jobStore;
        this.config = properties.getWebhook();
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        drain = queue.asFlux()
                .flatMap(job -> deliver(job)
                        .onErrorResume(error -> {
                            log.error("Webhook delivery for job {} aborted", job.getId(), error);
                            return Mono.just(false);
                        }), DELIVERY_CONCURRENCY)
                .subscribe();
    }

    @PreDestroy
    public void stop() {
        if (drain != null) {
            drain.dispose();
        }
    }

    /**
     * Queue a notification for a job that reached a terminal state.
     * Jobs without a webhook URL are ignored.
     */
    public void enqueue(Job job) {
        if (!hasWebhook(job)) {
            return;
        }
        if (job.getStatus() == null || !job.getStatus().isTerminal()) {
            log.warn("Not queueing webhook for job {} in state {}", job.getId(), job.getStatus());
            return;
        }
        queue.emitNext(job, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
        log.debug("Queued webhook for job {}", job.getId());
    }

    /**
     * Deliver the notification for one job.
     *
     * @param job Terminal job
     * @return true when this call delivered and recorded the notification
     */
    public Mono<Boolean> deliver(Job job) {
        if (!hasWebhook(job)) {
            return Mono.just(false);
        }

        return Mono.defer(() -> {
            if (!inFlight.add(job.getId())) {
                log.debug("Webhook for job {} is already being delivered", job.getId());
                return Mono.just(false);
            }
            return jobStore.find(job.getId())
                    .flatMap(current -> {
                        if (Boolean.TRUE.equals(current.getWebhookSent())) {
                            log.debug("Webhook for job {} already delivered", current.getId());
                            return Mono.just(false);
                        }
                        return post(current);
                    })
                    .doFinally(signal -> inFlight.remove(job.getId()));
        });
    }

    private Mono<Boolean> post(Job job) {
        Map<String, Object> payload = buildPayload(job);

        return webClient.post()
                .uri(job.getWebhookUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .toBodilessEntity()
                .timeout(config.getTimeout())
                .doOnError(error -> log.warn("Webhook attempt for job {} to {} failed: {}",
                        job.getId(), job.getWebhookUrl(), error.getMessage()))
                .retryWhen(Retry.backoff(config.getMaxRetries(), config.getInitialBackoff())
                        .maxBackoff(config.getMaxBackoff()))
                .flatMap(response -> {
                    log.info("Webhook for job {} acknowledged with {}", job.getId(), response.getStatusCode());
                    return jobStore.markWebhookSent(job.getId());
                })
                .onErrorResume(error -> {
                    log.error("Webhook for job {} to {} failed after {} retries: {}", job.getId(),
                            job.getWebhookUrl(), config.getMaxRetries(), error.getMessage());
                    return Mono.just(false);
                });
    }

    Map<String, Object> buildPayload(Job job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", job.getId().toString());
        payload.put("status", job.getStatus().value());
        if (job.getIpfsCid() != null) {
            payload.put("ipfs_cid", job.getIpfsCid());
        }
        if (job.getEncryptionKey() != null) {
            payload.put("encryption_key", job.getEncryptionKey());
        }
        if (job.getErrorMessage() != null) {
            payload.put("error_message", job.getErrorMessage());
        }
        payload.put("timestamp", Instant.now(clock).toString());
        return payload;
    }

    private static boolean hasWebhook(Job job) {
        return job.getWebhookUrl() != null && !job.getWebhookUrl().isBlank();
    }
}

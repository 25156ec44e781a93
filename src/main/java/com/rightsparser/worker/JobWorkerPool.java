package com.rightsparser.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.DocumentConversionException;
import com.rightsparser.exception.IllegalJobTransitionException;
import com.rightsparser.model.JobResult;
import com.rightsparser.model.entity.Job;
import com.rightsparser.model.entity.JobStatus;
import com.rightsparser.service.JobStore;
import com.rightsparser.service.document.DocumentTextExtractor;
import com.rightsparser.service.extraction.ExtractionOrchestrator;
import com.rightsparser.service.storage.ArtifactPublisher;
import com.rightsparser.service.webhook.WebhookDispatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.file.Paths;

/**
 * Pool of polling workers that drive jobs from PENDING to a terminal state.
 *
 * Each worker loop claims one job at a time, converts the upload to text, extracts the
 * structured payload, publishes it and records the outcome. Failures are recorded on the
 * job; the loop itself keeps running.
 */
@Slf4j
@Component
public class JobWorkerPool {

    private final JobStore jobStore;
    private final DocumentTextExtractor textExtractor;
    private final ExtractionOrchestrator orchestrator;
    private final ArtifactPublisher publisher;
    private final WebhookDispatcher webhookDispatcher;
    private final ObjectMapper objectMapper;
    private final RightsParserProperties.WorkerConfig config;
    private final MeterRegistry meterRegistry;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter retriedCounter;
    private final Timer processingTimer;

    private final Disposable.Composite loops = Disposables.composite();

    public JobWorkerPool(JobStore jobStore, DocumentTextExtractor textExtractor,
                         ExtractionOrchestrator orchestrator, ArtifactPublisher publisher,
                         WebhookDispatcher webhookDispatcher, ObjectMapper objectMapper,
                         RightsParserProperties properties, MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.textExtractor = textExtractor;
        this.orchestrator = orchestrator;
        this.publisher = publisher;
        this.webhookDispatcher = webhookDispatcher;
        this.objectMapper = objectMapper;
        this.config = properties.getWorker();
        this.meterRegistry = meterRegistry;

        this.completedCounter = Counter.builder("rights.jobs.completed")
                .description("Number of jobs completed")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("rights.jobs.failed")
                .description("Number of jobs failed permanently")
                .register(meterRegistry);
        this.retriedCounter = Counter.builder("rights.jobs.retried")
                .description("Number of failed attempts returned to the queue")
                .register(meterRegistry);
        this.processingTimer = Timer.builder("rights.jobs.processing.time")
                .description("Time spent processing one claimed job")
                .register(meterRegistry);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!config.isEnabled()) {
            log.info("Job workers are disabled");
            return;
        }

        for (int i = 1; i <= config.getConcurrency(); i++) {
            String workerId = "worker-" + i;
            loops.add(runLoop(workerId).subscribe());
        }
        loops.add(Flux.interval(config.getStaleCheckInterval())
                .concatMap(tick -> recoverStaleClaims()
                        .onErrorResume(error -> {
                            log.error("Stale claim sweep failed", error);
                            return Mono.empty();
                        }))
                .subscribe());

        log.info("Started {} job workers (poll interval {}, max retries {})",
                config.getConcurrency(), config.getPollInterval(), config.getMaxRetries());
    }

    @PreDestroy
    public void stop() {
        loops.dispose();
        log.info("Job workers stopped");
    }

    private Flux<Boolean> runLoop(String workerId) {
        return Mono.defer(() -> pollOnce(workerId))
                .onErrorResume(error -> {
                    log.error("Worker {} poll failed", workerId, error);
                    return Mono.just(false);
                })
                .flatMap(found -> found
                        ? Mono.just(true)
                        : Mono.delay(config.getPollInterval()).thenReturn(false))
                .repeat();
    }

    /**
     * Claim and process at most one job.
     *
     * @param workerId Identity recorded on the claim
     * @return true when a job was claimed
     */
    public Mono<Boolean> pollOnce(String workerId) {
        return jobStore.claim(workerId)
                .flatMap(job -> process(job).thenReturn(true))
                .defaultIfEmpty(false);
    }

    /**
     * Release expired claims and notify for jobs that failed as a result.
     */
    public Mono<Long> recoverStaleClaims() {
        return jobStore.recoverStaleClaims()
                .doOnNext(failed -> {
                    failedCounter.increment();
                    webhookDispatcher.enqueue(failed);
                })
                .count()
                .doOnNext(count -> {
                    if (count > 0) {
                        log.warn("{} stale jobs failed after exhausting their retries", count);
                    }
                });
    }

    private Mono<Job> process(Job job) {
        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Processing job {} ({}) attempt {}", job.getId(), job.getFileName(), job.getRetryCount() + 1);

        return textExtractor.extractText(Paths.get(job.getFilePath()))
                .flatMap(orchestrator::extract)
                .flatMap(extraction -> publisher.publish(extraction.getPayload())
                        .flatMap(artifact -> Mono.fromCallable(() -> JobResult.builder()
                                .contentId(artifact.getContentId())
                                .encryptionKey(artifact.getEncryptionKey())
                                .parsedJson(serialize(extraction.getPayload()))
                                .modelUsed(extraction.getModelUsed())
                                .build())))
                .flatMap(result -> jobStore.complete(job, result))
                .doOnNext(completed -> completedCounter.increment())
                .onErrorResume(error -> !(error instanceof IllegalJobTransitionException),
                        error -> recordFailure(job, error))
                .doOnNext(updated -> {
                    if (updated.getStatus().isTerminal()) {
                        webhookDispatcher.enqueue(updated);
                    }
                })
                .doFinally(signal -> sample.stop(processingTimer));
    }

    private Mono<Job> recordFailure(Job job, Throwable error) {
        boolean retryable = isRetryable(error);
        String message = describe(error);
        log.warn("Job {} attempt failed ({}): {}", job.getId(), retryable ? "retryable" : "permanent", message);

        return jobStore.fail(job, message, retryable)
                .doOnNext(updated -> {
                    if (updated.getStatus() == JobStatus.FAILED) {
                        failedCounter.increment();
                    } else {
                        retriedCounter.increment();
                    }
                });
    }

    /**
     * Documents that cannot be converted are final; extraction, engine, network and
     * publish errors may succeed on a later attempt.
     */
    static boolean isRetryable(Throwable error) {
        if (error instanceof DocumentConversionException conversion) {
            return conversion.isRetryable();
        }
        return true;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private String serialize(JsonNode payload) throws JsonProcessingException {
        return objectMapper.writeValueAsString(payload);
    }
}

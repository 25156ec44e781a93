package com.rightsparser.controller;

import com.rightsparser.exception.BadRequestException;
import com.rightsparser.model.AuthenticatedKey;
import com.rightsparser.model.dto.JobSubmitResponse;
import com.rightsparser.model.entity.Job;
import com.rightsparser.security.UsageLoggingFilter;
import com.rightsparser.service.JobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Controller for agreement uploads.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ParseController {

    private final JobService jobService;

    /**
     * Accept an agreement for asynchronous extraction.
     *
     * With {@code wait=true} the call holds until the job ends or the sync timeout passes and
     * returns the job record: 200 when the job is terminal, 202 while it is still running.
     */
    @PostMapping(value = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Object>> parse(
            @RequestPart(value = "file", required = false) FilePart file,
            @RequestPart(value = "pdf", required = false) FilePart pdf,
            @RequestParam(value = "webhook_url", required = false) String webhookUrl,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "wait", defaultValue = "false") boolean wait,
            @AuthenticationPrincipal AuthenticatedKey key,
            ServerWebExchange exchange) {

        FilePart upload = file != null ? file : pdf;
        if (upload == null) {
            return Mono.error(new BadRequestException("Multipart field 'file' is required"));
        }

        return jobService.submit(upload, key, webhookUrl, userId)
                .doOnNext(job -> {
                    exchange.getAttributes().put(UsageLoggingFilter.JOB_ID_ATTRIBUTE, job.getId());
                    exchange.getAttributes().put(UsageLoggingFilter.FILE_SIZE_ATTRIBUTE, job.getFileSize());
                })
                .flatMap(job -> wait ? respondWhenDone(job) : Mono.just(accepted(job)));
    }

    private Mono<ResponseEntity<Object>> respondWhenDone(Job job) {
        return jobService.awaitTerminal(job)
                .map(current -> ResponseEntity
                        .status(current.getStatus().isTerminal() ? HttpStatus.OK : HttpStatus.ACCEPTED)
                        .body(jobService.toResponse(current)));
    }

    private ResponseEntity<Object> accepted(Job job) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobSubmitResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .statusUrl("/api/jobs/" + job.getId())
                .createdAt(job.getCreatedAt())
                .build());
    }
}

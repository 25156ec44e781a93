package com.rightsparser.controller;

import com.rightsparser.model.AuthenticatedKey;
import com.rightsparser.model.dto.JobResponse;
import com.rightsparser.model.dto.JobResultResponse;
import com.rightsparser.service.JobService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for job status and results. Jobs are only visible to the key that submitted them.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    @GetMapping
    public Flux<JobResponse> recentJobs(@AuthenticationPrincipal AuthenticatedKey key) {
        return jobService.recentJobs(key);
    }

    @GetMapping("/{jobId}")
    public Mono<JobResponse> getJob(@PathVariable UUID jobId, @AuthenticationPrincipal AuthenticatedKey key) {
        return jobService.getJob(jobId, key);
    }

    @GetMapping("/{jobId}/result")
    public Mono<JobResultResponse> getResult(@PathVariable UUID jobId,
                                             @AuthenticationPrincipal AuthenticatedKey key) {
        return jobService.getResult(jobId, key);
    }
}

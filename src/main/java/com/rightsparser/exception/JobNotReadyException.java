package com.rightsparser.exception;

import com.rightsparser.model.entity.JobStatus;

import java.util.UUID;

/**
 * Exception thrown when a job result is requested before the job completed.
 */
public class JobNotReadyException extends RuntimeException {

    public JobNotReadyException(UUID jobId, JobStatus status) {
        super(String.format("Job '%s' has no result, current status is %s", jobId, status.value()));
    }
}

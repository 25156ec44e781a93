package com.rightsparser.exception;

import com.rightsparser.model.entity.JobStatus;

import java.util.UUID;

/**
 * Exception thrown when a status transition is not allowed from the job's current state,
 * or when the caller no longer holds the job's claim.
 */
public class IllegalJobTransitionException extends RuntimeException {

    public IllegalJobTransitionException(UUID jobId, JobStatus current, JobStatus requested) {
        super(String.format("Job '%s' cannot move from %s to %s", jobId, current, requested));
    }

    public IllegalJobTransitionException(String message) {
        super(message);
    }
}

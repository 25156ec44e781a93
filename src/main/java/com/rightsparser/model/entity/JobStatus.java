package com.rightsparser.model.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job lifecycle states.
 *
 * State transitions:
 * PENDING → PROCESSING → {COMPLETED, FAILED}
 * PROCESSING → PENDING (retryable failure while retry_count < max_retries)
 */
public enum JobStatus {
    /**
     * Waiting to be claimed by a worker
     */
    PENDING,

    /**
     * Claimed by exactly one worker
     */
    PROCESSING,

    /**
     * Result published and recorded
     */
    COMPLETED,

    /**
     * Terminated with error
     */
    FAILED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}

package com.rightsparser.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when an API key cannot be admitted.
 */
@Getter
public class ApiKeyRejectedException extends RuntimeException {

    public enum Reason {
        UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "unauthorized"),
        FORBIDDEN(HttpStatus.FORBIDDEN, "forbidden"),
        RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "rate_limited");

        private final HttpStatus status;
        private final String kind;

        Reason(HttpStatus status, String kind) {
            this.status = status;
            this.kind = kind;
        }

        public HttpStatus getStatus() {
            return status;
        }

        public String getKind() {
            return kind;
        }
    }

    private final Reason reason;

    public ApiKeyRejectedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}

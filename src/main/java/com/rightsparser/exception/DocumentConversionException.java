package com.rightsparser.exception;

import lombok.Getter;

/**
 * Exception thrown when an uploaded document could not be turned into plain text.
 */
@Getter
public class DocumentConversionException extends RuntimeException {

    // false when converting the same file again cannot succeed
    private final boolean retryable;

    public DocumentConversionException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public DocumentConversionException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }
}

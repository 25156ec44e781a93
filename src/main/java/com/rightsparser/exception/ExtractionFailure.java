package com.rightsparser.exception;

/**
 * Exception thrown when the extraction engine did not produce a usable structured object.
 * Raised per attempt and again once the attempt budget is exhausted.
 */
public class ExtractionFailure extends RuntimeException {

    public ExtractionFailure(String message) {
        super(message);
    }

    public ExtractionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}

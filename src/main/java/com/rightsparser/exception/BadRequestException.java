package com.rightsparser.exception;

/**
 * Exception thrown when an upload or request parameter is rejected before a job exists.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}

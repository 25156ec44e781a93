package com.rightsparser.exception;

/**
 * Exception thrown when an artifact could not be encrypted or pushed to content-addressed storage.
 */
public class ContentStoreException extends RuntimeException {

    public ContentStoreException(String message) {
        super(message);
    }

    public ContentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

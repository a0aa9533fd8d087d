package com.vectorstore.dedup.api;

/**
 * Raised when a duplicate analysis cannot be completed. No partial analysis is returned.
 */
public class DeduplicationException extends RuntimeException {

    public DeduplicationException(String message) {
        super(message);
    }

    public DeduplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}

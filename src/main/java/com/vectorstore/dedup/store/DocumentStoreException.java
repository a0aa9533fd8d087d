package com.vectorstore.dedup.store;

/**
 * Raised by a {@link DocumentStore} when the store cannot be reached or rejects a call.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

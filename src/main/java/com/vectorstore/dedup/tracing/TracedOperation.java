package com.vectorstore.dedup.tracing;

/**
 * The deduplication operations that open a span, with their span names.
 */
public enum TracedOperation {
    /** Listing and fetching a record batch from the store. */
    LOAD("dedup.load"),
    /** Clustering a batch into duplicate groups. */
    ANALYZE("dedup.analyze"),
    /** Deleting the non-retained members of duplicate groups. */
    DELETE("dedup.delete");

    private final String spanName;

    TracedOperation(String spanName) {
        this.spanName = spanName;
    }

    public String spanName() {
        return spanName;
    }
}

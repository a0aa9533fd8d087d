package com.vectorstore.dedup.tracing;

import com.vectorstore.dedup.core.model.SimilarityMode;

/**
 * A traced deduplication operation.
 * Ends when a try-with-resources block exits; every span is closed as either succeeded or failed.
 *
 * <pre>
 * try (Span span = tracingService.startSpan(TracedOperation.ANALYZE, "docs")) {
 *     span.recordDocuments(batch.size());
 *     // ... cluster ...
 *     span.recordGroups(groups.size());
 *     span.succeed();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void recordSimilarityMode(SimilarityMode mode);

    /**
     * Number of records loaded or analyzed.
     */
    void recordDocuments(int documents);

    void recordGroups(int groups);

    /**
     * Outcome counts of a deletion run.
     */
    void recordDeletion(int deletedDocuments, int errors);

    void succeed();

    /**
     * Marks the operation failed because of an exception, which is attached to the span.
     */
    void fail(Throwable cause);

    /**
     * Marks the operation failed without an exception, for partial deletions.
     */
    void fail(String description);

    @Override
    void close();
}

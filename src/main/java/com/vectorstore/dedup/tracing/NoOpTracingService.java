package com.vectorstore.dedup.tracing;

import com.vectorstore.dedup.core.model.SimilarityMode;

/**
 * Tracing disabled. Every operation shares one inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startSpan(TracedOperation operation, String namespace) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements Span {
        @Override
        public void recordSimilarityMode(SimilarityMode mode) {
        }

        @Override
        public void recordDocuments(int documents) {
        }

        @Override
        public void recordGroups(int groups) {
        }

        @Override
        public void recordDeletion(int deletedDocuments, int errors) {
        }

        @Override
        public void succeed() {
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void fail(String description) {
        }

        @Override
        public void close() {
        }
    }
}

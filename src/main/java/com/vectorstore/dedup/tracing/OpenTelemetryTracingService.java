package com.vectorstore.dedup.tracing;

import com.vectorstore.dedup.core.model.SimilarityMode;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Span attributes:</p>
 * <ul>
 *   <li>{@code dedup.namespace} - set when the span starts</li>
 *   <li>{@code dedup.similarity_mode} - analysis only</li>
 *   <li>{@code dedup.documents}, {@code dedup.groups}</li>
 *   <li>{@code dedup.deleted_documents}, {@code dedup.errors} - deletion only</li>
 * </ul>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final AttributeKey<String> NAMESPACE = AttributeKey.stringKey("dedup.namespace");
    static final AttributeKey<String> SIMILARITY_MODE = AttributeKey.stringKey("dedup.similarity_mode");
    static final AttributeKey<Long> DOCUMENTS = AttributeKey.longKey("dedup.documents");
    static final AttributeKey<Long> GROUPS = AttributeKey.longKey("dedup.groups");
    static final AttributeKey<Long> DELETED_DOCUMENTS = AttributeKey.longKey("dedup.deleted_documents");
    static final AttributeKey<Long> ERRORS = AttributeKey.longKey("dedup.errors");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(TracedOperation operation, String namespace) {
        SpanBuilder builder = tracer.spanBuilder(operation.spanName());
        builder.setSpanKind(SpanKind.INTERNAL);
        builder.setAttribute(NAMESPACE, namespace);
        return new OTelSpanAdapter(builder.startSpan());
    }

    private static class OTelSpanAdapter implements Span {

        private final io.opentelemetry.api.trace.Span otelSpan;

        OTelSpanAdapter(io.opentelemetry.api.trace.Span otelSpan) {
            this.otelSpan = otelSpan;
        }

        @Override
        public void recordSimilarityMode(SimilarityMode mode) {
            otelSpan.setAttribute(SIMILARITY_MODE, mode.value());
        }

        @Override
        public void recordDocuments(int documents) {
            otelSpan.setAttribute(DOCUMENTS, (long) documents);
        }

        @Override
        public void recordGroups(int groups) {
            otelSpan.setAttribute(GROUPS, (long) groups);
        }

        @Override
        public void recordDeletion(int deletedDocuments, int errors) {
            otelSpan.setAttribute(DELETED_DOCUMENTS, (long) deletedDocuments);
            otelSpan.setAttribute(ERRORS, (long) errors);
        }

        @Override
        public void succeed() {
            otelSpan.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable cause) {
            otelSpan.recordException(cause);
            otelSpan.setStatus(StatusCode.ERROR,
                    cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        }

        @Override
        public void fail(String description) {
            otelSpan.setStatus(StatusCode.ERROR, description);
        }

        @Override
        public void close() {
            otelSpan.end();
        }
    }
}

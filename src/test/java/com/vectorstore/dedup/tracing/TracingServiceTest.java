package com.vectorstore.dedup.tracing;

import com.vectorstore.dedup.core.model.SimilarityMode;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @ParameterizedTest
    @CsvSource({"LOAD, dedup.load", "ANALYZE, dedup.analyze", "DELETE, dedup.delete"})
    @DisplayName("Each traced operation has its span name")
    void spanNames(TracedOperation operation, String spanName) {
        assertEquals(spanName, operation.spanName());
    }

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle works without a tracer")
        void spanLifecycle() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan(TracedOperation.ANALYZE, "docs")) {
                    span.recordSimilarityMode(SimilarityMode.FUZZY);
                    span.recordDocuments(42);
                    span.recordGroups(3);
                    span.recordDeletion(2, 1);
                    span.fail(new IllegalStateException("boom"));
                    span.fail("1 group failed");
                    span.succeed();
                }
            });
        }

        @Test
        @DisplayName("Returns one shared span")
        void sharedSpan() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan(TracedOperation.LOAD, "docs"),
                    noOp.startSpan(TracedOperation.DELETE, "default"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Starts an internal span named after the operation and tagged with the namespace")
        void startSpan() {
            Span span = service.startSpan(TracedOperation.LOAD, "docs");

            assertNotNull(span);
            verify(tracer).spanBuilder("dedup.load");
            verify(builder).setSpanKind(SpanKind.INTERNAL);
            verify(builder).setAttribute(OpenTelemetryTracingService.NAMESPACE, "docs");
            verify(builder).startSpan();
        }

        @Test
        @DisplayName("Analysis attributes use the dedup keys")
        void analysisAttributes() {
            Span span = service.startSpan(TracedOperation.ANALYZE, "docs");
            span.recordSimilarityMode(SimilarityMode.EXACT);
            span.recordDocuments(3);
            span.recordGroups(1);

            verify(otelSpan).setAttribute(OpenTelemetryTracingService.SIMILARITY_MODE, "exact");
            verify(otelSpan).setAttribute(OpenTelemetryTracingService.DOCUMENTS, 3L);
            verify(otelSpan).setAttribute(OpenTelemetryTracingService.GROUPS, 1L);
        }

        @Test
        @DisplayName("Deletion counts are recorded together")
        void deletionAttributes() {
            service.startSpan(TracedOperation.DELETE, "docs").recordDeletion(4, 1);

            verify(otelSpan).setAttribute(OpenTelemetryTracingService.DELETED_DOCUMENTS, 4L);
            verify(otelSpan).setAttribute(OpenTelemetryTracingService.ERRORS, 1L);
        }

        @Test
        @DisplayName("Failing with a cause records it and sets an error status")
        void failWithCause() {
            RuntimeException error = new RuntimeException("store down");

            service.startSpan(TracedOperation.LOAD, "docs").fail(error);

            verify(otelSpan).recordException(error);
            verify(otelSpan).setStatus(StatusCode.ERROR, "store down");
        }

        @Test
        @DisplayName("A cause without a message falls back to its type name")
        void failWithoutMessage() {
            service.startSpan(TracedOperation.LOAD, "docs").fail(new IllegalStateException());

            verify(otelSpan).setStatus(StatusCode.ERROR, "IllegalStateException");
        }

        @Test
        @DisplayName("Failing with a description sets an error status without an exception")
        void failWithDescription() {
            service.startSpan(TracedOperation.DELETE, "docs").fail("1 group failed");

            verify(otelSpan).setStatus(StatusCode.ERROR, "1 group failed");
            verify(otelSpan, never()).recordException(any());
        }

        @Test
        @DisplayName("Closing a successful span sets OK and ends it")
        void succeedAndClose() {
            try (Span span = service.startSpan(TracedOperation.ANALYZE, "docs")) {
                span.succeed();
            }

            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).end();
        }
    }
}

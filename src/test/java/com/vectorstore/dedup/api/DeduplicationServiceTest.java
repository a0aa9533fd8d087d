package com.vectorstore.dedup.api;

import com.vectorstore.dedup.cluster.DuplicationAnalysis;
import com.vectorstore.dedup.core.model.DuplicateGroup;
import com.vectorstore.dedup.core.model.SimilarityMode;
import com.vectorstore.dedup.core.model.VectorRecord;
import com.vectorstore.dedup.deletion.DeletionResult;
import com.vectorstore.dedup.metrics.MicrometerMetricsService;
import com.vectorstore.dedup.store.DocumentStore;
import com.vectorstore.dedup.store.DocumentStoreException;
import com.vectorstore.dedup.store.InMemoryDocumentStore;
import com.vectorstore.dedup.tracing.Span;
import com.vectorstore.dedup.tracing.TracedOperation;
import com.vectorstore.dedup.tracing.TracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("DeduplicationService Tests")
class DeduplicationServiceTest {

    private static final Instant NOW = Instant.parse("2024-07-01T12:00:00Z");

    private InMemoryDocumentStore store;
    private SimpleMeterRegistry registry;
    private DeduplicationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        store.putAll("docs", List.of(
                VectorRecord.of("a", Map.of("name", "Report.pdf")),
                VectorRecord.of("b", Map.of("name", "Report.pdf")),
                VectorRecord.of("c", Map.of("url", "http://s.com/p?ref=1")),
                VectorRecord.of("d", Map.of("url", "http://s.com/p?ref=2")),
                VectorRecord.of("e", Map.of("name", "other.txt"))));

        registry = new SimpleMeterRegistry();
        service = DeduplicationService.builder()
                .metricsService(new MicrometerMetricsService(registry))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .random(new Random(7))
                .build();
    }

    @Nested
    @DisplayName("Analysis")
    class AnalysisTests {

        @Test
        @DisplayName("Analyzes a store namespace")
        void analyzeNamespace() {
            DuplicationAnalysis analysis = service.analyze(store, "docs", DeduplicationOptions.defaults());

            assertEquals("docs", analysis.namespace());
            assertEquals(5, analysis.totalDocuments());
            assertEquals(2, analysis.duplicateGroups().size());
            assertEquals(List.of("a", "b"), analysis.duplicateGroups().get(0).memberIds());
            assertEquals(List.of("c", "d"), analysis.duplicateGroups().get(1).memberIds());
            assertEquals(2, analysis.potentialSavings().documentsToDelete());
            assertEquals(1, analysis.metrics().uniqueDocuments());

            assertEquals(1.0, registry.find("dedup.groups.found").tag("kind", "exact").counter().count());
            assertEquals(1.0, registry.find("dedup.groups.found").tag("kind", "fuzzy").counter().count());
            assertEquals(1, registry.find("dedup.batch.size").summary().count());
        }

        @Test
        @DisplayName("Analyzes an in-memory batch with the default options")
        void analyzeBatch() {
            DuplicationAnalysis analysis = service.analyze(List.of(
                    VectorRecord.of("x", Map.of("title", "same")),
                    VectorRecord.of("y", Map.of("title", "same"))));

            assertEquals("default", analysis.namespace());
            assertTrue(analysis.hasDuplicates());
            assertEquals(85.0, service.getDefaultOptions().getThreshold());
        }

        @Test
        @DisplayName("Empty namespace is reported by name")
        void emptyNamespace() {
            DeduplicationException ex = assertThrows(DeduplicationException.class,
                    () -> service.analyze(store, "empty", DeduplicationOptions.defaults()));
            assertEquals("No documents found in namespace \"empty\"", ex.getMessage());

            DeduplicationException defaultEx = assertThrows(DeduplicationException.class,
                    () -> service.analyze(store, null, DeduplicationOptions.defaults()));
            assertEquals("No documents found in namespace \"default\"", defaultEx.getMessage());
        }

        @Test
        @DisplayName("Store failure fails the analysis")
        void storeFailure() {
            DocumentStore failing = mock(DocumentStore.class);
            when(failing.list(any(), anyInt(), any())).thenThrow(new DocumentStoreException("timeout"));

            DeduplicationException ex = assertThrows(DeduplicationException.class,
                    () -> service.analyze(failing, "docs", DeduplicationOptions.defaults()));
            assertEquals("Cannot list documents: timeout", ex.getMessage());
            assertInstanceOf(DocumentStoreException.class, ex.getCause());
        }

        @Test
        @DisplayName("Empty batch and duplicate ids are rejected")
        void invalidBatches() {
            assertThrows(DeduplicationException.class, () -> service.analyze(List.of()));

            DeduplicationException ex = assertThrows(DeduplicationException.class, () -> service.analyze(List.of(
                    VectorRecord.of("x", Map.of("title", "a")),
                    VectorRecord.of("x", Map.of("title", "b")))));
            assertTrue(ex.getMessage().startsWith("Duplicate analysis failed: "));
        }

        @Test
        @DisplayName("Samples records for preview")
        void sample() {
            List<VectorRecord> sample = service.sample(store, "docs", 3);

            assertEquals(3, sample.size());
            sample.forEach(record -> assertTrue(store.contains("docs", record.id())));
        }
    }

    @Nested
    @DisplayName("Deletion")
    class DeletionTests {

        @Test
        @DisplayName("Confirmed deletion removes non-retained members")
        void confirmedDeletion() {
            List<DuplicateGroup> groups = service.analyze(store, "docs", DeduplicationOptions.defaults())
                    .duplicateGroups();

            DeletionResult result = service.resolveAndDelete(store, "docs", groups, true);

            assertTrue(result.success());
            assertEquals(2, result.deletedGroups());
            assertEquals(2, result.deletedDocuments());
            assertEquals(3, store.size("docs"));
            assertTrue(store.contains("docs", "a"));
            assertFalse(store.contains("docs", "b"));
            assertTrue(store.contains("docs", "c"));
            assertFalse(store.contains("docs", "d"));
            assertEquals(NOW, result.auditTrail().get(0).timestamp());
            assertEquals(2.0, registry.find("dedup.documents.deleted").counter().count());
        }

        @Test
        @DisplayName("Repeating a deletion reports per-group errors")
        void repeatedDeletion() {
            List<DuplicateGroup> groups = service.analyze(store, "docs", DeduplicationOptions.defaults())
                    .duplicateGroups();
            service.resolveAndDelete(store, "docs", groups, true);

            DeletionResult again = service.resolveAndDelete(store, "docs", groups, true);

            assertFalse(again.success());
            assertEquals(0, again.deletedDocuments());
            assertEquals(2, again.errors().size());
            assertEquals("Failed to delete group group-1: Delete operation failed", again.errors().get(0));
            assertEquals(3, store.size("docs"));
            assertEquals(2.0, registry.find("dedup.group.failures").counter().count());
        }

        @Test
        @DisplayName("Unconfirmed deletion leaves the store untouched")
        void unconfirmedDeletion() {
            List<DuplicateGroup> groups = service.analyze(store, "docs", DeduplicationOptions.defaults())
                    .duplicateGroups();

            DeletionResult result = service.resolveAndDelete(store, "docs", groups, false);

            assertFalse(result.success());
            assertEquals(List.of("Deletion confirmation required"), result.errors());
            assertEquals(5, store.size("docs"));
        }

        @Test
        @DisplayName("Groups resubmitted as JSON can be deleted")
        void resubmittedGroups() {
            DuplicateGroupCodec codec = new DuplicateGroupCodec();
            String reviewed = codec.writeGroupsAsString(
                    service.analyze(store, "docs", DeduplicationOptions.defaults()).duplicateGroups());

            DeletionResult result = service.resolveAndDelete(store, "docs", codec.readGroups(reviewed), true);

            assertTrue(result.success());
            assertEquals(3, store.size("docs"));
        }
    }

    @Nested
    @DisplayName("Tracing")
    class TracingTests {

        private TracingService tracingService;
        private Span span;
        private DeduplicationService traced;

        @BeforeEach
        void setUp() {
            tracingService = mock(TracingService.class);
            span = mock(Span.class);
            when(tracingService.startSpan(any(TracedOperation.class), anyString())).thenReturn(span);
            traced = DeduplicationService.builder()
                    .tracingService(tracingService)
                    .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                    .build();
        }

        @Test
        @DisplayName("Namespace analysis opens load and analyze spans tagged with the namespace")
        void analysisSpans() {
            traced.analyze(store, "docs", DeduplicationOptions.defaults());

            verify(tracingService).startSpan(TracedOperation.LOAD, "docs");
            verify(tracingService).startSpan(TracedOperation.ANALYZE, "docs");
            verify(span).recordSimilarityMode(SimilarityMode.FUZZY);
            verify(span, times(2)).recordDocuments(5);
            verify(span).recordGroups(2);
            verify(span, times(2)).succeed();
            verify(span, times(2)).close();
        }

        @Test
        @DisplayName("Batch analysis is traced under the default namespace")
        void batchAnalysisSpan() {
            traced.analyze(List.of(
                    VectorRecord.of("x", Map.of("name", "a.txt")),
                    VectorRecord.of("y", Map.of("name", "a.txt"))));

            verify(tracingService).startSpan(TracedOperation.ANALYZE, "default");
            verify(span).recordGroups(1);
        }

        @Test
        @DisplayName("A store failure fails the load span")
        void loadFailure() {
            DocumentStore failing = mock(DocumentStore.class);
            DocumentStoreException error = new DocumentStoreException("store down");
            when(failing.list(anyString(), anyInt(), any())).thenThrow(error);

            assertThrows(DeduplicationException.class,
                    () -> traced.analyze(failing, "docs", DeduplicationOptions.defaults()));

            verify(tracingService).startSpan(TracedOperation.LOAD, "docs");
            verify(span).fail(error);
            verify(span, never()).succeed();
            verify(span).close();
        }

        @Test
        @DisplayName("Deletion opens a delete span with the deletion counts")
        void deletionSpan() {
            List<DuplicateGroup> groups = service.analyze(store, "docs", DeduplicationOptions.defaults())
                    .duplicateGroups();

            traced.resolveAndDelete(store, "docs", groups, true);

            verify(tracingService).startSpan(TracedOperation.DELETE, "docs");
            verify(span).recordGroups(2);
            verify(span).recordDeletion(2, 0);
            verify(span).succeed();
        }

        @Test
        @DisplayName("A deletion with group errors fails the span with the summary")
        void failedDeletionSpan() {
            List<DuplicateGroup> groups = service.analyze(store, "docs", DeduplicationOptions.defaults())
                    .duplicateGroups();
            service.resolveAndDelete(store, "docs", groups, true);

            DeletionResult again = traced.resolveAndDelete(store, "docs", groups, true);

            verify(span).recordDeletion(0, 2);
            verify(span).fail(again.summary());
            verify(span, never()).succeed();
        }
    }
}

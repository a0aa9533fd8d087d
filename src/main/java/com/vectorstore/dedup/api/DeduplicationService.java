package com.vectorstore.dedup.api;

import com.vectorstore.dedup.cluster.DuplicateClusteringEngine;
import com.vectorstore.dedup.cluster.DuplicationAnalysis;
import com.vectorstore.dedup.core.model.DuplicateGroup;
import com.vectorstore.dedup.core.model.VectorRecord;
import com.vectorstore.dedup.deletion.DeleteFunction;
import com.vectorstore.dedup.deletion.DeletionExecutor;
import com.vectorstore.dedup.deletion.DeletionResult;
import com.vectorstore.dedup.logging.LogContext;
import com.vectorstore.dedup.metrics.MetricsService;
import com.vectorstore.dedup.metrics.NoOpMetricsService;
import com.vectorstore.dedup.policy.ResolutionPolicy;
import com.vectorstore.dedup.similarity.FieldComparator;
import com.vectorstore.dedup.similarity.RecordSimilarityScorer;
import com.vectorstore.dedup.store.DocumentLoader;
import com.vectorstore.dedup.store.DocumentStore;
import com.vectorstore.dedup.store.DocumentStoreException;
import com.vectorstore.dedup.store.Namespaces;
import com.vectorstore.dedup.tracing.NoOpTracingService;
import com.vectorstore.dedup.tracing.Span;
import com.vectorstore.dedup.tracing.TracedOperation;
import com.vectorstore.dedup.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;

/**
 * Main entry point for metadata deduplication.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * DeduplicationService service = DeduplicationService.builder()
 *     .metricsService(new MicrometerMetricsService(registry))
 *     .build();
 *
 * DuplicationAnalysis analysis = service.analyze(store, "docs", DeduplicationOptions.defaults());
 * // ... review analysis.duplicateGroups() ...
 * DeletionResult result = service.resolveAndDelete(store, "docs", analysis.duplicateGroups(), true);
 * </pre>
 *
 * <p>The service holds no per-call state; one instance can be shared across threads.</p>
 */
public class DeduplicationService {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationService.class);

    private final DuplicateClusteringEngine clusteringEngine;
    private final DeletionExecutor deletionExecutor;
    private final DocumentLoader documentLoader;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final DeduplicationOptions defaultOptions;

    private DeduplicationService(Builder builder) {
        ResolutionPolicy policy = new ResolutionPolicy();
        RecordSimilarityScorer scorer = new RecordSimilarityScorer(new FieldComparator());
        this.clusteringEngine = new DuplicateClusteringEngine(scorer, policy);
        this.deletionExecutor = new DeletionExecutor(policy, builder.clock);
        this.documentLoader = new DocumentLoader(builder.random);
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.defaultOptions = builder.defaultOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public DeduplicationOptions getDefaultOptions() {
        return defaultOptions;
    }

    // ========== Analysis ==========

    /**
     * Analyzes an already materialized batch with the default options.
     */
    public DuplicationAnalysis analyze(List<VectorRecord> records) {
        return analyze(records, defaultOptions);
    }

    /**
     * Analyzes an already materialized batch. Pure: performs no I/O.
     *
     * @throws DeduplicationException if the batch is empty or invalid
     */
    public DuplicationAnalysis analyze(List<VectorRecord> records, DeduplicationOptions options) {
        if (records == null || records.isEmpty()) {
            throw new DeduplicationException("No documents supplied for analysis");
        }
        try (LogContext ctx = LogContext.forAnalysis(LogContext.generateCorrelationId(),
                Namespaces.displayName(Namespaces.DEFAULT))) {
            return runAnalysis(Namespaces.DEFAULT, records, options);
        }
    }

    /**
     * Loads up to {@code maxDocuments} records from a namespace and analyzes them.
     *
     * @throws DeduplicationException if the namespace is empty or the store fails
     */
    public DuplicationAnalysis analyze(DocumentStore store, String namespace, DeduplicationOptions options) {
        String ns = Namespaces.normalize(namespace);
        try (LogContext ctx = LogContext.forAnalysis(LogContext.generateCorrelationId(),
                Namespaces.displayName(ns))) {
            List<VectorRecord> records = load(store, ns, options);
            if (records.isEmpty()) {
                throw new DeduplicationException(
                        "No documents found in namespace \"" + Namespaces.displayName(ns) + "\"");
            }
            return runAnalysis(ns, records, options);
        }
    }

    /**
     * Loads a random sample of records from a namespace, for previewing attributes.
     *
     * @throws DeduplicationException if the store fails
     */
    public List<VectorRecord> sample(DocumentStore store, String namespace, int size) {
        String ns = Namespaces.normalize(namespace);
        try {
            return documentLoader.load(store, ns, size, true);
        } catch (DocumentStoreException e) {
            log.error("dedup.sample.failed namespace={} error={}", Namespaces.displayName(ns), e.getMessage());
            throw new DeduplicationException("Cannot list documents: " + e.getMessage(), e);
        }
    }

    private List<VectorRecord> load(DocumentStore store, String namespace, DeduplicationOptions options) {
        try (Span span = tracingService.startSpan(TracedOperation.LOAD, Namespaces.displayName(namespace))) {
            try {
                List<VectorRecord> records = documentLoader.load(store, namespace, options.getMaxDocuments(), false);
                span.recordDocuments(records.size());
                span.succeed();
                return records;
            } catch (DocumentStoreException e) {
                span.fail(e);
                log.error("dedup.load.failed namespace={} error={}", Namespaces.displayName(namespace), e.getMessage());
                throw new DeduplicationException("Cannot list documents: " + e.getMessage(), e);
            }
        }
    }

    private DuplicationAnalysis runAnalysis(String namespace, List<VectorRecord> records,
                                            DeduplicationOptions options) {
        try (Span span = tracingService.startSpan(TracedOperation.ANALYZE, Namespaces.displayName(namespace))) {
            span.recordSimilarityMode(options.getSimilarityMode());
            log.info("dedup.analysis.started documents={} options={}", records.size(), options);
            try {
                DuplicationAnalysis analysis = clusteringEngine.analyze(namespace, records, options);

                metricsService.recordBatchSize(analysis.totalDocuments());
                metricsService.recordAnalysisDuration(options.getSimilarityMode(),
                        Duration.ofMillis(analysis.processingTimeMillis()));
                for (DuplicateGroup group : analysis.duplicateGroups()) {
                    metricsService.recordGroupFound(group.isExactMatch(), group.similarityScore());
                }

                span.recordDocuments(analysis.totalDocuments());
                span.recordGroups(analysis.duplicateGroups().size());
                span.succeed();
                return analysis;
            } catch (IllegalArgumentException e) {
                span.fail(e);
                throw new DeduplicationException("Duplicate analysis failed: " + e.getMessage(), e);
            }
        }
    }

    // ========== Deletion ==========

    /**
     * Deletes the non-retained members of each group from a store namespace.
     */
    public DeletionResult resolveAndDelete(DocumentStore store, String namespace,
                                           List<DuplicateGroup> groups, boolean confirmed) {
        String ns = Namespaces.normalize(namespace);
        try (LogContext ctx = LogContext.forDeletion(LogContext.generateCorrelationId(),
                Namespaces.displayName(ns))) {
            return runDeletion(ns, groups, ids -> store.deleteMany(ns, ids), confirmed);
        }
    }

    /**
     * Deletes the non-retained members of each group through an arbitrary batch delete.
     * Refuses to run, deleting nothing, unless {@code confirmed} is true and every group has members.
     */
    public DeletionResult resolveAndDelete(List<DuplicateGroup> groups, DeleteFunction deleter, boolean confirmed) {
        try (LogContext ctx = LogContext.forDeletion(LogContext.generateCorrelationId(),
                Namespaces.displayName(Namespaces.DEFAULT))) {
            return runDeletion(Namespaces.DEFAULT, groups, deleter, confirmed);
        }
    }

    private DeletionResult runDeletion(String namespace, List<DuplicateGroup> groups,
                                       DeleteFunction deleter, boolean confirmed) {
        try (Span span = tracingService.startSpan(TracedOperation.DELETE, Namespaces.displayName(namespace))) {
            span.recordGroups(groups != null ? groups.size() : 0);
            DeletionResult result = deletionExecutor.execute(groups, deleter, confirmed);

            metricsService.incrementDocumentsDeleted(result.deletedDocuments());
            metricsService.incrementGroupFailures(result.groupErrors().size());

            span.recordDeletion(result.deletedDocuments(), result.errors().size());
            if (result.success()) {
                span.succeed();
            } else {
                span.fail(result.summary());
            }
            return result;
        }
    }

    public static class Builder {
        private MetricsService metricsService;
        private TracingService tracingService;
        private DeduplicationOptions defaultOptions = DeduplicationOptions.defaults();
        private Clock clock = Clock.systemUTC();
        private Random random = new Random();

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder defaultOptions(DeduplicationOptions defaultOptions) {
            if (defaultOptions == null) {
                throw new IllegalArgumentException("defaultOptions is required");
            }
            this.defaultOptions = defaultOptions;
            return this;
        }

        /**
         * Clock used to timestamp audit entries.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Source of randomness for sampled loads.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public DeduplicationService build() {
            return new DeduplicationService(this);
        }
    }
}

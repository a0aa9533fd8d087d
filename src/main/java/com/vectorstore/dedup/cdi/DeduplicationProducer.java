package com.vectorstore.dedup.cdi;

import com.vectorstore.dedup.api.DeduplicationOptions;
import com.vectorstore.dedup.api.DeduplicationService;
import com.vectorstore.dedup.api.DuplicateGroupCodec;
import com.vectorstore.dedup.core.model.ResolutionStrategy;
import com.vectorstore.dedup.core.model.SimilarityMode;
import com.vectorstore.dedup.metrics.MicrometerMetricsService;
import com.vectorstore.dedup.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * CDI producer that wires the deduplication library from MicroProfile Config properties.
 *
 * <pre>
 * metadata-dedup:
 *   similarity-mode: fuzzy
 *   threshold: 85
 *   strategy: keep-first
 *   max-documents: 1000
 *   exclude-keys: createdBy,ingestRunId
 *   metrics:
 *     enabled: true
 * </pre>
 *
 * <p>Metrics and tracing are wired only when a {@link MeterRegistry} or {@link Tracer}
 * bean is resolvable in the container.</p>
 */
@ApplicationScoped
public class DeduplicationProducer {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationProducer.class);

    // ── Analysis defaults ─────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metadata-dedup.similarity-mode", defaultValue = "fuzzy")
    String similarityMode;

    @Inject
    @ConfigProperty(name = "metadata-dedup.threshold", defaultValue = "85")
    double threshold;

    @Inject
    @ConfigProperty(name = "metadata-dedup.strategy", defaultValue = "keep-first")
    String strategy;

    @Inject
    @ConfigProperty(name = "metadata-dedup.max-documents", defaultValue = "1000")
    int maxDocuments;

    @Inject
    @ConfigProperty(name = "metadata-dedup.include-keys")
    Optional<List<String>> includeKeys;

    @Inject
    @ConfigProperty(name = "metadata-dedup.exclude-keys")
    Optional<List<String>> excludeKeys;

    // ── Observability ─────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "metadata-dedup.metrics.enabled", defaultValue = "true")
    boolean metricsEnabled;

    @Inject
    @ConfigProperty(name = "metadata-dedup.tracing.enabled", defaultValue = "true")
    boolean tracingEnabled;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public DeduplicationOptions deduplicationOptions() {
        DeduplicationOptions.Builder builder = DeduplicationOptions.builder()
                .similarityMode(SimilarityMode.fromValue(similarityMode))
                .threshold(threshold)
                .strategy(ResolutionStrategy.fromValue(strategy))
                .maxDocuments(maxDocuments);
        includeKeys.ifPresent(builder::includeKeys);
        excludeKeys.ifPresent(builder::excludeKeys);

        DeduplicationOptions options = builder.build();
        log.info("Producing DeduplicationOptions: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public DeduplicationService deduplicationService(DeduplicationOptions options) {
        DeduplicationService.Builder builder = DeduplicationService.builder()
                .defaultOptions(options);

        if (metricsEnabled && meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Deduplication metrics enabled");
        } else {
            log.info("Deduplication metrics disabled");
        }

        if (tracingEnabled && tracer.isResolvable()) {
            builder.tracingService(new OpenTelemetryTracingService(tracer.get()));
            log.info("Deduplication tracing enabled");
        }

        return builder.build();
    }

    @Produces
    @ApplicationScoped
    public DuplicateGroupCodec duplicateGroupCodec() {
        return new DuplicateGroupCodec();
    }
}

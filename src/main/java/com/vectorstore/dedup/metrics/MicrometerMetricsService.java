package com.vectorstore.dedup.metrics;

import com.vectorstore.dedup.core.model.SimilarityMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.analysis.duration} - Timer (tag: mode)</li>
 *   <li>{@code dedup.batch.size} - DistributionSummary</li>
 *   <li>{@code dedup.groups.found} - Counter (tag: kind = exact|fuzzy)</li>
 *   <li>{@code dedup.similarity.score} - DistributionSummary of group scores</li>
 *   <li>{@code dedup.documents.deleted} - Counter</li>
 *   <li>{@code dedup.group.failures} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final DistributionSummary similarityScoreSummary;
    private final Counter exactGroupCounter;
    private final Counter fuzzyGroupCounter;
    private final Counter documentsDeletedCounter;
    private final Counter groupFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("dedup.batch.size")
                .description("Number of records per analyzed batch")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("dedup.similarity.score")
                .description("Distribution of duplicate group similarity scores")
                .register(registry);
        this.exactGroupCounter = groupCounter("exact");
        this.fuzzyGroupCounter = groupCounter("fuzzy");
        this.documentsDeletedCounter = Counter.builder("dedup.documents.deleted")
                .description("Number of duplicate records deleted")
                .register(registry);
        this.groupFailureCounter = Counter.builder("dedup.group.failures")
                .description("Number of duplicate groups whose deletion failed")
                .register(registry);
    }

    @Override
    public void recordAnalysisDuration(SimilarityMode mode, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(mode.value(), k ->
                Timer.builder("dedup.analysis.duration")
                        .description("Duration of duplicate analyses")
                        .tag("mode", mode.value())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordGroupFound(boolean exact, double similarityScore) {
        (exact ? exactGroupCounter : fuzzyGroupCounter).increment();
        similarityScoreSummary.record(similarityScore);
    }

    @Override
    public void incrementDocumentsDeleted(int count) {
        documentsDeletedCounter.increment(count);
    }

    @Override
    public void incrementGroupFailures(int count) {
        groupFailureCounter.increment(count);
    }

    private Counter groupCounter(String kind) {
        return Counter.builder("dedup.groups.found")
                .description("Number of duplicate groups found")
                .tag("kind", kind)
                .register(registry);
    }
}

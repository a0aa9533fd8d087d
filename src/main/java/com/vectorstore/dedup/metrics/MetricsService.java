package com.vectorstore.dedup.metrics;

import com.vectorstore.dedup.core.model.SimilarityMode;

import java.time.Duration;

/**
 * Interface for recording deduplication metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordAnalysisDuration(SimilarityMode mode, Duration duration);

    void recordBatchSize(int size);

    void recordGroupFound(boolean exact, double similarityScore);

    void incrementDocumentsDeleted(int count);

    void incrementGroupFailures(int count);
}

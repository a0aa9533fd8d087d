package com.vectorstore.dedup.metrics;

import com.vectorstore.dedup.core.model.SimilarityMode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAnalysisDuration(SimilarityMode mode, Duration duration) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordGroupFound(boolean exact, double similarityScore) {
    }

    @Override
    public void incrementDocumentsDeleted(int count) {
    }

    @Override
    public void incrementGroupFailures(int count) {
    }
}

package com.vectorstore.dedup.api;

import com.vectorstore.dedup.core.model.ResolutionStrategy;
import com.vectorstore.dedup.core.model.SimilarityMode;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Options for a duplicate analysis.
 * Configures the similarity mode, the grouping threshold, key filters, the batch cap
 * and the resolution strategy.
 */
public class DeduplicationOptions {

    private static final double DEFAULT_THRESHOLD = 85.0;
    private static final int DEFAULT_MAX_DOCUMENTS = 1_000;

    private final SimilarityMode similarityMode;
    private final double threshold;
    private final Set<String> includeKeys;
    private final Set<String> excludeKeys;
    private final int maxDocuments;
    private final ResolutionStrategy strategy;

    private DeduplicationOptions(Builder builder) {
        this.similarityMode = builder.similarityMode;
        this.threshold = builder.threshold;
        this.includeKeys = builder.includeKeys;
        this.excludeKeys = builder.excludeKeys;
        this.maxDocuments = builder.maxDocuments;
        this.strategy = builder.strategy;
    }

    public SimilarityMode getSimilarityMode() {
        return similarityMode;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * Keys to compare; when present, all other keys are ignored.
     */
    public Optional<Set<String>> getIncludeKeys() {
        return Optional.ofNullable(includeKeys);
    }

    /**
     * Keys never compared.
     */
    public Optional<Set<String>> getExcludeKeys() {
        return Optional.ofNullable(excludeKeys);
    }

    public int getMaxDocuments() {
        return maxDocuments;
    }

    public ResolutionStrategy getStrategy() {
        return strategy;
    }

    /**
     * Creates default options: fuzzy matching, threshold 85, keep-first.
     */
    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that only group byte-identical attribute maps.
     */
    public static DeduplicationOptions exact() {
        return builder().similarityMode(SimilarityMode.EXACT).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with these options.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .similarityMode(similarityMode)
                .threshold(threshold)
                .maxDocuments(maxDocuments)
                .strategy(strategy);
        builder.includeKeys = includeKeys;
        builder.excludeKeys = excludeKeys;
        return builder;
    }

    public static class Builder {
        private SimilarityMode similarityMode = SimilarityMode.FUZZY;
        private double threshold = DEFAULT_THRESHOLD;
        private Set<String> includeKeys;
        private Set<String> excludeKeys;
        private int maxDocuments = DEFAULT_MAX_DOCUMENTS;
        private ResolutionStrategy strategy = ResolutionStrategy.KEEP_FIRST;

        public Builder similarityMode(SimilarityMode similarityMode) {
            if (similarityMode == null) {
                throw new IllegalArgumentException("similarityMode is required");
            }
            this.similarityMode = similarityMode;
            return this;
        }

        public Builder threshold(double threshold) {
            if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 100.0) {
                throw new IllegalArgumentException("threshold must be between 0 and 100");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder includeKeys(Collection<String> includeKeys) {
            this.includeKeys = copyKeys(includeKeys);
            return this;
        }

        public Builder excludeKeys(Collection<String> excludeKeys) {
            this.excludeKeys = copyKeys(excludeKeys);
            return this;
        }

        public Builder maxDocuments(int maxDocuments) {
            if (maxDocuments <= 0) {
                throw new IllegalArgumentException("maxDocuments must be positive");
            }
            this.maxDocuments = maxDocuments;
            return this;
        }

        public Builder strategy(ResolutionStrategy strategy) {
            if (strategy == null) {
                throw new IllegalArgumentException("strategy is required");
            }
            this.strategy = strategy;
            return this;
        }

        public DeduplicationOptions build() {
            return new DeduplicationOptions(this);
        }

        private static Set<String> copyKeys(Collection<String> keys) {
            if (keys == null) {
                return null;
            }
            Set<String> copy = new LinkedHashSet<>();
            for (String key : keys) {
                if (key != null && !key.isBlank()) {
                    copy.add(key.trim());
                }
            }
            return Set.copyOf(copy);
        }
    }

    @Override
    public String toString() {
        return "DeduplicationOptions{" +
                "similarityMode=" + similarityMode.value() +
                ", threshold=" + threshold +
                ", includeKeys=" + includeKeys +
                ", excludeKeys=" + excludeKeys +
                ", maxDocuments=" + maxDocuments +
                ", strategy=" + strategy.value() +
                '}';
    }
}

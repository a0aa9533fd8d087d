package com.vectorstore.dedup.similarity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of comparing two attribute maps.
 *
 * @param score          aggregate similarity between 0 and 100
 * @param matchingFields fields scoring above {@link FieldComparator#MATCH_THRESHOLD}
 * @param reason         human-readable explanation
 */
public record SimilarityResult(double score, Set<String> matchingFields, String reason) {

    public SimilarityResult {
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("score must be between 0 and 100, got " + score);
        }
        matchingFields = matchingFields != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(matchingFields))
                : Set.of();
    }

    public static SimilarityResult none(String reason) {
        return new SimilarityResult(0.0, Set.of(), reason);
    }
}

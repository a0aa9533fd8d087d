package com.vectorstore.dedup.similarity;

import com.vectorstore.dedup.api.DeduplicationOptions;
import com.vectorstore.dedup.core.model.AttributeValue;
import com.vectorstore.dedup.core.model.SimilarityMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregates per-field scores of two attribute maps into one similarity result.
 *
 * <p>Byte-identical maps always score 100. In exact mode anything else scores 0.
 * Otherwise every comparable key (the union of both maps' keys, narrowed by the
 * include/exclude lists) is scored with the {@link FieldComparator} and the
 * aggregate is the mean, rounded to two decimals.</p>
 */
public class RecordSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(RecordSimilarityScorer.class);

    private final FieldComparator fieldComparator;

    public RecordSimilarityScorer() {
        this(new FieldComparator());
    }

    public RecordSimilarityScorer(FieldComparator fieldComparator) {
        this.fieldComparator = fieldComparator;
    }

    public SimilarityResult score(Map<String, AttributeValue> attributes1,
                                  Map<String, AttributeValue> attributes2,
                                  DeduplicationOptions options) {
        if (CanonicalJson.serialize(attributes1).equals(CanonicalJson.serialize(attributes2))) {
            return new SimilarityResult(100.0, attributes1.keySet(), "Exact metadata match");
        }

        if (options.getSimilarityMode() == SimilarityMode.EXACT) {
            return SimilarityResult.none("No exact match");
        }

        List<String> keysToCompare = comparableKeys(attributes1, attributes2, options);
        if (keysToCompare.isEmpty()) {
            return SimilarityResult.none("No comparable fields");
        }

        double totalScore = 0.0;
        Set<String> matchingFields = new LinkedHashSet<>();
        for (String key : keysToCompare) {
            double fieldScore = fieldComparator.compare(key, attributes1.get(key), attributes2.get(key));
            totalScore += fieldScore;
            if (fieldScore > FieldComparator.MATCH_THRESHOLD) {
                matchingFields.add(key);
            }
        }

        double averageScore = totalScore / keysToCompare.size();
        double rounded = Math.round(averageScore * 100.0) / 100.0;

        log.debug("similarity.scored fields={} matching={} score={}",
                keysToCompare.size(), matchingFields.size(), rounded);

        return new SimilarityResult(rounded, matchingFields, describe(averageScore, matchingFields));
    }

    private List<String> comparableKeys(Map<String, AttributeValue> attributes1,
                                        Map<String, AttributeValue> attributes2,
                                        DeduplicationOptions options) {
        Set<String> allKeys = new LinkedHashSet<>(attributes1.keySet());
        allKeys.addAll(attributes2.keySet());

        List<String> keys = new ArrayList<>();
        for (String key : allKeys) {
            if (options.getIncludeKeys().isPresent() && !options.getIncludeKeys().get().contains(key)) {
                continue;
            }
            if (options.getExcludeKeys().isPresent() && options.getExcludeKeys().get().contains(key)) {
                continue;
            }
            keys.add(key);
        }
        return keys;
    }

    static String describe(double score, Set<String> matchingFields) {
        if (score >= 95) {
            return "Near-exact match on " + matchingFields.size() + " fields";
        }
        if (score >= 85) {
            return "High similarity on fields: " + String.join(", ",
                    matchingFields.stream().limit(3).toList());
        }
        if (score >= 70) {
            return "Moderate similarity on " + matchingFields.size() + " fields";
        }
        return "Low similarity detected";
    }
}

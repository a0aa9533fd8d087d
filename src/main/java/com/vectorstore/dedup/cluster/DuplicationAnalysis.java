package com.vectorstore.dedup.cluster;

import com.vectorstore.dedup.core.model.DuplicateGroup;

import java.util.List;

/**
 * Result of a duplicate analysis over one record batch.
 *
 * @param namespace            display name of the analyzed namespace
 * @param totalDocuments       number of records analyzed
 * @param duplicateGroups      groups ordered by similarity score, highest first
 * @param potentialSavings     what deleting the duplicates would save
 * @param processingTimeMillis wall-clock time spent clustering
 * @param metrics              exact/fuzzy/unique counts
 */
public record DuplicationAnalysis(
        String namespace,
        int totalDocuments,
        List<DuplicateGroup> duplicateGroups,
        PotentialSavings potentialSavings,
        long processingTimeMillis,
        AnalysisMetrics metrics
) {
    public DuplicationAnalysis {
        duplicateGroups = duplicateGroups != null ? List.copyOf(duplicateGroups) : List.of();
    }

    public boolean hasDuplicates() {
        return !duplicateGroups.isEmpty();
    }

    public String summary() {
        return "Found " + duplicateGroups.size() + " duplicate groups in " + totalDocuments + " documents";
    }
}

package com.vectorstore.dedup.cluster;

/**
 * Counts describing the groups found by an analysis.
 *
 * @param exactMatches    groups whose score is at least 99.9
 * @param fuzzyMatches    the remaining groups
 * @param uniqueDocuments records that belong to no group
 */
public record AnalysisMetrics(int exactMatches, int fuzzyMatches, int uniqueDocuments) {
}

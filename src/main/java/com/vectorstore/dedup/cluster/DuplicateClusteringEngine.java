package com.vectorstore.dedup.cluster;

import com.vectorstore.dedup.api.DeduplicationOptions;
import com.vectorstore.dedup.core.model.DuplicateGroup;
import com.vectorstore.dedup.core.model.GroupMember;
import com.vectorstore.dedup.core.model.RecommendedAction;
import com.vectorstore.dedup.core.model.VectorRecord;
import com.vectorstore.dedup.policy.ResolutionPolicy;
import com.vectorstore.dedup.similarity.RecordSimilarityScorer;
import com.vectorstore.dedup.similarity.SimilarityResult;
import com.vectorstore.dedup.store.Namespaces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Partitions a record batch into duplicate groups.
 *
 * <p>Greedy single-link clustering in input order: each unprocessed record anchors a
 * candidate group, and every later unprocessed record scoring at least the threshold
 * <em>against the anchor</em> joins it. Membership is not transitive: two members may
 * each match the anchor without matching each other. The result is deterministic for
 * a given input order.</p>
 *
 * <p>Holds no state between calls.</p>
 */
public class DuplicateClusteringEngine {
    private static final Logger log = LoggerFactory.getLogger(DuplicateClusteringEngine.class);

    private final RecordSimilarityScorer scorer;
    private final ResolutionPolicy policy;

    public DuplicateClusteringEngine() {
        this(new RecordSimilarityScorer(), new ResolutionPolicy());
    }

    public DuplicateClusteringEngine(RecordSimilarityScorer scorer, ResolutionPolicy policy) {
        this.scorer = scorer;
        this.policy = policy;
    }

    /**
     * Analyzes a batch from the default namespace.
     */
    public DuplicationAnalysis analyze(List<VectorRecord> records, DeduplicationOptions options) {
        return analyze(Namespaces.DEFAULT, records, options);
    }

    /**
     * Clusters a batch and computes the aggregate metrics.
     * Only the first {@code maxDocuments} records are considered.
     *
     * @throws IllegalArgumentException if the batch is empty or contains duplicate ids
     */
    public DuplicationAnalysis analyze(String namespace, List<VectorRecord> records,
                                       DeduplicationOptions options) {
        long start = System.nanoTime();
        List<VectorRecord> batch = capBatch(records, options);

        List<DuplicateGroup> groups = findGroups(batch, options);

        int exactMatches = 0;
        int documentsInGroups = 0;
        int documentsToDelete = 0;
        for (DuplicateGroup group : groups) {
            if (group.isExactMatch()) {
                exactMatches++;
            }
            documentsInGroups += group.size();
            documentsToDelete += group.size() - 1;
        }

        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;
        DuplicationAnalysis analysis = new DuplicationAnalysis(
                Namespaces.displayName(namespace),
                batch.size(),
                groups,
                PotentialSavings.forDocuments(documentsToDelete),
                elapsedMillis,
                new AnalysisMetrics(exactMatches, groups.size() - exactMatches, batch.size() - documentsInGroups)
        );

        log.info("dedup.analysis.completed namespace={} documents={} groups={} toDelete={} durationMs={}",
                analysis.namespace(), batch.size(), groups.size(), documentsToDelete, elapsedMillis);
        return analysis;
    }

    /**
     * Finds duplicate groups, ordered by similarity score descending.
     * Groups are numbered in discovery order and always have at least two members.
     */
    public List<DuplicateGroup> findGroups(List<VectorRecord> records, DeduplicationOptions options) {
        requireUniqueIds(records);

        List<DuplicateGroup> groups = new ArrayList<>();
        boolean[] processed = new boolean[records.size()];

        for (int i = 0; i < records.size(); i++) {
            if (processed[i]) {
                continue;
            }
            VectorRecord anchor = records.get(i);
            processed[i] = true;

            List<VectorRecord> candidates = new ArrayList<>();
            candidates.add(anchor);

            for (int j = i + 1; j < records.size(); j++) {
                if (processed[j]) {
                    continue;
                }
                SimilarityResult similarity = scorer.score(
                        anchor.attributes(), records.get(j).attributes(), options);
                if (similarity.score() >= options.getThreshold()) {
                    candidates.add(records.get(j));
                    processed[j] = true;
                }
            }

            if (candidates.size() > 1) {
                groups.add(toGroup("group-" + (groups.size() + 1), candidates, options));
            }
        }

        groups.sort(Comparator.comparingDouble(DuplicateGroup::similarityScore).reversed());
        return groups;
    }

    private DuplicateGroup toGroup(String groupId, List<VectorRecord> candidates, DeduplicationOptions options) {
        SimilarityResult pairScore = scorer.score(
                candidates.get(0).attributes(), candidates.get(1).attributes(), options);

        List<GroupMember> members = candidates.stream().map(GroupMember::from).toList();
        RecommendedAction action = policy.decide(options.getStrategy(), members);

        log.debug("dedup.group.formed groupId={} members={} score={} action={}",
                groupId, members.size(), pairScore.score(), action.value());

        return new DuplicateGroup(groupId, pairScore.score(), members, action,
                pairScore.reason(), pairScore.matchingFields());
    }

    private List<VectorRecord> capBatch(List<VectorRecord> records, DeduplicationOptions options) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("Record batch must not be empty");
        }
        if (records.size() > options.getMaxDocuments()) {
            log.warn("dedup.batch.truncated size={} maxDocuments={}", records.size(), options.getMaxDocuments());
            return records.subList(0, options.getMaxDocuments());
        }
        return records;
    }

    private static void requireUniqueIds(List<VectorRecord> records) {
        Set<String> seen = new HashSet<>();
        for (VectorRecord record : records) {
            if (!seen.add(record.id())) {
                throw new IllegalArgumentException("Duplicate record id in batch: " + record.id());
            }
        }
    }
}

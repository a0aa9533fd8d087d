package com.vectorstore.dedup.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A cluster of records judged to be duplicates of one another.
 * Groups produced by analysis always hold at least two members; groups resubmitted
 * for deletion are validated by the deletion executor instead.
 *
 * @param id                group identifier, unique within one analysis
 * @param similarityScore   score between the first two members
 * @param members           ordered members; the first one anchored the group
 * @param recommendedAction what the resolution policy recommends
 * @param reason            human-readable explanation of the match
 * @param matchingFields    fields that scored above the match threshold
 */
public record DuplicateGroup(
        String id,
        double similarityScore,
        List<GroupMember> members,
        RecommendedAction recommendedAction,
        String reason,
        Set<String> matchingFields
) {
    public DuplicateGroup {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(recommendedAction, "recommendedAction is required");
        members = members != null ? List.copyOf(members) : List.of();
        matchingFields = matchingFields != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(matchingFields))
                : Set.of();
        reason = reason != null ? reason : "";
    }

    public int size() {
        return members.size();
    }

    public List<String> memberIds() {
        return members.stream().map(GroupMember::id).toList();
    }

    public boolean isExactMatch() {
        return similarityScore >= 99.9;
    }
}

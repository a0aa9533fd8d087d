package com.vectorstore.dedup.policy;

import com.vectorstore.dedup.core.TimestampParser;
import com.vectorstore.dedup.core.model.AttributeValue;
import com.vectorstore.dedup.core.model.DuplicateGroup;
import com.vectorstore.dedup.core.model.GroupMember;
import com.vectorstore.dedup.core.model.RecommendedAction;
import com.vectorstore.dedup.core.model.ResolutionStrategy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides which record of a duplicate group is retained.
 *
 * <p>{@code keep-newest} only applies when at least one member carries a timestamp
 * attribute ({@code lastModified}, {@code timestamp} or {@code created}, checked in that order);
 * otherwise the group falls back to {@code keep-first}. When selecting the newest member,
 * members whose timestamp does not parse are ignored; if none parse, the first member is kept.</p>
 */
public class ResolutionPolicy {

    static final List<String> TIMESTAMP_KEYS = List.of("lastModified", "timestamp", "created");

    /**
     * Recommends an action for a group of members under the given strategy.
     */
    public RecommendedAction decide(ResolutionStrategy strategy, List<GroupMember> members) {
        switch (strategy) {
            case MANUAL:
                return RecommendedAction.MANUAL_REVIEW;
            case KEEP_FIRST:
                return RecommendedAction.KEEP_FIRST;
            default:
                boolean hasTimestamps = members.stream().anyMatch(m -> timestampAttribute(m).isPresent());
                return hasTimestamps ? RecommendedAction.KEEP_NEWEST : RecommendedAction.KEEP_FIRST;
        }
    }

    /**
     * Splits a group into the retained id and the ids to delete, following the group's
     * recommended action. Manual-review groups keep their first member.
     *
     * @throws IllegalArgumentException if the group has no members
     */
    public Selection select(DuplicateGroup group) {
        List<GroupMember> members = group.members();
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Group " + group.id() + " has no members");
        }

        int keepIndex = 0;
        if (group.recommendedAction() == RecommendedAction.KEEP_NEWEST) {
            keepIndex = newestIndex(members);
        }

        String keep = members.get(keepIndex).id();
        List<String> delete = new ArrayList<>(members.size() - 1);
        for (int i = 0; i < members.size(); i++) {
            if (i != keepIndex) {
                delete.add(members.get(i).id());
            }
        }
        return new Selection(keep, delete);
    }

    private int newestIndex(List<GroupMember> members) {
        int newestIndex = 0;
        Instant newest = null;
        for (int i = 0; i < members.size(); i++) {
            Optional<Instant> time = timestampAttribute(members.get(i)).flatMap(TimestampParser::parse);
            if (time.isPresent() && (newest == null || time.get().isAfter(newest))) {
                newest = time.get();
                newestIndex = i;
            }
        }
        return newestIndex;
    }

    /**
     * Returns the first non-empty string or numeric timestamp attribute of a member.
     */
    static Optional<AttributeValue> timestampAttribute(GroupMember member) {
        for (String key : TIMESTAMP_KEYS) {
            AttributeValue value = member.attribute(key);
            if (value.kind() == AttributeValue.Kind.STRING && !value.asString().isEmpty()) {
                return Optional.of(value);
            }
            if (value.kind() == AttributeValue.Kind.NUMBER && value.asNumber() != 0) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}

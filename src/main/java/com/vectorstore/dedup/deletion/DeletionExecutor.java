package com.vectorstore.dedup.deletion;

import com.vectorstore.dedup.audit.AuditEntry;
import com.vectorstore.dedup.core.model.DuplicateGroup;
import com.vectorstore.dedup.policy.ResolutionPolicy;
import com.vectorstore.dedup.policy.Selection;
import com.vectorstore.dedup.store.DeleteOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes the non-retained members of duplicate groups and records an audit trail.
 *
 * <p>The request is refused outright, with no store interaction, unless deletion is
 * explicitly confirmed and every group has members. Accepted groups are then processed
 * independently: a failing group is recorded as an error and the next group proceeds.
 * There is no rollback and no retry.</p>
 */
public class DeletionExecutor {
    private static final Logger log = LoggerFactory.getLogger(DeletionExecutor.class);

    private final ResolutionPolicy policy;
    private final Clock clock;

    public DeletionExecutor() {
        this(new ResolutionPolicy(), Clock.systemUTC());
    }

    public DeletionExecutor(ResolutionPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Deletes duplicates group by group.
     *
     * @param groups    groups to resolve, typically resubmitted from a reviewed analysis
     * @param deleter   batch delete bound to the target store and namespace
     * @param confirmed explicit confirmation that deletion may proceed
     * @return what succeeded and what did not
     */
    public DeletionResult execute(List<DuplicateGroup> groups, DeleteFunction deleter, boolean confirmed) {
        if (!confirmed) {
            log.warn("dedup.delete.rejected reason=confirmation-missing");
            return DeletionResult.rejected("Deletion confirmation required");
        }
        if (groups == null || groups.isEmpty()) {
            log.warn("dedup.delete.rejected reason=no-groups");
            return DeletionResult.rejected("Invalid duplicate groups data");
        }
        for (DuplicateGroup group : groups) {
            if (group == null || group.members().isEmpty()) {
                String groupId = group != null ? group.id() : "unknown";
                log.warn("dedup.delete.rejected reason=invalid-group groupId={}", groupId);
                return DeletionResult.rejected("Group " + groupId + " is missing required fields");
            }
        }

        log.info("dedup.delete.started groups={}", groups.size());

        List<AuditEntry> auditTrail = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Map<String, String> groupErrors = new LinkedHashMap<>();
        int totalDeleted = 0;

        for (DuplicateGroup group : groups) {
            try {
                Selection selection = policy.select(group);
                if (!selection.hasDeletions()) {
                    continue;
                }

                DeleteOutcome outcome = deleter.delete(selection.delete());
                if (outcome != null && outcome.success()) {
                    totalDeleted += selection.delete().size();
                    auditTrail.add(AuditEntry.builder()
                            .groupId(group.id())
                            .deletedIds(selection.delete())
                            .keptId(selection.keep())
                            .reason(group.reason())
                            .timestamp(clock.instant())
                            .build());
                    log.debug("dedup.group.deleted groupId={} kept={} deleted={}",
                            group.id(), selection.keep(), selection.delete().size());
                } else {
                    String message = "Failed to delete group " + group.id() + ": Delete operation failed";
                    errors.add(message);
                    groupErrors.put(group.id(), message);
                    log.warn("dedup.group.failed groupId={} detail={}",
                            group.id(), outcome != null ? outcome.message() : "no outcome");
                }
            } catch (RuntimeException e) {
                String message = "Error processing group " + group.id() + ": " + e.getMessage();
                errors.add(message);
                groupErrors.put(group.id(), message);
                log.warn("dedup.group.error groupId={} error={}", group.id(), e.getMessage());
            }
        }

        DeletionResult result = new DeletionResult(errors.isEmpty(), auditTrail.size(), totalDeleted,
                errors, groupErrors, auditTrail);
        log.info("dedup.delete.completed result={}", result);
        return result;
    }
}

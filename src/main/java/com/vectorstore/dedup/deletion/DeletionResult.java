package com.vectorstore.dedup.deletion;

import com.vectorstore.dedup.audit.AuditEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort outcome of deleting duplicate groups.
 * Describes exactly which groups succeeded (one audit entry each) and which failed,
 * so a caller can resubmit only the failed groups.
 *
 * @param success          true only if no group failed and the request was accepted
 * @param deletedGroups    groups deleted successfully
 * @param deletedDocuments records deleted across all groups
 * @param errors           error messages in processing order
 * @param groupErrors      the per-group error messages keyed by group id
 * @param auditTrail       one entry per successfully processed group
 */
public record DeletionResult(
        boolean success,
        int deletedGroups,
        int deletedDocuments,
        List<String> errors,
        Map<String, String> groupErrors,
        List<AuditEntry> auditTrail
) {
    public DeletionResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        groupErrors = groupErrors != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(groupErrors))
                : Map.of();
        auditTrail = auditTrail != null ? List.copyOf(auditTrail) : List.of();
    }

    /**
     * A request refused before any store interaction.
     */
    public static DeletionResult rejected(String message) {
        return new DeletionResult(false, 0, 0, List.of(message), Map.of(), List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public String summary() {
        if (success) {
            return "Successfully deleted " + deletedDocuments + " duplicate documents in "
                    + deletedGroups + " groups";
        }
        return "Deletion completed with " + errors.size() + " errors. "
                + deletedDocuments + " documents deleted.";
    }

    @Override
    public String toString() {
        return "DeletionResult{" +
                "success=" + success +
                ", groups=" + deletedGroups +
                ", documents=" + deletedDocuments +
                ", errors=" + errors.size() +
                '}';
    }
}

package com.vectorstore.dedup.audit;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable record of one executed deletion decision.
 *
 * @param groupId    the duplicate group the decision belongs to
 * @param deletedIds ids removed from the store, in group order
 * @param keptId     the retained record; never one of {@code deletedIds}
 * @param reason     why the group was considered duplicate
 * @param timestamp  when the deletion was confirmed by the store
 */
public record AuditEntry(
        String groupId,
        List<String> deletedIds,
        String keptId,
        String reason,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(groupId, "groupId is required");
        Objects.requireNonNull(keptId, "keptId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        deletedIds = deletedIds != null ? List.copyOf(deletedIds) : List.of();
        if (deletedIds.contains(keptId)) {
            throw new IllegalArgumentException("Kept id " + keptId + " cannot appear in deletedIds");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String groupId;
        private List<String> deletedIds;
        private String keptId;
        private String reason;
        private Instant timestamp = Instant.now();

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder deletedIds(List<String> deletedIds) {
            this.deletedIds = deletedIds;
            return this;
        }

        public Builder keptId(String keptId) {
            this.keptId = keptId;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(groupId, deletedIds, keptId, reason, timestamp);
        }
    }
}

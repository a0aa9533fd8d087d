package com.vectorstore.dedup.policy;

import java.util.List;
import java.util.Objects;

/**
 * Which member of a duplicate group survives and which are removed.
 *
 * @param keep   id of the retained record
 * @param delete ids to remove, in group order; never contains {@code keep}
 */
public record Selection(String keep, List<String> delete) {

    public Selection {
        Objects.requireNonNull(keep, "keep is required");
        delete = delete != null ? List.copyOf(delete) : List.of();
        if (delete.contains(keep)) {
            throw new IllegalArgumentException("Retained id " + keep + " cannot also be deleted");
        }
    }

    public boolean hasDeletions() {
        return !delete.isEmpty();
    }
}

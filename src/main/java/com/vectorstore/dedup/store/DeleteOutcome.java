package com.vectorstore.dedup.store;

/**
 * Result reported by a store batch delete.
 *
 * @param success      whether the store accepted the delete
 * @param deletedCount number of ids the store removed
 * @param message      failure detail, or {@code null} on success
 */
public record DeleteOutcome(boolean success, int deletedCount, String message) {

    public static DeleteOutcome succeeded(int deletedCount) {
        return new DeleteOutcome(true, deletedCount, null);
    }

    public static DeleteOutcome failed(String message) {
        return new DeleteOutcome(false, 0, message);
    }
}

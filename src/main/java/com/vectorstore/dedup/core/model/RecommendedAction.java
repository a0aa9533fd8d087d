package com.vectorstore.dedup.core.model;

/**
 * What the resolution policy recommends doing with a duplicate group.
 */
public enum RecommendedAction {
    /**
     * Keep the first member, delete the rest.
     */
    KEEP_FIRST("keep-first"),

    /**
     * Keep the member with the latest timestamp attribute, delete the rest.
     */
    KEEP_NEWEST("keep-newest"),

    /**
     * A person should decide. Deletion falls back to keeping the first member.
     */
    MANUAL_REVIEW("manual-review");

    private final String value;

    RecommendedAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static RecommendedAction fromValue(String value) {
        for (RecommendedAction action : values()) {
            if (action.value.equalsIgnoreCase(value) || action.name().equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown recommended action: " + value);
    }
}

package com.vectorstore.dedup.core.model;

/**
 * Caller-selected policy for choosing the surviving member of a duplicate group.
 */
public enum ResolutionStrategy {
    KEEP_FIRST("keep-first"),
    KEEP_NEWEST("keep-newest"),
    MANUAL("manual");

    private final String value;

    ResolutionStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ResolutionStrategy fromValue(String value) {
        for (ResolutionStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown resolution strategy: " + value);
    }
}

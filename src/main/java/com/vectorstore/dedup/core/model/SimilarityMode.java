package com.vectorstore.dedup.core.model;

/**
 * How attribute maps are compared.
 */
public enum SimilarityMode {
    /**
     * Only byte-identical attribute maps match.
     */
    EXACT("exact"),

    /**
     * Field-wise scoring with field-name heuristics.
     */
    FUZZY("fuzzy"),

    /**
     * Field-wise scoring, typically restricted with include/exclude keys.
     */
    CUSTOM("custom");

    private final String value;

    SimilarityMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SimilarityMode fromValue(String value) {
        for (SimilarityMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown similarity mode: " + value);
    }
}

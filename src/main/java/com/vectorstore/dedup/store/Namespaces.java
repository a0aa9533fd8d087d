package com.vectorstore.dedup.store;

/**
 * Namespace name handling. {@code null}, {@code ""} and {@code "default"} all denote
 * the store's default namespace.
 */
public final class Namespaces {

    public static final String DEFAULT = "";

    private static final String DEFAULT_DISPLAY_NAME = "default";

    private Namespaces() {
    }

    /**
     * Returns the namespace as the store expects it.
     */
    public static String normalize(String namespace) {
        if (namespace == null || namespace.isBlank() || DEFAULT_DISPLAY_NAME.equals(namespace)) {
            return DEFAULT;
        }
        return namespace;
    }

    /**
     * Returns the namespace as shown in reports.
     */
    public static String displayName(String namespace) {
        String normalized = normalize(namespace);
        return normalized.isEmpty() ? DEFAULT_DISPLAY_NAME : normalized;
    }
}

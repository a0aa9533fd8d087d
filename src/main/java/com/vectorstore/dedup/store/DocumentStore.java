package com.vectorstore.dedup.store;

import com.vectorstore.dedup.core.model.AttributeValue;

import java.util.List;
import java.util.Map;

/**
 * Read/write contract of the vector-document store the engine works against.
 * Implementations wrap a concrete store client; one instance is created at startup
 * and passed to the service entry points.
 */
public interface DocumentStore {

    /**
     * Hard cap on ids returned by one {@link #list} call.
     */
    int MAX_PAGE_SIZE = 100;

    /**
     * Largest id batch passed to one {@link #fetchAttributes} call.
     */
    int MAX_FETCH_BATCH = 50;

    /**
     * Lists record ids in a namespace.
     *
     * @param namespace store namespace, {@code ""} for the default one
     * @param pageSize  at most {@link #MAX_PAGE_SIZE}
     * @param pageToken token from the previous page, or {@code null} for the first page
     * @throws DocumentStoreException if the store is unavailable
     */
    ListPage list(String namespace, int pageSize, String pageToken);

    /**
     * Fetches the attributes of the given records. Unknown ids are omitted from the result.
     *
     * @throws DocumentStoreException if the store is unavailable
     */
    Map<String, Map<String, AttributeValue>> fetchAttributes(String namespace, List<String> ids);

    /**
     * Deletes the given records.
     *
     * @return the store's verdict
     * @throws DocumentStoreException if the store is unavailable
     */
    DeleteOutcome deleteMany(String namespace, List<String> ids);
}

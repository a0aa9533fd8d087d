package com.vectorstore.dedup.store;

import com.vectorstore.dedup.core.model.AttributeValue;
import com.vectorstore.dedup.core.model.VectorRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link DocumentStore}.
 * Records are kept per namespace in insertion order; page tokens are offsets.
 * Thread-safe via synchronization.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, VectorRecord>> namespaces = new HashMap<>();

    public synchronized void put(String namespace, VectorRecord record) {
        namespaces.computeIfAbsent(Namespaces.normalize(namespace), k -> new LinkedHashMap<>())
                .put(record.id(), record);
    }

    public void putAll(String namespace, List<VectorRecord> records) {
        records.forEach(record -> put(namespace, record));
    }

    public synchronized boolean contains(String namespace, String id) {
        return records(namespace).containsKey(id);
    }

    public synchronized int size(String namespace) {
        return records(namespace).size();
    }

    @Override
    public synchronized ListPage list(String namespace, int pageSize, String pageToken) {
        if (pageSize <= 0 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        List<String> ids = new ArrayList<>(records(namespace).keySet());
        int offset = parseToken(pageToken);
        int end = Math.min(offset + pageSize, ids.size());
        List<String> page = offset < ids.size() ? ids.subList(offset, end) : List.of();
        String next = end < ids.size() ? String.valueOf(end) : null;
        return new ListPage(page, next);
    }

    @Override
    public synchronized Map<String, Map<String, AttributeValue>> fetchAttributes(String namespace, List<String> ids) {
        Map<String, VectorRecord> stored = records(namespace);
        Map<String, Map<String, AttributeValue>> result = new LinkedHashMap<>();
        for (String id : ids) {
            VectorRecord record = stored.get(id);
            if (record != null) {
                result.put(id, record.attributes());
            }
        }
        return result;
    }

    /**
     * Removes the given ids. Reports failure when none of them exist.
     */
    @Override
    public synchronized DeleteOutcome deleteMany(String namespace, List<String> ids) {
        Map<String, VectorRecord> stored = namespaces.getOrDefault(Namespaces.normalize(namespace), new HashMap<>());
        int removed = 0;
        for (String id : ids) {
            if (stored.remove(id) != null) {
                removed++;
            }
        }
        if (removed == 0 && !ids.isEmpty()) {
            return DeleteOutcome.failed("None of the " + ids.size() + " ids were found");
        }
        return DeleteOutcome.succeeded(removed);
    }

    private Map<String, VectorRecord> records(String namespace) {
        return namespaces.getOrDefault(Namespaces.normalize(namespace), Map.of());
    }

    private static int parseToken(String pageToken) {
        if (pageToken == null || pageToken.isEmpty()) {
            return 0;
        }
        int offset;
        try {
            offset = Integer.parseInt(pageToken);
        } catch (NumberFormatException e) {
            throw new DocumentStoreException("Invalid page token: " + pageToken, e);
        }
        if (offset < 0) {
            throw new DocumentStoreException("Invalid page token: " + pageToken);
        }
        return offset;
    }
}

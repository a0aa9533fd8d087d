package com.vectorstore.dedup.store;

import com.vectorstore.dedup.core.model.AttributeValue;
import com.vectorstore.dedup.core.model.VectorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Materializes a bounded record batch from a {@link DocumentStore}.
 * Pages through the id listing within the store's page cap, optionally samples,
 * then fetches attributes in bounded chunks and merges them in listing order.
 */
public class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    /**
     * Upper bound on records loaded by one call, whatever limit is requested.
     */
    public static final int MAX_RECORDS = 10_000;

    private final Random random;

    public DocumentLoader() {
        this(new Random());
    }

    public DocumentLoader(Random random) {
        this.random = random;
    }

    /**
     * Loads up to {@code limit} records from a namespace.
     *
     * @param randomSample list up to {@link #MAX_RECORDS} ids and pick a random subset of
     *                     {@code limit} instead of the first ones
     * @throws DocumentStoreException if any store call fails
     */
    public List<VectorRecord> load(DocumentStore store, String namespace, int limit, boolean randomSample) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        String ns = Namespaces.normalize(namespace);

        int target = randomSample ? MAX_RECORDS : Math.min(limit, MAX_RECORDS);
        List<String> ids = listIds(store, ns, target);
        if (ids.isEmpty()) {
            log.info("dedup.load.empty namespace={}", Namespaces.displayName(ns));
            return List.of();
        }

        if (randomSample && ids.size() > limit) {
            List<String> shuffled = new ArrayList<>(ids);
            Collections.shuffle(shuffled, random);
            ids = shuffled.subList(0, limit);
            log.debug("dedup.load.sampled selected={} available={}", limit, shuffled.size());
        } else if (ids.size() > limit) {
            ids = ids.subList(0, limit);
        }

        Map<String, Map<String, AttributeValue>> fetched = fetchAll(store, ns, ids);

        List<VectorRecord> records = new ArrayList<>(fetched.size());
        for (String id : ids) {
            Map<String, AttributeValue> attributes = fetched.get(id);
            if (attributes != null) {
                records.add(new VectorRecord(id, attributes));
            }
        }

        log.info("dedup.load.completed namespace={} listed={} loaded={}",
                Namespaces.displayName(ns), ids.size(), records.size());
        return records;
    }

    private List<String> listIds(DocumentStore store, String namespace, int target) {
        List<String> ids = new ArrayList<>();
        String pageToken = null;

        while (ids.size() < target) {
            int pageSize = Math.min(target - ids.size(), DocumentStore.MAX_PAGE_SIZE);
            ListPage page = store.list(namespace, pageSize, pageToken);
            ids.addAll(page.ids());

            pageToken = page.next().orElse(null);
            if (pageToken == null || page.ids().isEmpty()) {
                break;
            }
        }
        return ids;
    }

    private Map<String, Map<String, AttributeValue>> fetchAll(DocumentStore store, String namespace,
                                                              List<String> ids) {
        Map<String, Map<String, AttributeValue>> merged = new HashMap<>();
        for (int i = 0; i < ids.size(); i += DocumentStore.MAX_FETCH_BATCH) {
            List<String> chunk = ids.subList(i, Math.min(i + DocumentStore.MAX_FETCH_BATCH, ids.size()));
            merged.putAll(store.fetchAttributes(namespace, List.copyOf(chunk)));
        }
        return merged;
    }
}

package com.vectorstore.dedup.store;

import java.util.List;
import java.util.Optional;

/**
 * One page of record ids from {@link DocumentStore#list}.
 *
 * @param ids           record ids on this page
 * @param nextPageToken token for the following page, or {@code null} on the last page
 */
public record ListPage(List<String> ids, String nextPageToken) {

    public ListPage {
        ids = ids != null ? List.copyOf(ids) : List.of();
    }

    public Optional<String> next() {
        return Optional.ofNullable(nextPageToken).filter(token -> !token.isEmpty());
    }
}

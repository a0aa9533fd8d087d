package com.vectorstore.dedup.store;

import com.vectorstore.dedup.core.model.AttributeValue;
import com.vectorstore.dedup.core.model.VectorRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryDocumentStore Tests")
class InMemoryDocumentStoreTest {

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        store.putAll("docs", List.of(
                VectorRecord.of("a", Map.of("title", "A")),
                VectorRecord.of("b", Map.of("title", "B")),
                VectorRecord.of("c", Map.of("title", "C"))));
    }

    @Test
    @DisplayName("Lists ids in insertion order with offset tokens")
    void paging() {
        ListPage first = store.list("docs", 2, null);
        assertEquals(List.of("a", "b"), first.ids());
        assertEquals("2", first.next().orElseThrow());

        ListPage second = store.list("docs", 2, first.nextPageToken());
        assertEquals(List.of("c"), second.ids());
        assertTrue(second.next().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 101})
    @DisplayName("Page size outside the store cap is rejected")
    void pageSizeCap(int pageSize) {
        assertThrows(IllegalArgumentException.class, () -> store.list("docs", pageSize, null));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not-a-token", "-5", "-1"})
    @DisplayName("Malformed or negative page token is a store error")
    void badToken(String token) {
        DocumentStoreException ex = assertThrows(DocumentStoreException.class, () -> store.list("docs", 10, token));
        assertEquals("Invalid page token: " + token, ex.getMessage());
    }

    @Test
    @DisplayName("Token past the end yields an empty last page")
    void tokenPastEnd() {
        ListPage page = store.list("docs", 10, "7");

        assertTrue(page.ids().isEmpty());
        assertTrue(page.next().isEmpty());
    }

    @Test
    @DisplayName("Fetch omits unknown ids")
    void fetchOmitsUnknown() {
        Map<String, Map<String, AttributeValue>> fetched = store.fetchAttributes("docs", List.of("a", "zz"));

        assertEquals(1, fetched.size());
        assertEquals(AttributeValue.of("A"), fetched.get("a").get("title"));
    }

    @Test
    @DisplayName("Deleting reports failure once nothing is left to delete")
    void deleteMany() {
        DeleteOutcome first = store.deleteMany("docs", List.of("b", "c"));
        assertTrue(first.success());
        assertEquals(2, first.deletedCount());
        assertEquals(1, store.size("docs"));

        DeleteOutcome second = store.deleteMany("docs", List.of("b", "c"));
        assertFalse(second.success());
        assertEquals("None of the 2 ids were found", second.message());
    }

    @Test
    @DisplayName("Deleting from an unknown namespace fails without error")
    void deleteUnknownNamespace() {
        assertFalse(store.deleteMany("other", List.of("a")).success());
        assertTrue(store.contains("docs", "a"));
    }

    @Test
    @DisplayName("Namespace aliases resolve to the default namespace")
    void namespaceAliases() {
        store.put(null, VectorRecord.of("x", Map.of()));

        assertTrue(store.contains("default", "x"));
        assertTrue(store.contains("", "x"));
        assertEquals("default", Namespaces.displayName(""));
        assertEquals("docs", Namespaces.displayName("docs"));
    }
}

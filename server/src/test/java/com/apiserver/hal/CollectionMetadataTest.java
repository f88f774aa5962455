package com.apiserver.hal;

import com.apiserver.hal.TestEntities.ThingCollection;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectionMetadataTest {

    @Test
    void testOf_Defaults() {
        CollectionMetadata metadata = CollectionMetadata.of(ThingCollection.class, "/things", "things");
        assertEquals(ThingCollection.class, metadata.collectionType());
        assertEquals("/things", metadata.route());
        assertEquals("things", metadata.collectionRelation());
        assertTrue(metadata.queryStringArguments().isEmpty());
        assertEquals("page", metadata.paginationParam());
        assertEquals(25, metadata.pageSize());
    }

    @Test
    void testWithQueryOverlay_CallerOverridesAndAdds() {
        CollectionMetadata metadata = CollectionMetadata.of(ThingCollection.class, "/things", "things")
            .withQueryStringArguments(Map.of("sort", "id"));

        Map<String, List<String>> query = new LinkedHashMap<>();
        query.put("sort", List.of("name"));
        query.put("page", List.of("2"));
        query.put("tag", List.of("a", "b"));
        query.put("empty", List.of());

        CollectionMetadata merged = metadata.withQueryOverlay(query);

        assertEquals("name", merged.queryStringArguments().get("sort"));
        assertEquals("2", merged.queryStringArguments().get("page"));
        assertEquals(List.of("a", "b"), merged.queryStringArguments().get("tag"));
        assertFalse(merged.queryStringArguments().containsKey("empty"));
        assertEquals(List.of("sort", "page", "tag"), List.copyOf(merged.queryStringArguments().keySet()));

        // The registered metadata is left untouched
        assertEquals(Map.of("sort", "id"), metadata.queryStringArguments());
    }

    @Test
    void testWithQueryOverlay_EmptyQueryReturnsSameInstance() {
        CollectionMetadata metadata = CollectionMetadata.of(ThingCollection.class, "/things", "things");
        assertSame(metadata, metadata.withQueryOverlay(Map.of()));
    }

    @Test
    void testQueryStringArgumentsAreImmutable() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("sort", "id");
        CollectionMetadata metadata = CollectionMetadata.of(ThingCollection.class, "/things", "things")
            .withQueryStringArguments(arguments);
        arguments.put("sort", "name");

        assertEquals("id", metadata.queryStringArguments().get("sort"));
        assertThrows(UnsupportedOperationException.class,
            () -> metadata.queryStringArguments().put("x", "y"));
    }

    @Test
    void testConstructor_RejectsInvalidValues() {
        CollectionMetadata metadata = CollectionMetadata.of(ThingCollection.class, "/things", "things");
        assertThrows(IllegalArgumentException.class, () -> metadata.withPageSize(0));
        assertThrows(IllegalArgumentException.class,
            () -> CollectionMetadata.of(ThingCollection.class, "", "things"));
        assertThrows(IllegalArgumentException.class,
            () -> CollectionMetadata.of(ThingCollection.class, "/things", ""));
    }
}

package teranet.mapdev.forge.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.forge.model.JoinKeyPair;
import teranet.mapdev.forge.model.JoinStep;
import teranet.mapdev.forge.model.TransformSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static teranet.mapdev.forge.util.TestDataFactory.join;

class JoinKeySuggestionServiceTest {

    private JoinKeySuggestionService service;

    @BeforeEach
    void setUp() {
        service = new JoinKeySuggestionService();
    }

    @Test
    void testSuggest_PreferredKeyWins() {
        Optional<JoinKeyPair> pair = service.suggest(
                List.of("name", "Item_ID", "sku"), List.of("SKU", "item id", "name"));

        assertTrue(pair.isPresent());
        assertEquals("Item_ID", pair.get().getLeft());
        assertEquals("item id", pair.get().getRight());
    }

    @Test
    void testSuggest_FirstCommonNormalizedName() {
        Optional<JoinKeyPair> pair = service.suggest(
                List.of("order_id", "Customer-Id", "total"), List.of("customerid", "region"));

        assertEquals(Optional.of(new JoinKeyPair("Customer-Id", "customerid")), pair);
    }

    @Test
    void testSuggest_NoOverlap() {
        assertTrue(service.suggest(List.of("a1"), List.of("b1")).isEmpty());
        assertTrue(service.suggest(List.of(), List.of("b1")).isEmpty());
        assertTrue(service.suggest(List.of("a1"), null).isEmpty());
    }

    @Test
    void testNormalize() {
        assertEquals("itemid", JoinKeySuggestionService.normalize(" Item_ID "));
        assertEquals("", JoinKeySuggestionService.normalize(null));
    }

    @Test
    void testSeedJoinKeys_OnlyFillsIncompleteFirstPair() {
        // Given
        TransformSpec transform = new TransformSpec();
        JoinStep empty = JoinStep.disabled("b");
        JoinStep configured = join("c", "left", "order_id", "ref");
        transform.setJoins(new ArrayList<>(List.of(empty, configured)));
        Map<String, List<String>> schemas = Map.of(
                "a", List.of("order_id", "customer_id"),
                "b", List.of("customer_id", "name"),
                "c", List.of("order_id", "ref"));

        // When
        service.seedJoinKeys(transform, schemas);

        // Then
        assertEquals(new JoinKeyPair("customer_id", "customer_id"), empty.getKeys().get(0));
        assertFalse(empty.isEnabled());
        assertEquals(new JoinKeyPair("order_id", "ref"), configured.getKeys().get(0));
    }

    @Test
    void testSeedJoinKeys_NoPrimarySchema() {
        TransformSpec transform = new TransformSpec();
        JoinStep step = JoinStep.disabled("b");
        transform.setJoins(new ArrayList<>(List.of(step)));

        service.seedJoinKeys(transform, Map.of("b", List.of("id")));

        assertTrue(step.getKeys().get(0).isEmpty());
    }
}

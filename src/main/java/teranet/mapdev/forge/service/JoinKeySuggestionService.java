package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.ColumnDescriptor;
import teranet.mapdev.forge.model.JoinKeyPair;
import teranet.mapdev.forge.model.JoinStep;
import teranet.mapdev.forge.model.TransformSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Best-effort join key guesses between two schemas.
 *
 * Names are compared after lowercasing and stripping non-alphanumerics, so
 * "Item_ID", "item id" and "ITEMID" are the same key.
 */
@Service
@Slf4j
public class JoinKeySuggestionService {

    private static final List<String> PREFERRED_KEYS = List.of(
            "id", "itemid", "item_id", "inv_item_id", "ib_item_id", "key", "sku", "code");

    /**
     * Suggest a key pair: the first preferred key present on both sides,
     * else the first left column whose normalized name exists on the right.
     *
     * @return the pair, or empty when the schemas share no name
     */
    public Optional<JoinKeyPair> suggest(List<String> leftColumns, List<String> rightColumns) {
        if (leftColumns == null || rightColumns == null || leftColumns.isEmpty() || rightColumns.isEmpty()) {
            return Optional.empty();
        }
        Map<String, String> left = byNormalizedName(leftColumns);
        Map<String, String> right = byNormalizedName(rightColumns);

        for (String preferred : PREFERRED_KEYS) {
            String key = normalize(preferred);
            if (left.containsKey(key) && right.containsKey(key)) {
                return Optional.of(new JoinKeyPair(left.get(key), right.get(key)));
            }
        }
        for (String column : leftColumns) {
            String key = normalize(column);
            if (!key.isEmpty() && right.containsKey(key)) {
                return Optional.of(new JoinKeyPair(column, right.get(key)));
            }
        }
        return Optional.empty();
    }

    /**
     * Fill the first key pair of every step that has no complete first pair,
     * keyed against the primary schema. Configured keys are never replaced.
     *
     * @param transform normalized transform (modified in place)
     * @param schemas   header columns per dataset tag
     */
    public void seedJoinKeys(TransformSpec transform, Map<String, List<String>> schemas) {
        List<String> primary = schemas.get(ColumnDescriptor.PRIMARY_SOURCE);
        if (primary == null || primary.isEmpty() || transform.getJoins() == null) {
            return;
        }
        for (JoinStep step : transform.getJoins()) {
            if (hasFirstKey(step)) {
                continue;
            }
            List<String> right = schemas.get(step.getRight());
            suggest(primary, right).ifPresent(pair -> {
                List<JoinKeyPair> keys = new ArrayList<>();
                keys.add(pair);
                step.setKeys(keys);
                log.info("Seeded join key for dataset {}: {} = {}", step.getRight(), pair.getLeft(), pair.getRight());
            });
        }
    }

    private boolean hasFirstKey(JoinStep step) {
        return step.getKeys() != null && !step.getKeys().isEmpty()
                && step.getKeys().get(0) != null && step.getKeys().get(0).isComplete();
    }

    private Map<String, String> byNormalizedName(List<String> columns) {
        Map<String, String> lookup = new LinkedHashMap<>();
        for (String column : columns) {
            lookup.putIfAbsent(normalize(column), column);
        }
        return lookup;
    }

    static String normalize(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}

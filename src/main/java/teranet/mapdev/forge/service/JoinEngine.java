package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.ColumnDescriptor;
import teranet.mapdev.forge.model.JoinKeyPair;
import teranet.mapdev.forge.model.JoinStep;
import teranet.mapdev.forge.model.JoinType;
import teranet.mapdev.forge.util.ValueCoercion;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Executes join steps in declared order over a growing row set.
 *
 * Each executable step indexes its right-hand rows by key tuple, keeping the
 * first row per tuple. A matching left row is copied and receives every right
 * field as {@code <tag>__<field>}. Unmatched rows are kept for left joins and
 * dropped for inner joins. Input rows are never modified.
 */
@Service
@Slf4j
public class JoinEngine {

    /**
     * Run every step in order.
     *
     * @param primaryRows rows of the primary dataset
     * @param rightRows   rows per right-hand dataset tag
     * @param steps       canonical join steps
     * @return the joined rows
     */
    public List<Map<String, String>> execute(List<Map<String, String>> primaryRows,
            Map<String, List<Map<String, String>>> rightRows,
            List<JoinStep> steps) {
        List<Map<String, String>> current = primaryRows;
        if (steps == null) {
            return current;
        }
        for (JoinStep step : steps) {
            if (!step.isExecutable()) {
                continue;
            }
            List<Map<String, String>> right = rightRows.get(step.getRight());
            if (right == null) {
                log.warn("Skipping join to {}: no rows loaded for that dataset", step.getRight());
                continue;
            }
            current = applyStep(current, right, step);
        }
        return current;
    }

    /**
     * Apply one step. Disabled or key-less steps return the input unchanged.
     */
    public List<Map<String, String>> applyStep(List<Map<String, String>> leftRows,
            List<Map<String, String>> rightRows,
            JoinStep step) {
        if (!step.isExecutable()) {
            return leftRows;
        }
        List<JoinKeyPair> keys = step.getCompleteKeys();
        List<String> leftColumns = keys.stream().map(JoinKeyPair::getLeftTrimmed).collect(Collectors.toList());
        List<String> rightColumns = keys.stream().map(JoinKeyPair::getRightTrimmed).collect(Collectors.toList());
        Map<List<String>, Map<String, String>> index = buildIndex(rightRows, rightColumns);

        String tag = step.getRight().trim();
        boolean inner = step.getJoinType() == JoinType.INNER;
        List<Map<String, String>> result = new ArrayList<>(leftRows.size());
        int matched = 0;

        for (Map<String, String> row : leftRows) {
            List<String> key = keyTuple(row, leftColumns);
            Map<String, String> match = key == null ? null : index.get(key);
            if (match != null) {
                Map<String, String> merged = new LinkedHashMap<>(row);
                match.forEach((column, value) -> merged.put(ColumnDescriptor.prefixed(tag, column), value));
                result.add(merged);
                matched++;
            } else if (!inner) {
                result.add(row);
            }
        }

        log.debug("Join to {} ({}): {} of {} rows matched, {} rows out",
                tag, step.getJoinType().getName(), matched, leftRows.size(), result.size());
        return result;
    }

    /**
     * First right row per key tuple. Rows whose tuple is entirely blank are not indexed.
     */
    Map<List<String>, Map<String, String>> buildIndex(List<Map<String, String>> rightRows, List<String> columns) {
        Map<List<String>, Map<String, String>> index = new HashMap<>();
        for (Map<String, String> row : rightRows) {
            List<String> key = keyTuple(row, columns);
            if (key != null) {
                index.putIfAbsent(key, row);
            }
        }
        return index;
    }

    /**
     * Blank-normalized, trimmed key values of a row.
     *
     * @return the tuple, or null when every element is blank
     */
    public List<String> keyTuple(Map<String, String> row, List<String> columns) {
        List<String> key = new ArrayList<>(columns.size());
        boolean allBlank = true;
        for (String column : columns) {
            String value = ValueCoercion.orEmpty(row.get(column)).trim();
            if (!value.isEmpty()) {
                allBlank = false;
            }
            key.add(value);
        }
        return allBlank ? null : key;
    }
}

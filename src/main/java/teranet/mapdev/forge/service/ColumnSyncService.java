package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.ColumnDescriptor;
import teranet.mapdev.forge.model.TransformSpec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rebuilds the column descriptors of a transform from the current schemas.
 *
 * Primary columns keep their name and are selected by default. Right-hand
 * columns become {@code <tag>__<column>}, labelled {@code <TAG>.<column>}
 * and are not selected by default. Include and label choices already made
 * for a name are kept; descriptors for columns that disappeared are dropped.
 */
@Service
@Slf4j
public class ColumnSyncService {

    /**
     * @param transform transform to update in place
     * @param schemas   header columns per dataset tag, primary first
     */
    public void sync(TransformSpec transform, Map<String, List<String>> schemas) {
        Map<String, ColumnDescriptor> previous = new HashMap<>();
        if (transform.getColumns() != null) {
            for (ColumnDescriptor column : transform.getColumns()) {
                if (column != null && column.getName() != null && !column.getName().isEmpty()) {
                    previous.put(column.getName(), column);
                }
            }
        }

        List<ColumnDescriptor> synced = new ArrayList<>();
        for (String column : schemas.getOrDefault(ColumnDescriptor.PRIMARY_SOURCE, new ArrayList<>())) {
            synced.add(descriptor(previous.get(column), column, column, true, ColumnDescriptor.PRIMARY_SOURCE));
        }
        schemas.forEach((tag, columns) -> {
            if (ColumnDescriptor.PRIMARY_SOURCE.equals(tag)) {
                return;
            }
            for (String column : columns) {
                String name = ColumnDescriptor.prefixed(tag, column);
                String label = tag.toUpperCase(Locale.ROOT) + "." + column;
                synced.add(descriptor(previous.get(name), name, label, false, tag));
            }
        });

        transform.setColumns(synced);
        log.debug("Synced {} column descriptor(s) from {} schema(s)", synced.size(), schemas.size());
    }

    private ColumnDescriptor descriptor(ColumnDescriptor previous, String name, String defaultLabel,
            boolean defaultInclude, String source) {
        if (previous == null) {
            return new ColumnDescriptor(name, defaultLabel, defaultInclude, source);
        }
        String label = previous.getLabel() == null || previous.getLabel().isEmpty() ? defaultLabel : previous.getLabel();
        return new ColumnDescriptor(name, label, previous.isInclude(), source);
    }
}

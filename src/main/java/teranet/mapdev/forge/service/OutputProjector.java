package teranet.mapdev.forge.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.forge.dto.PreviewColumnDto;
import teranet.mapdev.forge.dto.PreviewDto;
import teranet.mapdev.forge.model.ColumnDescriptor;
import teranet.mapdev.forge.model.ComputedColumnSpec;
import teranet.mapdev.forge.model.JoinStep;
import teranet.mapdev.forge.model.SortSpec;
import teranet.mapdev.forge.model.TransformSpec;
import teranet.mapdev.forge.util.ValueCoercion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Sorting, limiting and column projection of transformed rows.
 */
@Service
public class OutputProjector {

    /**
     * Stable string sort on the sort column; blank values sort as "".
     * Rows are returned unchanged when no sort column is set.
     */
    public List<Map<String, String>> sort(List<Map<String, String>> rows, SortSpec sort) {
        if (sort == null || sort.getColumnTrimmed().isEmpty()) {
            return rows;
        }
        String column = sort.getColumnTrimmed();
        Comparator<Map<String, String>> comparator =
                Comparator.comparing(row -> ValueCoercion.orEmpty(row.get(column)));
        if (sort.isDescending()) {
            comparator = comparator.reversed();
        }
        List<Map<String, String>> sorted = new ArrayList<>(rows);
        sorted.sort(comparator);
        return sorted;
    }

    /**
     * Keep the first {@code clampLimit(limit, fallback)} rows.
     */
    public List<Map<String, String>> limit(List<Map<String, String>> rows, Integer limit, int fallback) {
        int max = TransformSpec.clampLimit(limit, fallback);
        return rows.size() <= max ? rows : new ArrayList<>(rows.subList(0, max));
    }

    /**
     * Output columns in order: eligible names listed in {@code output_order}
     * first, then the remaining eligible columns in declaration order.
     *
     * Eligible means included, and for a right-hand dataset column, its join step enabled.
     * Computed columns follow the transform columns; a computed column reusing a
     * column name replaces that entry.
     */
    public List<PreviewColumnDto> selectColumns(TransformSpec transform) {
        Set<String> disabledSources = disabledJoinSources(transform.getJoins());

        Map<String, ColumnDescriptor> descriptors = new LinkedHashMap<>();
        for (ColumnDescriptor column : transform.getColumns()) {
            if (column != null && column.getName() != null && !column.getName().isEmpty()) {
                descriptors.put(column.getName(), column);
            }
        }
        for (ComputedColumnSpec computed : transform.getComputedColumns()) {
            if (computed != null && computed.getName() != null && !computed.getName().isBlank()) {
                String name = computed.getName().trim();
                String label = computed.getLabel() == null || computed.getLabel().isEmpty() ? name : computed.getLabel();
                descriptors.put(name, new ColumnDescriptor(name, label, computed.isInclude(),
                        ColumnDescriptor.COMPUTED_SOURCE));
            }
        }

        Map<String, ColumnDescriptor> eligible = new LinkedHashMap<>();
        descriptors.forEach((name, descriptor) -> {
            if (descriptor.isInclude() && !disabledSources.contains(sourceOf(descriptor))) {
                eligible.put(name, descriptor);
            }
        });

        Set<String> ordered = new LinkedHashSet<>();
        if (transform.getOutputOrder() != null) {
            for (String name : transform.getOutputOrder()) {
                if (name != null && eligible.containsKey(name)) {
                    ordered.add(name);
                }
            }
        }
        ordered.addAll(eligible.keySet());

        return ordered.stream()
                .map(name -> new PreviewColumnDto(name, labelOf(eligible.get(name))))
                .collect(Collectors.toList());
    }

    /**
     * Project rows onto the selected columns and cut them to {@code outputRows}.
     * Without selected columns every key of the first row is emitted, labelled by name.
     */
    public PreviewDto project(List<Map<String, String>> rows, List<PreviewColumnDto> columns, int outputRows) {
        List<Map<String, String>> visible = rows.subList(0, Math.min(rows.size(), Math.max(0, outputRows)));

        List<PreviewColumnDto> effective = columns;
        if (effective.isEmpty()) {
            effective = rows.isEmpty()
                    ? new ArrayList<>()
                    : rows.get(0).keySet().stream()
                            .map(name -> new PreviewColumnDto(name, name))
                            .collect(Collectors.toList());
        }

        List<Map<String, String>> projected = new ArrayList<>(visible.size());
        for (Map<String, String> row : visible) {
            Map<String, String> out = new LinkedHashMap<>();
            for (PreviewColumnDto column : effective) {
                String value = row.get(column.getName());
                out.put(column.getName(), value == null ? "" : value);
            }
            projected.add(out);
        }
        return new PreviewDto(projected, new ArrayList<>(effective));
    }

    private Set<String> disabledJoinSources(List<JoinStep> steps) {
        Set<String> disabled = new HashSet<>();
        if (steps != null) {
            for (JoinStep step : steps) {
                if (step != null && step.getRight() != null && !step.isEnabled()) {
                    disabled.add(step.getRight().trim());
                }
            }
        }
        return disabled;
    }

    private String sourceOf(ColumnDescriptor descriptor) {
        return descriptor.getSource() == null || descriptor.getSource().isEmpty()
                ? ColumnDescriptor.inferSource(descriptor.getName())
                : descriptor.getSource();
    }

    private String labelOf(ColumnDescriptor descriptor) {
        return descriptor.getLabel() == null || descriptor.getLabel().isEmpty()
                ? descriptor.getName()
                : descriptor.getLabel();
    }
}

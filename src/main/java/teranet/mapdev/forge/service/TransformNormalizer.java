package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.FilterGroup;
import teranet.mapdev.forge.model.FilterSpec;
import teranet.mapdev.forge.model.SortSpec;
import teranet.mapdev.forge.model.TransformSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One-way migration of a loaded transform into its canonical shape.
 *
 * - flat {@code filters} become a single filter group when no groups exist
 * - join configuration is canonicalized by {@link JoinNormalizer}
 * - missing lists and the sort block get their defaults
 *
 * Runs once when a transform enters the service; everything downstream
 * reads only the canonical fields.
 */
@Service
@Slf4j
public class TransformNormalizer {

    private final JoinNormalizer joinNormalizer;

    public TransformNormalizer(JoinNormalizer joinNormalizer) {
        this.joinNormalizer = joinNormalizer;
    }

    /**
     * Normalize a transform in place.
     *
     * @param transform the transform (null yields a fresh default transform)
     * @param rightTags declared right-hand dataset tags, in declaration order
     * @return the normalized transform
     */
    public TransformSpec normalize(TransformSpec transform, List<String> rightTags) {
        TransformSpec spec = transform != null ? transform : new TransformSpec();

        if (spec.getFilterGroups() == null) {
            List<FilterSpec> legacy = spec.getFilters() == null ? new ArrayList<>() : spec.getFilters();
            List<FilterGroup> groups = new ArrayList<>();
            groups.add(new FilterGroup(legacy.stream().filter(Objects::nonNull).collect(Collectors.toList())));
            spec.setFilterGroups(groups);
            if (!legacy.isEmpty()) {
                log.debug("Migrated {} legacy filter(s) into a filter group", legacy.size());
            }
        }
        spec.setFilters(new ArrayList<>());

        if (spec.getColumns() == null) {
            spec.setColumns(new ArrayList<>());
        }
        if (spec.getComputedColumns() == null) {
            spec.setComputedColumns(new ArrayList<>());
        }
        if (spec.getOutputOrder() == null) {
            spec.setOutputOrder(new ArrayList<>());
        }
        if (spec.getSort() == null) {
            spec.setSort(new SortSpec());
        }

        joinNormalizer.normalize(spec, rightTags);
        return spec;
    }
}

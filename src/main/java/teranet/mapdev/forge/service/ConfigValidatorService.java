package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.dto.ValidationResultDto;
import teranet.mapdev.forge.model.ColumnDescriptor;
import teranet.mapdev.forge.model.ComputedColumnSpec;
import teranet.mapdev.forge.model.FilterGroup;
import teranet.mapdev.forge.model.FilterOperator;
import teranet.mapdev.forge.model.FilterSpec;
import teranet.mapdev.forge.model.JoinKeyPair;
import teranet.mapdev.forge.model.JoinStep;
import teranet.mapdev.forge.model.JoinType;
import teranet.mapdev.forge.model.SortSpec;
import teranet.mapdev.forge.model.TransformSpec;
import teranet.mapdev.forge.model.UiSpec;
import teranet.mapdev.forge.transformer.ComputedColumnFunction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static checks of a transform against the discovered schemas.
 *
 * Errors block output generation, warnings do not. No data is read.
 * Expects a transform already normalized by TransformNormalizer.
 */
@Service
@Slf4j
public class ConfigValidatorService {

    private static final int MAX_LISTED_COLUMNS = 10;

    private final ComputedColumnFunctionFactory functionFactory;

    public ConfigValidatorService(ComputedColumnFunctionFactory functionFactory) {
        this.functionFactory = functionFactory;
    }

    /**
     * Validate a transform and its UI settings.
     *
     * @param schemas   header columns per dataset tag; the primary dataset is "a"
     * @param transform the normalized transform
     * @param ui        UI settings (may be null)
     * @return errors and warnings, in check order
     */
    public ValidationResultDto validate(Map<String, List<String>> schemas, TransformSpec transform, UiSpec ui) {
        ValidationResultDto result = new ValidationResultDto();
        List<String> errors = result.getErrors();
        List<String> warnings = result.getWarnings();

        List<String> primaryColumns = schemas.getOrDefault(ColumnDescriptor.PRIMARY_SOURCE, new ArrayList<>());
        Set<String> schemaColumns = schemaColumns(schemas);

        List<ColumnDescriptor> configured = transform.getColumns().stream()
                .filter(c -> c != null && c.getName() != null && !c.getName().isEmpty())
                .collect(Collectors.toList());
        Set<String> knownColumns = configured.isEmpty()
                ? schemaColumns
                : configured.stream().map(ColumnDescriptor::getName).collect(Collectors.toCollection(LinkedHashSet::new));

        if (primaryColumns.isEmpty()) {
            errors.add("Dataset A columns are missing. Upload CSV A in Sources.");
        }

        List<String> stale = configured.stream()
                .filter(c -> !ColumnDescriptor.COMPUTED_SOURCE.equals(c.getSource()))
                .map(ColumnDescriptor::getName)
                .filter(name -> !schemaColumns.contains(name))
                .collect(Collectors.toList());
        if (!stale.isEmpty()) {
            warnings.add("Some configured columns are no longer in the source datasets: " + listed(stale));
        }

        boolean anySelected = configured.stream().anyMatch(ColumnDescriptor::isInclude)
                || transform.getComputedColumns().stream().anyMatch(c -> c != null && c.isInclude());
        if (!anySelected) {
            warnings.add("No columns selected; the generated webapp will default to all available columns.");
        }

        validateFilters(transform.getFilterGroups(), knownColumns, errors, warnings);
        validateJoins(schemas, primaryColumns, configured, transform.getJoins(), errors, warnings);
        Set<String> computedNames = validateComputed(transform.getComputedColumns(), knownColumns, errors, warnings);

        Set<String> outputColumns = new LinkedHashSet<>(knownColumns);
        outputColumns.addAll(computedNames);
        validateSort(transform.getSort(), outputColumns, errors);
        validateUi(ui, outputColumns, warnings);

        log.debug("Validation finished with {} error(s) and {} warning(s)", errors.size(), warnings.size());
        return result;
    }

    private void validateFilters(List<FilterGroup> groups, Set<String> knownColumns,
            List<String> errors, List<String> warnings) {
        if (groups == null) {
            return;
        }
        for (int g = 0; g < groups.size(); g++) {
            FilterGroup group = groups.get(g);
            if (group == null || group.isEmpty()) {
                continue;
            }
            for (int f = 0; f < group.getFilters().size(); f++) {
                FilterSpec filter = group.getFilters().get(f);
                if (filter == null) {
                    continue;
                }
                String where = "Filter group " + (g + 1) + ", row " + (f + 1) + ": ";
                String column = trimmed(filter.getColumn());
                String op = trimmed(filter.getOp());
                if (column.isEmpty() || op.isEmpty()) {
                    errors.add(where + "missing column or operator.");
                } else if (!knownColumns.contains(column)) {
                    errors.add(where + "column not found: " + column);
                } else if (FilterOperator.fromName(op) == FilterOperator.UNKNOWN) {
                    warnings.add(where + "unknown operator: " + op + " (the filter matches every row).");
                }
            }
        }
    }

    private void validateJoins(Map<String, List<String>> schemas, List<String> primaryColumns,
            List<ColumnDescriptor> configured, List<JoinStep> steps,
            List<String> errors, List<String> warnings) {
        if (steps == null) {
            return;
        }
        Set<String> leftColumns = new LinkedHashSet<>(primaryColumns);

        for (JoinStep step : steps) {
            String tag = step.getRight();
            String dataset = "Dataset " + tag.toUpperCase(Locale.ROOT);

            if (!step.isEnabled()) {
                List<String> ignored = configured.stream()
                        .filter(ColumnDescriptor::isInclude)
                        .filter(c -> tag.equals(sourceOf(c)))
                        .map(ColumnDescriptor::getName)
                        .collect(Collectors.toList());
                if (!ignored.isEmpty()) {
                    warnings.add("Join to " + dataset + " is disabled; its selected columns are ignored: "
                            + listed(ignored));
                }
                continue;
            }

            List<String> rightColumns = schemas.get(tag);
            if (rightColumns == null || rightColumns.isEmpty()) {
                errors.add("Join to " + dataset + " is enabled but " + dataset
                        + " columns are missing. Upload CSV " + tag.toUpperCase(Locale.ROOT) + " in Sources.");
            }
            if (JoinType.fromName(step.getHow()).isEmpty()) {
                errors.add("Join to " + dataset + ": type must be left or inner.");
            }

            List<JoinKeyPair> keys = step.getKeys() == null ? new ArrayList<>() : step.getKeys();
            if (step.getCompleteKeys().isEmpty()) {
                errors.add("Join to " + dataset + " is enabled: add at least one join key pair.");
            }
            for (int k = 0; k < keys.size(); k++) {
                JoinKeyPair key = keys.get(k);
                if (key == null || key.isEmpty()) {
                    continue;
                }
                if (!key.isComplete()) {
                    errors.add("Join to " + dataset + ": key pair " + (k + 1) + " is incomplete.");
                    continue;
                }
                if (!leftColumns.contains(key.getLeftTrimmed())) {
                    errors.add("Join to " + dataset + ": invalid left join key: " + key.getLeftTrimmed());
                }
                if (rightColumns != null && !rightColumns.isEmpty() && !rightColumns.contains(key.getRightTrimmed())) {
                    errors.add("Join to " + dataset + ": invalid " + dataset + " join key: " + key.getRightTrimmed());
                }
            }

            // Later steps may key on this step's prefixed columns
            if (rightColumns != null) {
                rightColumns.forEach(c -> leftColumns.add(ColumnDescriptor.prefixed(tag, c)));
            }
        }
    }

    private Set<String> validateComputed(List<ComputedColumnSpec> computed, Set<String> knownColumns,
            List<String> errors, List<String> warnings) {
        Set<String> computedNames = new LinkedHashSet<>();
        for (int i = 0; i < computed.size(); i++) {
            ComputedColumnSpec spec = computed.get(i);
            if (spec == null) {
                continue;
            }
            String type = trimmed(spec.getType());
            String name = trimmed(spec.getName());
            if (type.isEmpty() || name.isEmpty()) {
                errors.add("Computed column " + (i + 1) + ": missing type or name.");
                continue;
            }
            if (knownColumns.contains(name) || computedNames.contains(name)) {
                warnings.add("Computed column " + (i + 1) + ": name collides with an existing column: " + name);
            }

            Optional<ComputedColumnFunction> function = functionFactory.getFunction(type);
            if (function.isEmpty()) {
                errors.add("Computed column " + (i + 1) + ": unsupported type: " + type);
                computedNames.add(name);
                continue;
            }

            List<String> inputs = function.get().inputColumns(spec);
            if (inputs.isEmpty()) {
                errors.add("Computed column " + name + ": no input column configured.");
            }
            List<String> missing = inputs.stream()
                    .filter(c -> !knownColumns.contains(c) && !computedNames.contains(c))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                errors.add("Computed column " + name + ": missing input columns: " + String.join(", ", missing));
            }
            computedNames.add(name);
        }
        return computedNames;
    }

    private void validateSort(SortSpec sort, Set<String> outputColumns, List<String> errors) {
        if (sort == null) {
            return;
        }
        String column = sort.getColumnTrimmed();
        if (!column.isEmpty() && !outputColumns.contains(column)) {
            errors.add("Sort column not found: " + column);
        }
        String direction = sort.getDirectionNormalized();
        if (!"asc".equals(direction) && !"desc".equals(direction)) {
            errors.add("Sort direction must be asc or desc.");
        }
    }

    private void validateUi(UiSpec ui, Set<String> outputColumns, List<String> warnings) {
        if (ui == null) {
            return;
        }
        String template = ui.getTemplate() == null || ui.getTemplate().isBlank()
                ? UiSpec.DEFAULT_TEMPLATE
                : ui.getTemplate().trim();
        if (!UiSpec.TEMPLATES.contains(template)) {
            warnings.add("Unknown template: " + template + " (defaulting to table).");
        }
        if (ui.getFrontendFilters() != null) {
            for (String column : ui.getFrontendFilters()) {
                String name = trimmed(column);
                if (!name.isEmpty() && !outputColumns.contains(name)) {
                    warnings.add("Frontend filter column not found: " + name);
                }
            }
        }
    }

    /**
     * Primary columns plus the prefixed columns of every right-hand dataset.
     */
    private Set<String> schemaColumns(Map<String, List<String>> schemas) {
        Set<String> columns = new LinkedHashSet<>(schemas.getOrDefault(ColumnDescriptor.PRIMARY_SOURCE, new ArrayList<>()));
        schemas.forEach((tag, cols) -> {
            if (!ColumnDescriptor.PRIMARY_SOURCE.equals(tag)) {
                cols.forEach(c -> columns.add(ColumnDescriptor.prefixed(tag, c)));
            }
        });
        return columns;
    }

    private String sourceOf(ColumnDescriptor descriptor) {
        return descriptor.getSource() == null || descriptor.getSource().isEmpty()
                ? ColumnDescriptor.inferSource(descriptor.getName())
                : descriptor.getSource();
    }

    private String listed(List<String> names) {
        String shown = names.stream().limit(MAX_LISTED_COLUMNS).collect(Collectors.joining(", "));
        return names.size() > MAX_LISTED_COLUMNS ? shown + ", ..." : shown;
    }

    private String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}

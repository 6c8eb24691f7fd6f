package teranet.mapdev.forge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.FilterGroup;
import teranet.mapdev.forge.model.FilterOperator;
import teranet.mapdev.forge.model.FilterSpec;
import teranet.mapdev.forge.util.ValueCoercion;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Evaluates filters against rows.
 *
 * A row passes a filter specification when it matches every filter of at
 * least one non-empty group. When every group is empty the specification
 * does not filter at all.
 *
 * Unparsable numbers and dates never raise; the comparison simply does not match.
 */
@Service
public class FilterEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(FilterEvaluator.class);

    // Cache: regex text -> compiled pattern (empty when it does not compile)
    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    /**
     * Filter rows, keeping their order.
     *
     * @param rows   input rows
     * @param groups filter groups (null or all empty means no filtering)
     * @return the matching rows
     */
    public List<Map<String, String>> apply(List<Map<String, String>> rows, List<FilterGroup> groups) {
        if (!hasActiveGroup(groups)) {
            return rows;
        }
        List<Map<String, String>> kept = rows.stream()
                .filter(row -> matchesAny(groups, row))
                .collect(Collectors.toList());
        logger.debug("Filter kept {} of {} rows", kept.size(), rows.size());
        return kept;
    }

    /**
     * OR over non-empty groups, AND within a group.
     */
    public boolean matchesAny(List<FilterGroup> groups, Map<String, String> row) {
        if (!hasActiveGroup(groups)) {
            return true;
        }
        for (FilterGroup group : groups) {
            if (group == null || group.isEmpty()) {
                continue;
            }
            boolean all = true;
            for (FilterSpec filter : group.getFilters()) {
                if (!matches(filter, row)) {
                    all = false;
                    break;
                }
            }
            if (all) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluate a single filter against a row. Absent fields count as blank.
     */
    public boolean matches(FilterSpec filter, Map<String, String> row) {
        if (filter == null) {
            return true;
        }
        String raw = filter.getColumn() == null ? null : row.get(filter.getColumn().trim());
        String field = ValueCoercion.orEmpty(raw);
        String value = filter.getValue() == null ? "" : filter.getValue();
        FilterOperator op = FilterOperator.fromName(filter.getOp());

        switch (op) {
            case BLANK:
                return ValueCoercion.isBlank(raw);
            case NOTBLANK:
                return !ValueCoercion.isBlank(raw);
            case CONTAINS:
                return lower(field).contains(lower(value));
            case CONTAINS_CS:
                return field.contains(value);
            case STARTSWITH:
                return lower(field).startsWith(lower(value));
            case STARTSWITH_CS:
                return field.startsWith(value);
            case ENDSWITH:
                return lower(field).endsWith(lower(value));
            case ENDSWITH_CS:
                return field.endsWith(value);
            case REGEX:
                return regexFind(value, field);
            case EQ:
                return field.equals(value);
            case NEQ:
                return !field.equals(value);
            case IN:
                return parseList(value).contains(field);
            case NOTIN:
                return !parseList(value).contains(field);
            case GT:
                return compareNumbers(field, value, (a, b) -> a > b);
            case GTE:
                return compareNumbers(field, value, (a, b) -> a >= b);
            case LT:
                return compareNumbers(field, value, (a, b) -> a < b);
            case LTE:
                return compareNumbers(field, value, (a, b) -> a <= b);
            case DATE_GT:
                return compareDates(field, value, (a, b) -> a.isAfter(b));
            case DATE_GTE:
                return compareDates(field, value, (a, b) -> !a.isBefore(b));
            case DATE_LT:
                return compareDates(field, value, (a, b) -> a.isBefore(b));
            case DATE_LTE:
                return compareDates(field, value, (a, b) -> !a.isAfter(b));
            case UNKNOWN:
            default:
                // Unrecognized operators pass every row
                return true;
        }
    }

    private boolean hasActiveGroup(List<FilterGroup> groups) {
        return groups != null && groups.stream().anyMatch(g -> g != null && !g.isEmpty());
    }

    private boolean regexFind(String pattern, String field) {
        Optional<Pattern> compiled = compiledPattern(pattern);
        if (compiled.isEmpty()) {
            return false;
        }
        try {
            return compiled.get().matcher(field).find();
        } catch (StackOverflowError e) {
            logger.debug("Filter regex '{}' overflowed while matching", pattern);
            return false;
        }
    }

    Optional<Pattern> compiledPattern(String pattern) {
        return patternCache.computeIfAbsent(pattern, this::compile);
    }

    private Optional<Pattern> compile(String pattern) {
        try {
            return Optional.of(Pattern.compile(pattern));
        } catch (PatternSyntaxException e) {
            logger.debug("Invalid filter regex '{}': {}", pattern, e.getDescription());
            return Optional.empty();
        }
    }

    private List<String> parseList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.toList());
    }

    private boolean compareNumbers(String field, String value, BiPredicate<Double, Double> comparison) {
        OptionalDouble left = ValueCoercion.toNumber(field);
        OptionalDouble right = ValueCoercion.toNumber(value);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        return comparison.test(left.getAsDouble(), right.getAsDouble());
    }

    private boolean compareDates(String field, String value,
            BiPredicate<LocalDateTime, LocalDateTime> comparison) {
        Optional<LocalDateTime> left = ValueCoercion.toDateTime(field);
        Optional<LocalDateTime> right = ValueCoercion.toDateTime(value);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        return comparison.test(left.get(), right.get());
    }

    private String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}

package teranet.mapdev.forge.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Supported filter operators.
 *
 * UNKNOWN is the arm every unrecognized operator name resolves to; the
 * evaluator treats it as a match so that a typo does not hide every row.
 */
public enum FilterOperator {
    BLANK("blank"),
    NOTBLANK("notblank"),
    CONTAINS("contains"),
    CONTAINS_CS("contains_cs"),
    STARTSWITH("startswith"),
    STARTSWITH_CS("startswith_cs"),
    ENDSWITH("endswith"),
    ENDSWITH_CS("endswith_cs"),
    REGEX("regex"),
    EQ("eq"),
    NEQ("neq"),
    IN("in"),
    NOTIN("notin"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    DATE_GT("date_gt"),
    DATE_GTE("date_gte"),
    DATE_LT("date_lt"),
    DATE_LTE("date_lte"),
    UNKNOWN("");

    private static final Map<String, FilterOperator> BY_NAME = Arrays.stream(values())
            .filter(op -> op != UNKNOWN)
            .collect(Collectors.toMap(FilterOperator::getName, Function.identity()));

    private final String name;

    FilterOperator(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Resolve an operator name (case-insensitive, surrounding whitespace ignored).
     *
     * @param name raw operator name from the configuration
     * @return the operator, or UNKNOWN
     */
    public static FilterOperator fromName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return BY_NAME.getOrDefault(name.trim().toLowerCase(Locale.ROOT), UNKNOWN);
    }
}

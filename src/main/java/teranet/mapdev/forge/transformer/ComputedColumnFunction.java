package teranet.mapdev.forge.transformer;

import teranet.mapdev.forge.model.ComputedColumnSpec;
import teranet.mapdev.forge.model.ComputedColumnType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Derivation of one computed column value from a row.
 *
 * One implementation exists per {@link ComputedColumnType}; they are
 * registered as Spring components and looked up through
 * ComputedColumnFunctionFactory.
 *
 * Implementations never throw on dirty data: anything that cannot be
 * parsed yields an empty string.
 */
public interface ComputedColumnFunction {

    /**
     * The computed column type handled by this function.
     */
    ComputedColumnType getType();

    /**
     * Compute the value for a row.
     *
     * @param row  the row, including earlier computed columns
     * @param spec the computed column declaration
     * @return the derived value (never null)
     */
    String derive(Map<String, String> row, ComputedColumnSpec spec);

    /**
     * Input columns read by this function, used for validation.
     * Defaults to the single {@code column} parameter.
     */
    default List<String> inputColumns(ComputedColumnSpec spec) {
        List<String> columns = new ArrayList<>();
        if (spec.getColumn() != null && !spec.getColumn().isBlank()) {
            columns.add(spec.getColumn().trim());
        }
        return columns;
    }
}

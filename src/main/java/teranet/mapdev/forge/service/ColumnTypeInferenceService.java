package teranet.mapdev.forge.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.ColumnType;
import teranet.mapdev.forge.model.DatasetSample;
import teranet.mapdev.forge.util.ValueCoercion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Guesses a semantic type per column from sampled string values.
 *
 * Precedence is datetime, then number, then boolean, then string, so that
 * date components that look numeric are not reported as numbers.
 */
@Service
public class ColumnTypeInferenceService {

    static final int MAX_SAMPLED_VALUES = 50;

    private static final double DATETIME_THRESHOLD = 0.80;
    private static final double NUMBER_THRESHOLD = 0.90;
    private static final double BOOLEAN_THRESHOLD = 0.95;

    private static final Set<String> BOOLEAN_TOKENS = Set.of("true", "false", "yes", "no", "y", "n", "0", "1");

    /**
     * Infer the type of a single column.
     *
     * @param values raw values in sample order; blanks are skipped
     * @return the inferred type, UNKNOWN when no value is non-blank
     */
    public ColumnType inferType(List<String> values) {
        List<String> sampled = new ArrayList<>();
        for (String value : values) {
            if (!ValueCoercion.isBlank(value)) {
                sampled.add(value.trim());
                if (sampled.size() >= MAX_SAMPLED_VALUES) {
                    break;
                }
            }
        }
        if (sampled.isEmpty()) {
            return ColumnType.UNKNOWN;
        }

        double total = sampled.size();
        long dates = sampled.stream().filter(v -> ValueCoercion.toDateTime(v).isPresent()).count();
        long numbers = sampled.stream().filter(v -> ValueCoercion.toNumber(v).isPresent()).count();
        long booleans = sampled.stream().filter(this::isBooleanToken).count();

        if (dates / total >= DATETIME_THRESHOLD) {
            return ColumnType.DATETIME;
        }
        if (numbers / total >= NUMBER_THRESHOLD) {
            return booleans / total >= BOOLEAN_THRESHOLD ? ColumnType.BOOLEAN : ColumnType.NUMBER;
        }
        if (booleans / total >= BOOLEAN_THRESHOLD) {
            return ColumnType.BOOLEAN;
        }
        return ColumnType.STRING;
    }

    /**
     * Infer a type for every header column of a sample, in header order.
     */
    public Map<String, ColumnType> inferTypes(DatasetSample sample) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (String column : sample.getColumns()) {
            List<String> values = new ArrayList<>();
            for (Map<String, String> row : sample.getRows()) {
                values.add(row.get(column));
            }
            types.put(column, inferType(values));
        }
        return types;
    }

    private boolean isBooleanToken(String value) {
        return BOOLEAN_TOKENS.contains(value.toLowerCase(Locale.ROOT));
    }
}

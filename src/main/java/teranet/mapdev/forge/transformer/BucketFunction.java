package teranet.mapdev.forge.transformer;

import org.springframework.stereotype.Component;
import teranet.mapdev.forge.model.ComputedColumnSpec;
import teranet.mapdev.forge.model.ComputedColumnType;
import teranet.mapdev.forge.util.ValueCoercion;

import java.math.BigDecimal;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Lower bound of the fixed-width bucket holding a numeric value:
 * {@code floor(value / size) * size}, rendered as an exact integer of any
 * magnitude.
 *
 * Examples (size 10): "57" gives "50", "-3" gives "-10", "abc" gives "".
 */
@Component
public class BucketFunction implements ComputedColumnFunction {

    @Override
    public ComputedColumnType getType() {
        return ComputedColumnType.BUCKET;
    }

    @Override
    public String derive(Map<String, String> row, ComputedColumnSpec spec) {
        int size = spec.getSize() == null ? ComputedColumnSpec.DEFAULT_BUCKET_SIZE : spec.getSize();
        String column = spec.getColumn() == null ? "" : spec.getColumn().trim();
        OptionalDouble value = ValueCoercion.toNumber(row.get(column));
        if (size <= 0 || value.isEmpty() || !Double.isFinite(value.getAsDouble())) {
            return "";
        }
        double base = Math.floor(value.getAsDouble() / size) * size;
        return new BigDecimal(base).toBigInteger().toString();
    }
}

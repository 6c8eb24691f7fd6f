package teranet.mapdev.forge.transformer;

import org.springframework.stereotype.Component;
import teranet.mapdev.forge.model.ComputedColumnSpec;
import teranet.mapdev.forge.model.ComputedColumnType;
import teranet.mapdev.forge.util.ValueCoercion;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * First non-blank input value, or "" when every input is blank.
 */
@Component
public class CoalesceFunction implements ComputedColumnFunction {

    @Override
    public ComputedColumnType getType() {
        return ComputedColumnType.COALESCE;
    }

    @Override
    public String derive(Map<String, String> row, ComputedColumnSpec spec) {
        for (String column : inputColumns(spec)) {
            String value = row.get(column);
            if (!ValueCoercion.isBlank(value)) {
                return value;
            }
        }
        return "";
    }

    @Override
    public List<String> inputColumns(ComputedColumnSpec spec) {
        return spec.getColumns() == null ? new ArrayList<>() : spec.getColumns();
    }
}

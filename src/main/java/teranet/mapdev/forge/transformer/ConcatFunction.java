package teranet.mapdev.forge.transformer;

import org.springframework.stereotype.Component;
import teranet.mapdev.forge.model.ComputedColumnSpec;
import teranet.mapdev.forge.model.ComputedColumnType;
import teranet.mapdev.forge.util.ValueCoercion;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Joins the input columns with the declared separator. Blank inputs contribute "".
 *
 * Example: columns [first, last], sep " " on {first: "Ada", last: "Lovelace"} gives "Ada Lovelace".
 */
@Component
public class ConcatFunction implements ComputedColumnFunction {

    @Override
    public ComputedColumnType getType() {
        return ComputedColumnType.CONCAT;
    }

    @Override
    public String derive(Map<String, String> row, ComputedColumnSpec spec) {
        String separator = spec.getSep() == null ? "" : spec.getSep();
        return inputColumns(spec).stream()
                .map(column -> ValueCoercion.orEmpty(row.get(column)))
                .collect(Collectors.joining(separator));
    }

    @Override
    public List<String> inputColumns(ComputedColumnSpec spec) {
        return spec.getColumns() == null ? new ArrayList<>() : spec.getColumns();
    }
}

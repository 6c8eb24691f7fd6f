package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.ComputedColumnSpec;
import teranet.mapdev.forge.transformer.ComputedColumnFunction;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Appends computed columns to rows in declaration order, so a later
 * computed column can read the output of an earlier one.
 *
 * Rows are updated in place. Declarations without a name or with an
 * unsupported type are skipped.
 */
@Service
@Slf4j
public class ComputedColumnDeriver {

    private final ComputedColumnFunctionFactory functionFactory;

    public ComputedColumnDeriver(ComputedColumnFunctionFactory functionFactory) {
        this.functionFactory = functionFactory;
    }

    public void derive(List<Map<String, String>> rows, List<ComputedColumnSpec> specs) {
        if (specs == null || specs.isEmpty()) {
            return;
        }
        for (Map<String, String> row : rows) {
            deriveRow(row, specs);
        }
        log.debug("Derived {} computed column(s) over {} rows", specs.size(), rows.size());
    }

    public void deriveRow(Map<String, String> row, List<ComputedColumnSpec> specs) {
        for (ComputedColumnSpec spec : specs) {
            if (spec == null || spec.getName() == null || spec.getName().isBlank()) {
                continue;
            }
            Optional<ComputedColumnFunction> function = functionFactory.getFunction(spec.getType());
            if (function.isPresent()) {
                row.put(spec.getName().trim(), function.get().derive(row, spec));
            }
        }
    }
}

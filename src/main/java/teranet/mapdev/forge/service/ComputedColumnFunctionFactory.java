package teranet.mapdev.forge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.forge.model.ComputedColumnType;
import teranet.mapdev.forge.transformer.ComputedColumnFunction;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of computed column functions by type name.
 *
 * Every {@link ComputedColumnFunction} component is registered at startup.
 * Unknown type names resolve to an empty Optional; the deriver skips them
 * and the validator reports them.
 */
@Service
@Slf4j
public class ComputedColumnFunctionFactory {

    private final Map<ComputedColumnType, ComputedColumnFunction> functions =
            new EnumMap<>(ComputedColumnType.class);

    public ComputedColumnFunctionFactory(List<ComputedColumnFunction> available) {
        for (ComputedColumnFunction function : available) {
            ComputedColumnFunction previous = functions.put(function.getType(), function);
            if (previous != null) {
                throw new IllegalStateException("Duplicate computed column function for type "
                        + function.getType().getName() + ": " + previous.getClass().getSimpleName()
                        + " and " + function.getClass().getSimpleName());
            }
        }
        log.info("Registered {} computed column function(s): {}", functions.size(), functions.keySet());
    }

    /**
     * Look up the function for a type name (case-insensitive).
     *
     * @param typeName the declared computed column type
     * @return the function, or empty for unsupported types
     */
    public Optional<ComputedColumnFunction> getFunction(String typeName) {
        return ComputedColumnType.fromName(typeName).map(functions::get);
    }
}

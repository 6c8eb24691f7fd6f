package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Names accepted by the transform configuration, for building editors.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OperatorCatalogDto {

    @JsonProperty("filter_operators")
    private List<String> filterOperators;

    @JsonProperty("computed_types")
    private List<String> computedTypes;

    @JsonProperty("join_types")
    private List<String> joinTypes;

    @JsonProperty("templates")
    private List<String> templates;
}

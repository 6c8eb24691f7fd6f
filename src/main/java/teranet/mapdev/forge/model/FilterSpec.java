package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single row predicate: column, operator name and a raw string operand.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterSpec {

    @JsonProperty("column")
    private String column;

    @JsonProperty("op")
    @JsonAlias("operator")
    private String op;

    @JsonProperty("value")
    private String value;
}

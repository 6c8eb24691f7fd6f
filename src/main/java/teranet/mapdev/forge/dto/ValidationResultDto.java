package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Static validation outcome. Errors block output generation, warnings do not.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResultDto {

    @JsonProperty("errors")
    private List<String> errors = new ArrayList<>();

    @JsonProperty("warnings")
    private List<String> warnings = new ArrayList<>();

    @JsonIgnore
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

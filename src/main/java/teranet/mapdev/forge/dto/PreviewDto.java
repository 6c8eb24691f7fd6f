package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Preview of the transformed output: projected rows in output column order
 * and the matching column headers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PreviewDto {

    @JsonProperty("rows")
    private List<Map<String, String>> rows = new ArrayList<>();

    @JsonProperty("columns")
    private List<PreviewColumnDto> columns = new ArrayList<>();
}

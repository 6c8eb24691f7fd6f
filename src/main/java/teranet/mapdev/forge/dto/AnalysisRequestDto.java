package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import teranet.mapdev.forge.model.TransformSpec;
import teranet.mapdev.forge.model.UiSpec;

/**
 * Request body for the transform endpoints.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequestDto {

    @JsonProperty("transform")
    private TransformSpec transform = new TransformSpec();

    @JsonProperty("ui")
    private UiSpec ui = new UiSpec();

    /** Optional override of the preview output row cap. */
    @JsonProperty("output_rows")
    private Integer outputRows;
}

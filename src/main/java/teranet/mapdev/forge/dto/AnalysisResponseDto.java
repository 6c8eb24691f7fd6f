package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Combined validation, join health and preview for one transform.
 * Join health and preview are null when they could not be produced.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponseDto {

    @JsonProperty("status")
    private String status;

    @JsonProperty("validation")
    private ValidationResultDto validation;

    @JsonProperty("join_health")
    private JoinHealthDto joinHealth;

    @JsonProperty("preview")
    private PreviewDto preview;
}

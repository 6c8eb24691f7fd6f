package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import teranet.mapdev.forge.model.JoinKeyPair;

import java.util.List;

/**
 * Sample-based key quality metrics for one join step.
 * A rate is null when its denominator is zero.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JoinStepHealthDto {

    @JsonProperty("right")
    private String right;

    @JsonProperty("how")
    private String how;

    @JsonProperty("keys")
    private List<JoinKeyPair> keys;

    @JsonProperty("left_rows")
    private int leftRows;

    @JsonProperty("right_rows")
    private int rightRows;

    @JsonProperty("left_key_blank_rate")
    private Double leftKeyBlankRate;

    @JsonProperty("right_key_blank_rate")
    private Double rightKeyBlankRate;

    @JsonProperty("left_key_duplicate_rate")
    private Double leftKeyDuplicateRate;

    @JsonProperty("right_key_duplicate_rate")
    private Double rightKeyDuplicateRate;

    @JsonProperty("match_rate")
    private Double matchRate;
}

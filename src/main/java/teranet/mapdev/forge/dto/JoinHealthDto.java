package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinHealthDto {

    @JsonProperty("steps")
    private List<JoinStepHealthDto> steps = new ArrayList<>();
}

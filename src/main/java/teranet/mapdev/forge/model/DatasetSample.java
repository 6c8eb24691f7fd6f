package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Bounded sample of a delimited source: the header columns in file order
 * and the first rows, each an ordered column -> string mapping.
 *
 * The row cap is a sampling limit, so anything computed from a sample is
 * an approximation of the full dataset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatasetSample {

    @JsonProperty("columns")
    private List<String> columns = new ArrayList<>();

    @JsonProperty("sample_rows")
    private List<Map<String, String>> rows = new ArrayList<>();

    public static DatasetSample empty() {
        return new DatasetSample(new ArrayList<>(), new ArrayList<>());
    }
}

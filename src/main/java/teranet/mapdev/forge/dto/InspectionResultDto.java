package teranet.mapdev.forge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import teranet.mapdev.forge.model.ColumnType;

import java.util.List;
import java.util.Map;

/**
 * Result of inspecting a delimited source: header, sample rows and a
 * guessed type per column.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InspectionResultDto {

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("delimiter")
    private String delimiter;

    @JsonProperty("columns")
    private List<String> columns;

    @JsonProperty("sample_rows")
    private List<Map<String, String>> sampleRows;

    @JsonProperty("column_types")
    private Map<String, ColumnType> columnTypes;
}

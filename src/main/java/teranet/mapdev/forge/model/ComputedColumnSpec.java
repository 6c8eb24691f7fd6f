package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Declaration of a derived column.
 *
 * Parameters by type:
 * - concat: columns, sep
 * - coalesce: columns
 * - date_format: column, format (strftime style or java.time pattern, default %Y-%m-%d)
 * - bucket: column, size (default 10)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComputedColumnSpec {

    public static final String DEFAULT_DATE_FORMAT = "%Y-%m-%d";
    public static final int DEFAULT_BUCKET_SIZE = 10;

    @JsonProperty("name")
    private String name;

    @JsonProperty("label")
    private String label;

    @JsonProperty("type")
    private String type;

    @JsonProperty("columns")
    @Builder.Default
    private List<String> columns = new ArrayList<>();

    @JsonProperty("sep")
    private String sep;

    @JsonProperty("column")
    private String column;

    @JsonProperty("format")
    private String format;

    @JsonProperty("size")
    private Integer size;

    @JsonProperty("include")
    private boolean include;
}

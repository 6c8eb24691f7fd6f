package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output column entry of a transform.
 *
 * The source is the tag of the dataset the column comes from: the primary
 * dataset tag, a right-hand dataset tag (name prefixed "tag__"), or
 * "computed" for derived columns.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColumnDescriptor {

    public static final String PRIMARY_SOURCE = "a";
    public static final String COMPUTED_SOURCE = "computed";
    public static final String PREFIX_SEPARATOR = "__";

    @JsonProperty("name")
    private String name;

    @JsonProperty("label")
    private String label;

    @JsonProperty("include")
    private boolean include;

    @JsonProperty("source")
    private String source;

    /**
     * Build the prefixed column name a right-hand dataset column gets once joined.
     *
     * @param tag    dataset tag, e.g. "b"
     * @param column original column name
     * @return e.g. "b__customer_id"
     */
    public static String prefixed(String tag, String column) {
        return tag + PREFIX_SEPARATOR + column;
    }

    /**
     * Infer the source tag from a column name when a descriptor carries none.
     */
    public static String inferSource(String name) {
        if (name != null) {
            int idx = name.indexOf(PREFIX_SEPARATOR);
            if (idx > 0) {
                return name.substring(0, idx);
            }
        }
        return PRIMARY_SOURCE;
    }
}

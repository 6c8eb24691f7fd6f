package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative transform: column selection, filters, joins, computed
 * columns, output order, sort and limit.
 *
 * {@code filters}, {@code join_enabled} and {@code join} are legacy fields.
 * They are read once by TransformNormalizer and afterwards only written
 * from the canonical {@code filter_groups} and {@code joins}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransformSpec {

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 200000;

    @JsonProperty("columns")
    private List<ColumnDescriptor> columns = new ArrayList<>();

    @JsonProperty("filter_groups")
    private List<FilterGroup> filterGroups;

    @JsonProperty("filters")
    private List<FilterSpec> filters;

    @JsonProperty("joins")
    private List<JoinStep> joins;

    @JsonProperty("join_enabled")
    private Boolean joinEnabled;

    @JsonProperty("join")
    private LegacyJoin join;

    @JsonProperty("computed_columns")
    private List<ComputedColumnSpec> computedColumns = new ArrayList<>();

    @JsonProperty("output_order")
    private List<String> outputOrder = new ArrayList<>();

    @JsonProperty("sort")
    private SortSpec sort = new SortSpec();

    @JsonProperty("limit")
    private Integer limit;

    /**
     * Clamp a requested row limit into [1, 200000]; a missing or zero limit falls back to the given default.
     */
    public static int clampLimit(Integer requested, int fallback) {
        int value = requested == null || requested == 0 ? fallback : requested;
        return Math.max(MIN_LIMIT, Math.min(value, MAX_LIMIT));
    }
}

package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Presentation settings of the generated table view. Only the template
 * identifier and the frontend filter columns are checked by validation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UiSpec {

    public static final String DEFAULT_TEMPLATE = "table";
    public static final Set<String> TEMPLATES = Set.of("table", "sidebar_filters", "master_detail", "chart_table");

    @JsonProperty("template")
    private String template = DEFAULT_TEMPLATE;

    @JsonProperty("row_details")
    private boolean rowDetails = true;

    @JsonProperty("pagination")
    private boolean pagination;

    @JsonProperty("page_size")
    private int pageSize = 200;

    @JsonProperty("frontend_filters")
    private List<String> frontendFilters = new ArrayList<>();

    @JsonProperty("chart")
    private Chart chart = new Chart();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Chart {
        @JsonProperty("enabled")
        private boolean enabled;

        @JsonProperty("type")
        private String type = "bar";

        @JsonProperty("column")
        private String column = "";

        @JsonProperty("x_column")
        private String xColumn = "";

        @JsonProperty("y_column")
        private String yColumn = "";

        @JsonProperty("agg")
        private String agg = "count";

        @JsonProperty("top_n")
        private int topN = 12;

        @JsonProperty("bins")
        private int bins = 16;

        @JsonProperty("max_points")
        private int maxPoints = 600;
    }
}

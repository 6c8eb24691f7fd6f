package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Filters combined with AND. Groups are combined with OR.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FilterGroup {

    @JsonProperty("filters")
    private List<FilterSpec> filters = new ArrayList<>();

    public boolean isEmpty() {
        return filters == null || filters.isEmpty();
    }
}

package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SortSpec {

    @JsonProperty("column")
    private String column = "";

    @JsonProperty("direction")
    private String direction = "asc";

    @JsonIgnore
    public String getColumnTrimmed() {
        return column == null ? "" : column.trim();
    }

    @JsonIgnore
    public String getDirectionNormalized() {
        return direction == null || direction.isBlank() ? "asc" : direction.trim().toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public boolean isDescending() {
        return "desc".equals(getDirectionNormalized());
    }
}

package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Equality condition between a left-side column and a right-hand dataset column.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinKeyPair {

    @JsonProperty("left")
    private String left = "";

    @JsonProperty("right")
    private String right = "";

    public static JoinKeyPair placeholder() {
        return new JoinKeyPair("", "");
    }

    @JsonIgnore
    public String getLeftTrimmed() {
        return left == null ? "" : left.trim();
    }

    @JsonIgnore
    public String getRightTrimmed() {
        return right == null ? "" : right.trim();
    }

    /** Both sides named. */
    @JsonIgnore
    public boolean isComplete() {
        return !getLeftTrimmed().isEmpty() && !getRightTrimmed().isEmpty();
    }

    /** Neither side named. */
    @JsonIgnore
    public boolean isEmpty() {
        return getLeftTrimmed().isEmpty() && getRightTrimmed().isEmpty();
    }
}

package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One configured join of the current row set against a named right-hand dataset.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinStep {

    @JsonProperty("right")
    private String right;

    @JsonProperty("enabled")
    private boolean enabled;

    @JsonProperty("how")
    private String how = JoinType.LEFT.getName();

    @JsonProperty("keys")
    private List<JoinKeyPair> keys = new ArrayList<>();

    public static JoinStep disabled(String right) {
        List<JoinKeyPair> keys = new ArrayList<>();
        keys.add(JoinKeyPair.placeholder());
        return new JoinStep(right, false, JoinType.LEFT.getName(), keys);
    }

    /**
     * Key pairs with both sides named, in declared order.
     */
    @JsonIgnore
    public List<JoinKeyPair> getCompleteKeys() {
        if (keys == null) {
            return new ArrayList<>();
        }
        return keys.stream()
                .filter(k -> k != null && k.isComplete())
                .collect(Collectors.toList());
    }

    /**
     * Join type; anything other than "inner" behaves as a left join at run time.
     */
    @JsonIgnore
    public JoinType getJoinType() {
        return JoinType.fromName(how).orElse(JoinType.LEFT);
    }

    /**
     * True when the step takes part in execution: enabled and keyed.
     */
    @JsonIgnore
    public boolean isExecutable() {
        return enabled && right != null && !right.isBlank() && !getCompleteKeys().isEmpty();
    }
}

package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-join shape used by older configurations ({@code join_enabled} plus
 * {@code join}). It always mirrors the first canonical join step.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LegacyJoin {

    @JsonProperty("how")
    private String how = JoinType.LEFT.getName();

    @JsonProperty("keys")
    private List<KeyPair> keys = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class KeyPair {
        @JsonProperty("a")
        private String a = "";

        @JsonProperty("b")
        private String b = "";
    }
}

package teranet.mapdev.forge.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic type guessed for a column from its sample values.
 */
public enum ColumnType {
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATETIME("datetime"),
    STRING("string"),
    UNKNOWN("unknown");

    private final String value;

    ColumnType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

package teranet.mapdev.forge.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported derived-column kinds.
 */
public enum ComputedColumnType {
    CONCAT("concat"),
    COALESCE("coalesce"),
    DATE_FORMAT("date_format"),
    BUCKET("bucket");

    private final String name;

    ComputedColumnType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** concat and coalesce read a list of columns, the others a single column. */
    public boolean isMultiColumn() {
        return this == CONCAT || this == COALESCE;
    }

    public static Optional<ComputedColumnType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ComputedColumnType type : values()) {
            if (type.name.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

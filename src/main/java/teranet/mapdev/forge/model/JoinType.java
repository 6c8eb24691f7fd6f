package teranet.mapdev.forge.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Join behaviour for left rows that find no right-hand match.
 */
public enum JoinType {
    /** Keep unmatched left rows unmerged. */
    LEFT("left"),
    /** Drop unmatched left rows. */
    INNER("inner");

    private final String name;

    JoinType(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Optional<JoinType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (JoinType type : values()) {
            if (type.name.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

package io.framekit.frame;

import io.framekit.core.InvalidArgumentException;

import java.util.Locale;

public enum JoinType {
    /** Matched pairs only. */
    INNER,
    /** Every left row, matched or with null right columns. */
    LEFT,
    /** Every right row, matched or with null left columns. */
    RIGHT,
    /** Left join plus the right rows that matched nothing. */
    OUTER,
    /** Cartesian product; takes no keys. */
    CROSS;

    /**
     * Case-insensitive lookup by name.
     *
     * @throws InvalidArgumentException for an unknown join type
     */
    public static JoinType fromName(String name) {
        for (var type : values()) {
            if (type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new InvalidArgumentException("invalid join type: \"" + name + "\"");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package tech.rowguard.platform.policy;

import java.util.Locale;

/**
 * How a row-level security filter composes with the other filters on a table.
 *
 * <ul>
 *   <li>{@link #REGULAR} - applied to members of the associated roles</li>
 *   <li>{@link #BASE} - applied to everyone except members of the associated roles</li>
 * </ul>
 *
 * The stored value is the label used in the metadata database.
 */
public enum FilterType {

    REGULAR("Regular"),
    BASE("Base");

    private final String storedValue;

    FilterType(String storedValue) {
        this.storedValue = storedValue;
    }

    public String storedValue() {
        return storedValue;
    }

    /**
     * Parse a filter type from either its enum name or its stored label,
     * ignoring case ("REGULAR", "Regular" and "regular" are equivalent).
     *
     * @throws IllegalArgumentException if the value matches no filter type
     */
    public static FilterType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Filter type must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (FilterType type : values()) {
            if (type.name().equals(normalized) || type.storedValue.toUpperCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown filter type: " + value);
    }
}

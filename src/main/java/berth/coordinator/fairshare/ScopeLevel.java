package berth.coordinator.fairshare;

import java.util.Locale;

/**
 * Hierarchy level of a fair share scope.
 */
public enum ScopeLevel {
    DOMAIN,
    PROJECT,
    USER;

    /** Lower-case name used in URLs and storage. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ScopeLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("scope level is required");
        }
        try {
            return ScopeLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scope level: " + value);
        }
    }
}

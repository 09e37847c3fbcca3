package io.fullerstack.components.registry;

import java.util.Locale;

/**
 * What a registry does when a name is registered a second time.
 * Fixed per registry instance.
 */
public enum DuplicatePolicy {

    /** Throw {@link DuplicateComponentException}; the existing record stays. */
    REJECT,

    /** Replace the existing record with the new one. */
    REPLACE;

    /**
     * Parses a configuration value ("reject" / "replace", case-insensitive).
     *
     * @param value configured value
     * @return matching policy
     * @throws IllegalArgumentException if the value names no policy
     */
    public static DuplicatePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("duplicate policy cannot be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

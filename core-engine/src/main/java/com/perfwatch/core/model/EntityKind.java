package com.perfwatch.core.model;

import java.util.Locale;

/**
 * Kind of monitored entity.
 *
 * @since 1.0.0
 */
public enum EntityKind {
    TEAM,
    WORKFLOW;

    /**
     * Parse a configuration value such as {@code "team"} or {@code "WORKFLOW"}.
     *
     * @param value case-insensitive kind name
     * @return the matching kind
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static EntityKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity kind must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown entity kind: '" + value + "'. Supported: team, workflow", e);
        }
    }
}

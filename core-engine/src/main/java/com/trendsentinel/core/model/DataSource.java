package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Family of raw events an analysis run draws its series from.
 *
 * @since 1.0.0
 */
public enum DataSource {

    ANALYTICS("analytics"),
    FEEDBACK("feedback"),
    INVENTORY("inventory"),
    RECIPES("recipes"),
    ALL("all");

    private final String code;

    DataSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Whether a run configured with this selector reads events of
     * {@code family}.
     *
     * @param family the family an event belongs to
     * @return {@code true} if this is {@link #ALL} or equal to {@code family}
     */
    public boolean includes(DataSource family) {
        return this == ALL || this == family;
    }

    /**
     * @param code data source code, case-insensitive
     * @return the matching data source
     * @throws IllegalArgumentException if the code is unknown
     */
    public static DataSource fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (DataSource source : values()) {
                if (source.code.equals(normalized)) {
                    return source;
                }
            }
        }
        throw new IllegalArgumentException(
                "Unknown data source: '" + code + "'. Supported: analytics, feedback, inventory, recipes, all");
    }
}

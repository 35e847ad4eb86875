package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Canonical trend type stored on a {@link Trend}.
 *
 * @since 1.0.0
 */
public enum TrendType {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable"),
    SEASONAL("seasonal"),
    CYCLICAL("cyclical");

    private final String code;

    TrendType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolve a trend type from its code, ignoring case.
     *
     * @param code trend type code, e.g. {@code "increasing"}
     * @return the matching type
     * @throws IllegalArgumentException if the code is unknown
     */
    public static TrendType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (TrendType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown trend type: '" + code + "'");
    }
}

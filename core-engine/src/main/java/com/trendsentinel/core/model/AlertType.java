package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of alert a subscription listens for.
 *
 * <p>
 * Only {@link #THRESHOLD}, {@link #EMERGENCE} and {@link #ACCELERATION} carry
 * a primary matching condition; the remaining types are accepted in
 * subscriptions but never match a trend.
 * </p>
 *
 * @since 1.0.0
 */
public enum AlertType {

    THRESHOLD("threshold"),
    EMERGENCE("emergence"),
    ACCELERATION("acceleration"),
    PEAK("peak"),
    DECLINE("decline"),
    ANOMALY("anomaly");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * @param code alert type code, case-insensitive
     * @return the matching type, or empty if unknown
     */
    public static Optional<AlertType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AlertType type : values()) {
            if (type.code.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

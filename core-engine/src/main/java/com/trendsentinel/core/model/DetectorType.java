package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Raw pattern type reported by a detector.
 *
 * <p>
 * Declaration order is the tie-break order used when merging results of a run
 * (metric name first, then detector type).
 * </p>
 *
 * @since 1.0.0
 */
public enum DetectorType {

    GROWTH("growth"),
    DECLINE("decline"),
    CHANGE_POINT("change_point"),
    SEASONAL("seasonal"),
    ANOMALY("anomaly");

    private final String code;

    DetectorType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

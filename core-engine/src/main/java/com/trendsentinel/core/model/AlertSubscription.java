package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A user-defined alert rule matched against newly classified trends.
 *
 * <p>
 * Subscriptions are created and deleted outside the engine; the engine only
 * reads them. Call {@link #validate()} to check that the fields required by
 * the declared alert type are present; the alert evaluator skips
 * subscriptions that fail validation instead of aborting.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertSubscription implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;

    /** Reference to the owning user. */
    private String ownerId;

    /** Alert type code, normalised to lowercase. */
    private String alertType;

    /** Minimum trend significance for threshold alerts. */
    private Double threshold;

    private AlertConditions conditions = new AlertConditions();

    private boolean active = true;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the subscription for its declared alert type.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (id == null || id.isBlank()) {
            errors.add("Subscription 'id' is required");
        }

        Optional<AlertType> type = resolveAlertType();
        if (type.isEmpty()) {
            errors.add("Unknown alert type: '" + alertType
                    + "'. Supported: threshold, emergence, acceleration, peak, decline, anomaly");
        } else {
            switch (type.get()) {
                case THRESHOLD -> {
                    if (threshold == null || !(threshold >= 0 && threshold <= 1)) {
                        errors.add("Threshold subscription '" + id + "' requires 'threshold' in [0, 1]");
                    }
                }
                case ACCELERATION -> {
                    if (conditions == null || conditions.getMinGrowthRate() == null) {
                        errors.add("Acceleration subscription '" + id + "' requires 'conditions.minGrowthRate'");
                    }
                }
                default -> {
                    // no type-specific fields
                }
            }
        }

        if (conditions != null) {
            conditions.collectErrors(id, errors);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AlertSubscription: " + String.join("; ", errors));
        }
    }

    /**
     * @return the typed alert type, or empty if the code is unknown
     */
    public Optional<AlertType> resolveAlertType() {
        return AlertType.fromCode(alertType);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getAlertType() {
        return alertType;
    }

    /**
     * Set the alert type, normalised to lowercase.
     *
     * @param alertType alert type code
     */
    public void setAlertType(String alertType) {
        this.alertType = alertType != null ? alertType.toLowerCase(Locale.ROOT) : null;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public AlertConditions getConditions() {
        return conditions;
    }

    public void setConditions(AlertConditions conditions) {
        this.conditions = conditions;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertSubscription that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "AlertSubscription{" +
                "id='" + id + '\'' +
                ", ownerId='" + ownerId + '\'' +
                ", alertType='" + alertType + '\'' +
                ", threshold=" + threshold +
                ", conditions=" + conditions +
                ", active=" + active +
                '}';
    }
}

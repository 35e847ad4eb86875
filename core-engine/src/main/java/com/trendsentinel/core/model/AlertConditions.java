package com.trendsentinel.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Optional secondary filters of an {@link AlertSubscription}.
 *
 * <p>
 * Every field may be {@code null} (or an empty list), meaning "no filter".
 * </p>
 *
 * @since 1.0.0
 */
public class AlertConditions implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Minimum change percent required by acceleration alerts. */
    private Double minGrowthRate;

    /** Minimum trend significance, in [0, 1]. */
    private Double minConfidence;

    /** At least one of these must appear among the trend keywords. */
    private List<String> keywords = new ArrayList<>();

    /** Trend type codes the trend must belong to. */
    private List<String> trendTypes = new ArrayList<>();

    /**
     * Collect validation problems into {@code errors}.
     *
     * @param owner  label used in messages, e.g. the subscription id
     * @param errors sink for error messages
     */
    void collectErrors(String owner, List<String> errors) {
        if (minGrowthRate != null && (!Double.isFinite(minGrowthRate) || minGrowthRate < 0)) {
            errors.add("Subscription '" + owner + "' has invalid 'minGrowthRate': " + minGrowthRate);
        }
        if (minConfidence != null && !(minConfidence >= 0 && minConfidence <= 1)) {
            errors.add("Subscription '" + owner + "' requires 'minConfidence' in [0, 1], got: " + minConfidence);
        }
        for (String trendType : trendTypes) {
            try {
                TrendType.fromCode(trendType);
            } catch (IllegalArgumentException e) {
                errors.add("Subscription '" + owner + "': " + e.getMessage());
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public Double getMinGrowthRate() {
        return minGrowthRate;
    }

    public void setMinGrowthRate(Double minGrowthRate) {
        this.minGrowthRate = minGrowthRate;
    }

    public Double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(Double minConfidence) {
        this.minConfidence = minConfidence;
    }

    /**
     * @return unmodifiable list of keywords
     */
    public List<String> getKeywords() {
        return Collections.unmodifiableList(keywords);
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords != null ? new ArrayList<>(keywords) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of trend type codes
     */
    public List<String> getTrendTypes() {
        return Collections.unmodifiableList(trendTypes);
    }

    public void setTrendTypes(List<String> trendTypes) {
        this.trendTypes = trendTypes != null ? new ArrayList<>(trendTypes) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertConditions that))
            return false;
        return Objects.equals(minGrowthRate, that.minGrowthRate)
                && Objects.equals(minConfidence, that.minConfidence)
                && keywords.equals(that.keywords)
                && trendTypes.equals(that.trendTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minGrowthRate, minConfidence, keywords, trendTypes);
    }

    @Override
    public String toString() {
        return "AlertConditions{" +
                "minGrowthRate=" + minGrowthRate +
                ", minConfidence=" + minConfidence +
                ", keywords=" + keywords +
                ", trendTypes=" + trendTypes +
                '}';
    }
}

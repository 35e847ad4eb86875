package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Record of a subscription matching a trend.
 *
 * <p>
 * Immutable. Only the alert evaluator creates instances; they are recorded in
 * the store and handed to the notifier.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String subscriptionId;
    private final String trendId;
    private final Instant triggeredAt;
    private final String message;

    private AlertEvent(Builder builder) {
        this.subscriptionId = Objects.requireNonNull(builder.subscriptionId, "subscriptionId must not be null");
        this.trendId = Objects.requireNonNull(builder.trendId, "trendId must not be null");
        this.triggeredAt = Objects.requireNonNull(builder.triggeredAt, "triggeredAt must not be null");
        this.message = Objects.requireNonNull(builder.message, "message must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertEvent}; every field is required.
     */
    public static class Builder {
        private String subscriptionId;
        private String trendId;
        private Instant triggeredAt;
        private String message;

        public Builder subscriptionId(String subscriptionId) {
            this.subscriptionId = subscriptionId;
            return this;
        }

        public Builder trendId(String trendId) {
            this.trendId = trendId;
            return this;
        }

        public Builder triggeredAt(Instant triggeredAt) {
            this.triggeredAt = triggeredAt;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public AlertEvent build() {
            return new AlertEvent(this);
        }
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public String getTrendId() {
        return trendId;
    }

    public Instant getTriggeredAt() {
        return triggeredAt;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertEvent that))
            return false;
        return subscriptionId.equals(that.subscriptionId)
                && trendId.equals(that.trendId)
                && triggeredAt.equals(that.triggeredAt)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subscriptionId, trendId, triggeredAt, message);
    }

    @Override
    public String toString() {
        return "AlertEvent{" +
                "subscriptionId='" + subscriptionId + '\'' +
                ", trendId='" + trendId + '\'' +
                ", triggeredAt=" + triggeredAt +
                ", message='" + message + '\'' +
                '}';
    }
}

package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * An unlabelled event of one source family, before it is turned into metric
 * observations.
 *
 * <p>
 * {@code type} is the analytics event type or the inventory / recipe action
 * type; {@code sentiment} is only meaningful for feedback. Both may be
 * {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RawEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DataSource source;
    private final String type;
    private final String sentiment;
    private final Instant timestamp;

    /**
     * @throws NullPointerException     if {@code source} or {@code timestamp}
     *                                  is {@code null}
     * @throws IllegalArgumentException if {@code source} is {@link DataSource#ALL}
     */
    public RawEvent(DataSource source, String type, String sentiment, Instant timestamp) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        if (source == DataSource.ALL) {
            throw new IllegalArgumentException("An event belongs to one family, not 'all'");
        }
        this.type = type;
        this.sentiment = sentiment;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static RawEvent of(DataSource source, String type, Instant timestamp) {
        return new RawEvent(source, type, null, timestamp);
    }

    public static RawEvent feedback(String sentiment, Instant timestamp) {
        return new RawEvent(DataSource.FEEDBACK, null, sentiment, timestamp);
    }

    public DataSource getSource() {
        return source;
    }

    public String getType() {
        return type;
    }

    public String getSentiment() {
        return sentiment;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RawEvent that))
            return false;
        return source == that.source
                && Objects.equals(type, that.type)
                && Objects.equals(sentiment, that.sentiment)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, type, sentiment, timestamp);
    }

    @Override
    public String toString() {
        return "RawEvent{" +
                "source=" + source.getCode() +
                ", type='" + type + '\'' +
                ", sentiment='" + sentiment + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}

package com.trendsentinel.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.trendsentinel.core.model.DataSource;
import com.trendsentinel.core.model.Observation;
import com.trendsentinel.core.model.RawEvent;
import com.trendsentinel.core.series.SeriesDeriver;

import java.time.Instant;

/**
 * One line of the JSON-lines event file.
 *
 * <p>
 * A row is either a pre-labelled metric observation:
 * </p>
 *
 * <pre>
 * {"source":"analytics","metric":"mobile_app_crash","timestamp":"2024-03-01T10:15:00Z","value":1}
 * </pre>
 *
 * <p>
 * or, without {@code metric}, a raw family event whose series are derived by
 * {@link SeriesDeriver}:
 * </p>
 *
 * <pre>
 * {"source":"feedback","sentiment":"positive","timestamp":"2024-03-01T10:15:00Z"}
 * {"source":"inventory","type":"item_added","timestamp":"2024-03-01T11:02:00Z"}
 * </pre>
 *
 * <p>
 * {@code value} defaults to 1 so plain event rows count once.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventRecord {

    private String source;
    private String metric;
    private String type;
    private String sentiment;
    private Instant timestamp;
    private double value = 1.0;

    public boolean isLabelled() {
        return metric != null && !metric.isBlank();
    }

    public Observation toObservation() {
        return new Observation(timestamp, value);
    }

    public RawEvent toRawEvent(DataSource family) {
        return new RawEvent(family, type, sentiment, timestamp);
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSentiment() {
        return sentiment;
    }

    public void setSentiment(String sentiment) {
        this.sentiment = sentiment;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "EventRecord{" +
                "source='" + source + '\'' +
                ", metric='" + metric + '\'' +
                ", type='" + type + '\'' +
                ", sentiment='" + sentiment + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                '}';
    }
}

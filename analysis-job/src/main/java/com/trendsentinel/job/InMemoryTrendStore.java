package com.trendsentinel.job;

import com.trendsentinel.core.model.AlertSubscription;
import com.trendsentinel.core.model.Trend;
import com.trendsentinel.core.model.TrendType;
import com.trendsentinel.core.store.TrendStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Thread-safe, process-local {@link TrendStore}.
 *
 * <p>
 * Trends are unique on (metric, trendType, startDate): saving a trend whose
 * key is already present keeps the first record and returns its id.
 * Subscriptions are seeded up front, usually from a
 * {@link com.trendsentinel.core.config.SubscriptionsConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryTrendStore implements TrendStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTrendStore.class);

    private final Clock clock;
    private final Map<TrendKey, String> idsByKey = new LinkedHashMap<>();
    private final Map<String, Trend> trendsById = new LinkedHashMap<>();
    private final Map<String, AlertSubscription> subscriptions = new LinkedHashMap<>();
    private final List<AlertTrigger> triggers = new ArrayList<>();
    private long sequence;

    public InMemoryTrendStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTrendStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ---------------------------------------------------------------
    // TrendStore
    // ---------------------------------------------------------------

    @Override
    public synchronized String save(Trend trend) {
        Objects.requireNonNull(trend, "trend must not be null");
        TrendKey key = new TrendKey(trend.getMetric(), trend.getTrendType(), trend.getStartDate());
        String existing = idsByKey.get(key);
        if (existing != null) {
            LOG.debug("Trend [{}] already stored as {}", trend.getTrendName(), existing);
            return existing;
        }
        String id = "trend-" + (++sequence);
        idsByKey.put(key, id);
        trendsById.put(id, trend);
        LOG.info("Stored trend {}: {} ({}, significance={})",
                id, trend.getTrendName(), trend.getTrendType().getCode(), trend.getSignificance());
        return id;
    }

    @Override
    public synchronized List<AlertSubscription> listActiveAlertSubscriptions() {
        return subscriptions.values().stream()
                .filter(AlertSubscription::isActive)
                .toList();
    }

    @Override
    public synchronized void recordAlertTrigger(String subscriptionId, String trendId, String message) {
        triggers.add(new AlertTrigger(subscriptionId, trendId, message, clock.instant()));
    }

    // ---------------------------------------------------------------
    // Seeding / inspection
    // ---------------------------------------------------------------

    /**
     * Add or replace subscriptions by id.
     *
     * @param seed subscriptions to register
     */
    public synchronized void addSubscriptions(Collection<AlertSubscription> seed) {
        for (AlertSubscription subscription : seed) {
            subscriptions.put(subscription.getId(), subscription);
        }
        LOG.info("Registered {} alert subscription(s), {} total", seed.size(), subscriptions.size());
    }

    public synchronized Optional<Trend> findTrend(String id) {
        return Optional.ofNullable(trendsById.get(id));
    }

    public synchronized Map<String, Trend> getTrends() {
        return new LinkedHashMap<>(trendsById);
    }

    public synchronized List<AlertTrigger> getTriggers() {
        return new ArrayList<>(triggers);
    }

    // ---------------------------------------------------------------
    // Types
    // ---------------------------------------------------------------

    private static final class TrendKey {
        private final String metric;
        private final TrendType trendType;
        private final Instant startDate;

        TrendKey(String metric, TrendType trendType, Instant startDate) {
            this.metric = metric;
            this.trendType = trendType;
            this.startDate = startDate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof TrendKey that))
                return false;
            return metric.equals(that.metric)
                    && trendType == that.trendType
                    && startDate.equals(that.startDate);
        }

        @Override
        public int hashCode() {
            return Objects.hash(metric, trendType, startDate);
        }
    }

    /**
     * A recorded alert trigger.
     */
    public static final class AlertTrigger {
        private final String subscriptionId;
        private final String trendId;
        private final String message;
        private final Instant recordedAt;

        AlertTrigger(String subscriptionId, String trendId, String message, Instant recordedAt) {
            this.subscriptionId = subscriptionId;
            this.trendId = trendId;
            this.message = message;
            this.recordedAt = recordedAt;
        }

        public String getSubscriptionId() {
            return subscriptionId;
        }

        public String getTrendId() {
            return trendId;
        }

        public String getMessage() {
            return message;
        }

        public Instant getRecordedAt() {
            return recordedAt;
        }

        @Override
        public String toString() {
            return "AlertTrigger{" +
                    "subscriptionId='" + subscriptionId + '\'' +
                    ", trendId='" + trendId + '\'' +
                    ", message='" + message + '\'' +
                    ", recordedAt=" + recordedAt +
                    '}';
        }
    }
}

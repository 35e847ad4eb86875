package com.trendsentinel.core.store;

import com.trendsentinel.core.model.AlertSubscription;
import com.trendsentinel.core.model.Trend;

import java.util.List;

/**
 * Persistence boundary for canonical trends, alert subscriptions and alert
 * triggers.
 *
 * <p>
 * Implementations must be thread-safe. Deduplication of trends across runs
 * is the store's responsibility: saving a trend that is already known returns
 * the existing identifier.
 * </p>
 *
 * @since 1.0.0
 */
public interface TrendStore {

    /**
     * Persist a trend.
     *
     * @param trend canonical trend
     * @return the identifier of the stored (or already existing) trend
     */
    String save(Trend trend);

    /**
     * @return every subscription whose {@code active} flag is set
     */
    List<AlertSubscription> listActiveAlertSubscriptions();

    /**
     * Record that a subscription fired for a trend.
     *
     * @param subscriptionId subscription identifier
     * @param trendId        trend identifier returned by {@link #save(Trend)}
     * @param message        rendered alert message
     */
    void recordAlertTrigger(String subscriptionId, String trendId, String message);
}

package com.trendsentinel.core.alert;

import com.trendsentinel.core.model.AlertEvent;

/**
 * Delivery channel for triggered alerts (email, push, log, ...).
 *
 * <p>
 * Implementations may throw; the {@link AlertEvaluator} retries a bounded
 * number of times and then logs the failure.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertNotifier {

    /**
     * Deliver a single alert event.
     *
     * @param event the event to deliver
     * @throws Exception if delivery fails
     */
    void deliver(AlertEvent event) throws Exception;
}

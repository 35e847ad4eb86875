package com.trendsentinel.core.alert;

import com.trendsentinel.core.model.AlertConditions;
import com.trendsentinel.core.model.AlertEvent;
import com.trendsentinel.core.model.AlertSubscription;
import com.trendsentinel.core.model.AlertType;
import com.trendsentinel.core.model.Trend;
import com.trendsentinel.core.store.TrendStore;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Matches a newly stored trend against every active alert subscription.
 *
 * <h3>Matching</h3>
 * <p>
 * The primary condition depends on the alert type:
 * </p>
 * <ul>
 * <li>{@code threshold}: significance ≥ subscription threshold</li>
 * <li>{@code emergence}: always</li>
 * <li>{@code acceleration}: changePercent ≥ {@code conditions.minGrowthRate}</li>
 * <li>{@code peak}, {@code decline}, {@code anomaly}: never</li>
 * </ul>
 * <p>
 * Secondary filters are then applied in order (minConfidence, trendTypes,
 * keywords); the first failing filter rejects the subscription.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Each subscription is processed in its own try/catch. A malformed
 * subscription is skipped with a warning. Notification goes through a
 * Resilience4j {@link Retry} allowing {@code maxAttempts} calls spaced by
 * {@code retryWait}; a notifier that still fails is logged. Neither case
 * prevents the remaining subscriptions from being evaluated.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEvaluator.class);

    public static final Duration DEFAULT_RETRY_WAIT = Duration.ofMillis(200);

    private final TrendStore store;
    private final AlertNotifier notifier;
    private final int maxAttempts;
    private final RetryConfig retryConfig;
    private final Clock clock;

    public AlertEvaluator(TrendStore store, AlertNotifier notifier, int maxAttempts, Clock clock) {
        this(store, notifier, maxAttempts, DEFAULT_RETRY_WAIT, clock);
    }

    public AlertEvaluator(TrendStore store, AlertNotifier notifier, int maxAttempts,
                          Duration retryWait, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(retryWait, "retryWait must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (retryWait.isNegative()) {
            throw new IllegalArgumentException("retryWait must not be negative, got: " + retryWait);
        }
        this.maxAttempts = maxAttempts;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(retryWait)
                .build();
    }

    /**
     * Evaluate all active subscriptions against a stored trend.
     *
     * @param trendId identifier returned by {@link TrendStore#save}
     * @param trend   the stored trend
     * @return the alert events produced, in subscription order
     */
    public List<AlertEvent> evaluate(String trendId, Trend trend) {
        Objects.requireNonNull(trendId, "trendId must not be null");
        Objects.requireNonNull(trend, "trend must not be null");

        List<AlertEvent> events = new ArrayList<>();
        for (AlertSubscription subscription : store.listActiveAlertSubscriptions()) {
            if (!subscription.isActive()) {
                continue;
            }
            try {
                subscription.validate();
            } catch (IllegalStateException e) {
                LOG.warn("Skipping malformed subscription [{}]: {}", subscription.getId(), e.getMessage());
                continue;
            }

            try {
                if (!matches(subscription, trend)) {
                    continue;
                }
                AlertEvent event = AlertEvent.builder()
                        .subscriptionId(subscription.getId())
                        .trendId(trendId)
                        .triggeredAt(clock.instant())
                        .message(formatMessage(trend))
                        .build();
                store.recordAlertTrigger(event.getSubscriptionId(), trendId, event.getMessage());
                events.add(event);
                LOG.info("Alert triggered: subscription={}, trend={} ({})",
                        subscription.getId(), trendId, trend.getTrendName());
                deliver(event);
            } catch (Exception e) {
                LOG.error("Failed to process subscription [{}] for trend [{}]",
                        subscription.getId(), trendId, e);
            }
        }
        return events;
    }

    /**
     * Decide whether a subscription fires for a trend. The subscription is
     * assumed to be valid.
     *
     * @param subscription active, validated subscription
     * @param trend        candidate trend
     * @return {@code true} if both the primary condition and every secondary
     *         filter hold
     */
    public static boolean matches(AlertSubscription subscription, Trend trend) {
        Optional<AlertType> type = subscription.resolveAlertType();
        if (type.isEmpty()) {
            return false;
        }
        AlertConditions conditions = subscription.getConditions() != null
                ? subscription.getConditions()
                : new AlertConditions();

        boolean primary = switch (type.get()) {
            case THRESHOLD -> trend.getSignificance() >= subscription.getThreshold();
            case EMERGENCE -> true;
            case ACCELERATION -> trend.getChangePercent() >= conditions.getMinGrowthRate();
            case PEAK, DECLINE, ANOMALY -> false;
        };
        if (!primary) {
            return false;
        }

        if (conditions.getMinConfidence() != null
                && trend.getSignificance() < conditions.getMinConfidence()) {
            return false;
        }
        if (!conditions.getTrendTypes().isEmpty()) {
            Set<String> allowed = conditions.getTrendTypes().stream()
                    .map(t -> t.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            if (!allowed.contains(trend.getTrendType().getCode())) {
                return false;
            }
        }
        if (!conditions.getKeywords().isEmpty()) {
            Set<String> wanted = conditions.getKeywords().stream()
                    .map(k -> k.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            return trend.getKeywords().stream()
                    .map(k -> k.toLowerCase(Locale.ROOT))
                    .anyMatch(wanted::contains);
        }
        return true;
    }

    static String formatMessage(Trend trend) {
        return String.format(Locale.ROOT,
                "Trend Alert: %s detected with %.2f strength and %.1f%% growth rate.",
                trend.getTrendName(), trend.getSignificance(), trend.getChangePercent());
    }

    private void deliver(AlertEvent event) {
        Retry retry = Retry.of("alert-delivery-" + event.getSubscriptionId(), retryConfig);
        retry.getEventPublisher().onRetry(e -> LOG.warn(
                "Alert delivery attempt {}/{} failed for subscription [{}]: {}",
                e.getNumberOfRetryAttempts(), maxAttempts, event.getSubscriptionId(),
                e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "unknown"));
        try {
            Retry.decorateCheckedRunnable(retry, () -> notifier.deliver(event)).run();
        } catch (Throwable e) {
            LOG.error("Giving up delivering alert for subscription [{}] after {} attempt(s)",
                    event.getSubscriptionId(), maxAttempts, e);
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}

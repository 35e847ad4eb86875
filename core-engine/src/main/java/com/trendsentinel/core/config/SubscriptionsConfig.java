package com.trendsentinel.core.config;

import com.trendsentinel.core.model.AlertSubscription;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Top-level POJO for a subscriptions YAML file, used to seed a store.
 *
 * <pre>
 * subscriptions:
 *   - id: strong-trends
 *     ownerId: user-1
 *     alertType: threshold
 *     threshold: 0.6
 *     conditions:
 *       trendTypes: [increasing, stable]
 * </pre>
 *
 * @since 1.0.0
 */
public class SubscriptionsConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<AlertSubscription> subscriptions = new ArrayList<>();

    /**
     * @return unmodifiable list of subscriptions
     */
    public List<AlertSubscription> getSubscriptions() {
        return Collections.unmodifiableList(subscriptions);
    }

    public void setSubscriptions(List<AlertSubscription> subscriptions) {
        this.subscriptions = subscriptions != null ? new ArrayList<>(subscriptions) : new ArrayList<>();
    }

    /**
     * Validate every subscription and reject duplicate ids.
     *
     * @throws IllegalStateException if one or more subscriptions are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        List<String> seen = new ArrayList<>();

        for (int i = 0; i < subscriptions.size(); i++) {
            AlertSubscription subscription = Objects.requireNonNull(subscriptions.get(i),
                    "Subscription at index " + i + " is null");
            try {
                subscription.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (subscription.getId() != null) {
                if (seen.contains(subscription.getId())) {
                    errors.add("Duplicate subscription id: '" + subscription.getId() + "'");
                }
                seen.add(subscription.getId());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Subscriptions configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "SubscriptionsConfig{subscriptions=" + subscriptions + '}';
    }
}

package com.trendsentinel.job;

import com.trendsentinel.core.model.AlertSubscription;
import com.trendsentinel.core.model.TimePeriod;
import com.trendsentinel.core.model.Trend;
import com.trendsentinel.core.model.TrendType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryTrendStore}.
 */
class InMemoryTrendStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-25T00:00:00Z");

    private final InMemoryTrendStore store = new InMemoryTrendStore(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("Saving the same (metric, type, start) twice should return the first id")
    void shouldDeduplicate() {
        String first = store.save(trend("orders", TrendType.STABLE, 0.65));
        String again = store.save(trend("orders", TrendType.STABLE, 0.9));
        String other = store.save(trend("orders", TrendType.INCREASING, 0.7));

        assertThat(again).isEqualTo(first);
        assertThat(other).isNotEqualTo(first);
        assertThat(store.findTrend(first))
                .hasValueSatisfying(t -> assertThat(t.getSignificance()).isEqualTo(0.65));
        assertThat(store.getTrends()).hasSize(2);
    }

    @Test
    @DisplayName("Should list only active subscriptions")
    void shouldListActiveSubscriptions() {
        store.addSubscriptions(List.of(subscription("on", true), subscription("off", false)));

        assertThat(store.listActiveAlertSubscriptions())
                .extracting(AlertSubscription::getId)
                .containsExactly("on");
    }

    @Test
    @DisplayName("Should record alert triggers with the store clock")
    void shouldRecordTriggers() {
        store.recordAlertTrigger("on", "trend-1", "Trend Alert: ...");

        assertThat(store.getTriggers()).singleElement().satisfies(trigger -> {
            assertThat(trigger.getSubscriptionId()).isEqualTo("on");
            assertThat(trigger.getTrendId()).isEqualTo("trend-1");
            assertThat(trigger.getRecordedAt()).isEqualTo(NOW);
        });
    }

    private static Trend trend(String metric, TrendType type, double significance) {
        return Trend.builder()
                .trendName("Trend in " + metric)
                .trendType(type)
                .metric(metric)
                .currentValue(2)
                .previousValue(1)
                .changePercent(100)
                .timePeriod(TimePeriod.WEEK)
                .significance(significance)
                .startDate(Instant.parse("2024-03-01T00:00:00Z"))
                .build();
    }

    private static AlertSubscription subscription(String id, boolean active) {
        AlertSubscription subscription = new AlertSubscription();
        subscription.setId(id);
        subscription.setAlertType("emergence");
        subscription.setActive(active);
        return subscription;
    }
}

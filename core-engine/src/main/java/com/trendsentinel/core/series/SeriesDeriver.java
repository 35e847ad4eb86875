package com.trendsentinel.core.series;

import com.trendsentinel.core.model.Observation;
import com.trendsentinel.core.model.RawEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw family events into metric observations, one derivation per
 * {@link com.trendsentinel.core.model.DataSource} family.
 *
 * <h3>Derivations</h3>
 * <ul>
 * <li><b>analytics</b>: one count observation under the event type
 * ({@value #UNKNOWN_TYPE} when absent)</li>
 * <li><b>feedback</b>: a count for {@code feedback_volume} and a 1/0
 * indicator for {@code positive_sentiment}, averaged per bucket into the
 * positive share</li>
 * <li><b>inventory</b>: 1/0 indicators for {@code inventory_additions}
 * ({@code item_added}) and {@code inventory_turnover} ({@code item_removed});
 * only inventory actions participate</li>
 * <li><b>recipes</b>: 1/0 indicators for {@code recipe_views}
 * ({@code recipe_viewed}) and {@code recipe_creation}
 * ({@code recipe_created}); only recipe actions participate</li>
 * </ul>
 *
 * <p>
 * Indicators rather than plain counts give both series of a family a point in
 * every bucket where that family had activity, zero when the bucket held none
 * of that action.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesDeriver {

    static final String UNKNOWN_TYPE = "unknown";

    static final String ITEM_ADDED = "item_added";
    static final String ITEM_REMOVED = "item_removed";
    static final String RECIPE_VIEWED = "recipe_viewed";
    static final String RECIPE_CREATED = "recipe_created";

    private static final Set<String> INVENTORY_ACTIONS = Set.of(ITEM_ADDED, ITEM_REMOVED, "item_updated");
    private static final Set<String> RECIPE_ACTIONS = Set.of(RECIPE_VIEWED, RECIPE_CREATED, "recipe_favorited");

    private SeriesDeriver() {
        // utility class
    }

    /**
     * Derive the observations contributed by one event.
     *
     * @param event raw event
     * @return metric name → observation, empty if the event takes part in no
     *         derived series
     */
    public static Map<String, Observation> derive(RawEvent event) {
        Instant ts = event.getTimestamp();
        Map<String, Observation> derived = new LinkedHashMap<>();
        switch (event.getSource()) {
            case ANALYTICS -> {
                String type = normalize(event.getType());
                derived.put(type.isEmpty() ? UNKNOWN_TYPE : type, Observation.count(ts));
            }
            case FEEDBACK -> {
                derived.put(DerivedMetric.FEEDBACK_VOLUME.getMetricName(), Observation.count(ts));
                derived.put(DerivedMetric.POSITIVE_SENTIMENT.getMetricName(),
                        indicator(ts, "positive".equals(normalize(event.getSentiment()))));
            }
            case INVENTORY -> {
                String action = normalize(event.getType());
                if (INVENTORY_ACTIONS.contains(action)) {
                    derived.put(DerivedMetric.INVENTORY_ADDITIONS.getMetricName(),
                            indicator(ts, ITEM_ADDED.equals(action)));
                    derived.put(DerivedMetric.INVENTORY_TURNOVER.getMetricName(),
                            indicator(ts, ITEM_REMOVED.equals(action)));
                }
            }
            case RECIPES -> {
                String action = normalize(event.getType());
                if (RECIPE_ACTIONS.contains(action)) {
                    derived.put(DerivedMetric.RECIPE_VIEWS.getMetricName(),
                            indicator(ts, RECIPE_VIEWED.equals(action)));
                    derived.put(DerivedMetric.RECIPE_CREATION.getMetricName(),
                            indicator(ts, RECIPE_CREATED.equals(action)));
                }
            }
            case ALL -> throw new IllegalArgumentException("An event belongs to one family, not 'all'");
        }
        return derived;
    }

    /**
     * Derive every event and group the observations by metric.
     *
     * @param events raw events, in any order
     * @return metric name → observations, metrics in first-derived order
     */
    public static Map<String, List<Observation>> deriveAll(Collection<RawEvent> events) {
        Map<String, List<Observation>> byMetric = new LinkedHashMap<>();
        for (RawEvent event : events) {
            derive(event).forEach((metric, observation) ->
                    byMetric.computeIfAbsent(metric, k -> new ArrayList<>()).add(observation));
        }
        return byMetric;
    }

    private static Observation indicator(Instant ts, boolean hit) {
        return new Observation(ts, hit ? 1.0 : 0.0);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}

package com.trendsentinel.core.store;

import com.trendsentinel.core.model.DataSource;
import com.trendsentinel.core.model.Observation;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Read-only access to raw time-stamped events.
 *
 * @since 1.0.0
 */
public interface EventSource {

    /**
     * List the metric identifiers that belong to a data-source family.
     *
     * @param dataSource family to list; {@link DataSource#ALL} lists every
     *                   metric
     * @return metric identifiers, in a stable order
     * @throws IOException if the backing store cannot be read
     */
    List<String> listMetrics(DataSource dataSource) throws IOException;

    /**
     * Fetch the observations of one metric inside {@code [start, end)}.
     *
     * @param sourceId metric identifier from {@link #listMetrics(DataSource)}
     * @param start    inclusive lower bound
     * @param end      exclusive upper bound
     * @return observations, in any order
     * @throws IOException if the backing store cannot be read
     */
    List<Observation> fetchEvents(String sourceId, Instant start, Instant end) throws IOException;
}

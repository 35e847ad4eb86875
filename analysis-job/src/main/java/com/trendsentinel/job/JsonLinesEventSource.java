package com.trendsentinel.job;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendsentinel.core.model.DataSource;
import com.trendsentinel.core.model.Observation;
import com.trendsentinel.core.series.SeriesDeriver;
import com.trendsentinel.core.store.EventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * {@link EventSource} backed by a JSON-lines file of {@link EventRecord}s.
 *
 * <p>
 * The file is re-read on every call so a long-running scheduled job picks up
 * appended events. Labelled rows feed their metric directly; rows without a
 * metric are raw family events and feed the metrics {@link SeriesDeriver}
 * derives from them. Blank lines are ignored; malformed lines, rows without a
 * timestamp and rows with an unknown source family are logged and skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesEventSource implements EventSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesEventSource.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesEventSource(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<String> listMetrics(DataSource dataSource) throws IOException {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        TreeSet<String> metrics = new TreeSet<>();
        forEachObservation((family, metric, observation) -> {
            if (dataSource.includes(family)) {
                metrics.add(metric);
            }
        });
        return new ArrayList<>(metrics);
    }

    @Override
    public List<Observation> fetchEvents(String sourceId, Instant start, Instant end) throws IOException {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        List<Observation> observations = new ArrayList<>();
        forEachObservation((family, metric, observation) -> {
            Instant ts = observation.getTimestamp();
            if (sourceId.equals(metric) && !ts.isBefore(start) && ts.isBefore(end)) {
                observations.add(observation);
            }
        });
        LOG.debug("Fetched {} event(s) for [{}] in [{}, {})", observations.size(), sourceId, start, end);
        return observations;
    }

    private void forEachObservation(ObservationConsumer consumer) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                EventRecord record;
                try {
                    record = mapper.readValue(line, EventRecord.class);
                } catch (IOException e) {
                    LOG.warn("Skipping malformed event at {}:{}: {}", file, lineNumber, e.getMessage());
                    continue;
                }
                if (record.getTimestamp() == null) {
                    LOG.warn("Skipping event without timestamp at {}:{}", file, lineNumber);
                    continue;
                }
                try {
                    DataSource family = DataSource.fromCode(record.getSource());
                    if (record.isLabelled()) {
                        consumer.accept(family, record.getMetric(), record.toObservation());
                    } else {
                        SeriesDeriver.derive(record.toRawEvent(family))
                                .forEach((metric, observation) -> consumer.accept(family, metric, observation));
                    }
                } catch (IllegalArgumentException e) {
                    LOG.warn("Skipping event at {}:{}: {}", file, lineNumber, e.getMessage());
                }
            }
        }
    }

    public Path getFile() {
        return file;
    }

    @FunctionalInterface
    private interface ObservationConsumer {
        void accept(DataSource family, String metric, Observation observation);
    }
}

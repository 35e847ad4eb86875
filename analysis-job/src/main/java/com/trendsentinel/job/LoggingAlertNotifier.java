package com.trendsentinel.job;

import com.trendsentinel.core.alert.AlertNotifier;
import com.trendsentinel.core.model.AlertEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link AlertNotifier} that writes each alert as one JSON line to the
 * {@code trend-sentinel.alerts} logger. Route that logger to its own appender
 * to get an alert feed.
 *
 * @since 1.0.0
 */
public class LoggingAlertNotifier implements AlertNotifier {

    static final String ALERT_LOGGER = "trend-sentinel.alerts";

    private static final Logger ALERTS = LoggerFactory.getLogger(ALERT_LOGGER);

    private final AlertEventSerializer serializer;

    public LoggingAlertNotifier(AlertEventSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
    }

    @Override
    public void deliver(AlertEvent event) throws Exception {
        ALERTS.info(serializer.toJson(event));
    }
}

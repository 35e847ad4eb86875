package com.trendsentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendsentinel.core.model.AlertEvent;

/**
 * Serialises {@link AlertEvent}s to JSON with ISO-8601 timestamps.
 *
 * @since 1.0.0
 */
public class AlertEventSerializer {

    private final ObjectMapper mapper;

    public AlertEventSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public String toJson(AlertEvent event) throws JsonProcessingException {
        return mapper.writeValueAsString(event);
    }
}

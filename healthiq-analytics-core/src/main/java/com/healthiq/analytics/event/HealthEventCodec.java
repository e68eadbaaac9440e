package com.healthiq.analytics.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthiq.analytics.exceptions.MalformedEventException;
import com.healthiq.model.analytics.AnalyticsReport;
import com.healthiq.model.event.HealthEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads event arrays and writes analytics reports as JSON. The event subtype is chosen by the
 * {@code eventType} property; an unknown or missing type is malformed input.
 */
@ApplicationScoped
public class HealthEventCodec {

    private static final TypeReference<List<HealthEvent>> EVENT_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    @Inject
    public HealthEventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<HealthEvent> readEvents(String json) {
        try {
            return nonNull(mapper.readValue(json, EVENT_LIST));
        } catch (JsonProcessingException e) {
            throw new MalformedEventException(null, e.getOriginalMessage(), e);
        }
    }

    public List<HealthEvent> readEvents(InputStream in) throws IOException {
        try {
            return nonNull(mapper.readValue(in, EVENT_LIST));
        } catch (JsonProcessingException e) {
            throw new MalformedEventException(null, e.getOriginalMessage(), e);
        }
    }

    public HealthEvent readEvent(String json) {
        try {
            HealthEvent event = mapper.readValue(json, HealthEvent.class);
            if (event == null) {
                throw new MalformedEventException(null, "empty event document");
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new MalformedEventException(null, e.getOriginalMessage(), e);
        }
    }

    public String writeEvents(List<? extends HealthEvent> events) throws JsonProcessingException {
        return mapper.writerFor(EVENT_LIST).writeValueAsString(events);
    }

    public String writeReport(AnalyticsReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(report);
    }

    private static List<HealthEvent> nonNull(List<HealthEvent> events) {
        if (events == null) {
            return List.of();
        }
        for (HealthEvent event : events) {
            if (event == null) {
                throw new MalformedEventException(null, "null entry in event array");
            }
        }
        return events;
    }
}

package com.healthiq.analytics.event;

import com.healthiq.model.event.HealthEvent;

import java.time.Instant;

/**
 * An event paired with its parsed absolute timestamp.
 */
public record TimedEvent<E extends HealthEvent>(E event, Instant at) {

    public String id() {
        return event.getId();
    }
}

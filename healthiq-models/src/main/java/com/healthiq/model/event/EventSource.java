package com.healthiq.model.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a health event originates. Not a storage or import taxonomy.
 */
public enum EventSource {
    USER("user"),
    PRESCRIPTION("prescription"),
    DEVICE("device"),
    DOCTOR("doctor");

    private final String value;

    EventSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static EventSource fromValue(String value) {
        for (EventSource s : values()) {
            if (s.value.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown event source: " + value);
    }
}

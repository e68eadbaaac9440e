package com.healthiq.model.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Capture reliability of an event, also reused as the data confidence of a stability score.
 */
public enum ConfidenceLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    ConfidenceLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConfidenceLevel fromValue(String value) {
        for (ConfidenceLevel c : values()) {
            if (c.value.equals(value)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown confidence level: " + value);
    }
}

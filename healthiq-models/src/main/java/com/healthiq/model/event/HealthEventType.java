package com.healthiq.model.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminator of the closed {@link HealthEvent} union. The wire value is the capitalized name.
 */
public enum HealthEventType {
    MEDICATION("Medication"),
    SYMPTOM("Symptom"),
    LIFESTYLE("Lifestyle"),
    CLINICAL("Clinical"),
    INSIGHT("Insight");

    private final String value;

    HealthEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static HealthEventType fromValue(String value) {
        for (HealthEventType t : values()) {
            if (t.value.equals(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown health event type: " + value);
    }
}

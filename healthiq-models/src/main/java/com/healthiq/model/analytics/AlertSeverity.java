package com.healthiq.model.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * info: informational; warning: monitor closely; attention: review recommended.
 */
public enum AlertSeverity {
    INFO("info"),
    WARNING("warning"),
    ATTENTION("attention");

    private final String value;

    AlertSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AlertSeverity fromValue(String value) {
        for (AlertSeverity e : values()) {
            if (e.value.equals(value)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown AlertSeverity: " + value);
    }
}

package com.healthiq.model.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AdherenceOutcome {
    TAKEN("taken"),
    MISSED("missed"),
    DELAYED("delayed");

    private final String value;

    AdherenceOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AdherenceOutcome fromValue(String value) {
        for (AdherenceOutcome o : values()) {
            if (o.value.equals(value)) {
                return o;
            }
        }
        throw new IllegalArgumentException("Unknown adherence outcome: " + value);
    }
}

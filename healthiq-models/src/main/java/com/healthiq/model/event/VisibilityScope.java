package com.healthiq.model.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum VisibilityScope {
    USER_ONLY("user-only"),
    DOCTOR_SHAREABLE("doctor-shareable");

    private final String value;

    VisibilityScope(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static VisibilityScope fromValue(String value) {
        for (VisibilityScope v : values()) {
            if (v.value.equals(value)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown visibility scope: " + value);
    }
}

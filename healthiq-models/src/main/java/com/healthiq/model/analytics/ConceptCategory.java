package com.healthiq.model.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConceptCategory {
    SYMPTOM("symptom"),
    MEDICATION("medication"),
    LIFESTYLE("lifestyle"),
    CLINICAL("clinical");

    private final String value;

    ConceptCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConceptCategory fromValue(String value) {
        for (ConceptCategory e : values()) {
            if (e.value.equals(value)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown ConceptCategory: " + value);
    }
}

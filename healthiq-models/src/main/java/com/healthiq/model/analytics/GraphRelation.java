package com.healthiq.model.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relation carried by a concept graph edge. REPORTED_TRIGGER is reserved for explicit user-reported
 * triggers and is not derived from co-occurrence.
 */
public enum GraphRelation {
    CO_OCCURRENCE("co_occurrence"),
    TEMPORAL_SEQUENCE("temporal_sequence"),
    REPORTED_TRIGGER("reported_trigger"),
    MEDICATION_RESPONSE("medication_response");

    private final String value;

    GraphRelation(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static GraphRelation fromValue(String value) {
        for (GraphRelation e : values()) {
            if (e.value.equals(value)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown GraphRelation: " + value);
    }
}

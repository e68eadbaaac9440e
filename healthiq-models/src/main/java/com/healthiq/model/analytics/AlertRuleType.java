package com.healthiq.model.analytics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertRuleType {
    HSI_DROP("hsi_drop"),
    NEW_SYMPTOM_CLUSTER("new_symptom_cluster"),
    ADHERENCE_DECLINE("adherence_decline"),
    LOGGING_GAP("logging_gap"),
    SYMPTOM_ESCALATION("symptom_escalation"),
    CO_OCCURRENCE_SPIKE("co_occurrence_spike");

    private final String value;

    AlertRuleType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AlertRuleType fromValue(String value) {
        for (AlertRuleType e : values()) {
            if (e.value.equals(value)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown AlertRuleType: " + value);
    }
}

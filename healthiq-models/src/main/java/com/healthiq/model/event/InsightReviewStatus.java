package com.healthiq.model.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightReviewStatus {
    DRAFT("draft"),
    REVIEWED("reviewed");

    private final String value;

    InsightReviewStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static InsightReviewStatus fromValue(String value) {
        for (InsightReviewStatus s : values()) {
            if (s.value.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown review status: " + value);
    }
}

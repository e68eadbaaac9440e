package com.healthiq.model.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Timestamp of a health event. {@code absolute} must be an ISO-8601 date-time; it is kept as the
 * raw string so that a malformed value is detected where it is used rather than silently coerced
 * while binding.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventTimestamp {
    protected String absolute;
    protected RelativeTimestamp relative;

    public static EventTimestamp of(String absolute) {
        return new EventTimestamp(absolute, null);
    }
}

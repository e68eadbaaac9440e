package com.healthiq.model.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * Base of the closed health event union. The set of subtypes is fixed; consumers dispatch through
 * {@link #accept(HealthEventVisitor)} so that adding a variant breaks every consumer at compile time
 * instead of being silently skipped.
 * <p>
 * Events are domain contracts only: no persistence assumptions and no AI conclusions.
 * </p>
 */
@Data
@NoArgsConstructor
@SuperBuilder
@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "eventType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MedicationEvent.class, name = "Medication"),
        @JsonSubTypes.Type(value = SymptomEvent.class, name = "Symptom"),
        @JsonSubTypes.Type(value = LifestyleEvent.class, name = "Lifestyle"),
        @JsonSubTypes.Type(value = ClinicalEvent.class, name = "Clinical"),
        @JsonSubTypes.Type(value = InsightEvent.class, name = "Insight")
})
public abstract class HealthEvent {

    protected String id;

    protected EventTimestamp timestamp;

    @Builder.Default
    protected EventSource source = EventSource.USER;

    // capture reliability, not disease likelihood
    @Builder.Default
    protected ConfidenceLevel confidence = ConfidenceLevel.MEDIUM;

    @Builder.Default
    protected VisibilityScope visibilityScope = VisibilityScope.USER_ONLY;

    protected List<String> tags;

    protected String notes;

    public abstract HealthEventType getEventType();

    public abstract <R> R accept(HealthEventVisitor<R> visitor);
}

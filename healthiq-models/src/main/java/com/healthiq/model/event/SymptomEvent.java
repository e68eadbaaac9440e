package com.healthiq.model.event;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
@SuperBuilder
@RegisterForReflection
public class SymptomEvent extends HealthEvent {

    protected String description;

    // user chosen and non-clinical: "mild", "7/10", "severe"
    protected String intensity;

    protected String userReportedContext;

    @Override
    public HealthEventType getEventType() {
        return HealthEventType.SYMPTOM;
    }

    @Override
    public <R> R accept(HealthEventVisitor<R> visitor) {
        return visitor.visitSymptom(this);
    }
}

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
public class ClinicalEvent extends HealthEvent {

    protected String doctorVisit;

    // only when provided by a clinician or a record
    protected String diagnosisLabel;

    @Override
    public HealthEventType getEventType() {
        return HealthEventType.CLINICAL;
    }

    @Override
    public <R> R accept(HealthEventVisitor<R> visitor) {
        return visitor.visitClinical(this);
    }
}

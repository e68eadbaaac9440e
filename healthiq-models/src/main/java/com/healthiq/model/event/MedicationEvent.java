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
public class MedicationEvent extends HealthEvent {

    protected String name;
    protected String dosage;

    // intentionally high level, e.g. "once daily", "as needed"
    protected String intendedSchedule;

    protected AdherenceOutcome adherenceOutcome;

    @Override
    public HealthEventType getEventType() {
        return HealthEventType.MEDICATION;
    }

    @Override
    public <R> R accept(HealthEventVisitor<R> visitor) {
        return visitor.visitMedication(this);
    }
}

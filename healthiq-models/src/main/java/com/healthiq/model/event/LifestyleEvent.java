package com.healthiq.model.event;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * High-level lifestyle signals. Every field is optional free text.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
@SuperBuilder
@RegisterForReflection
public class LifestyleEvent extends HealthEvent {

    protected String sleep;
    protected String stress;
    protected String activity;
    protected String food;

    @Override
    public HealthEventType getEventType() {
        return HealthEventType.LIFESTYLE;
    }

    @Override
    public <R> R accept(HealthEventVisitor<R> visitor) {
        return visitor.visitLifestyle(this);
    }
}

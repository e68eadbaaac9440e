package com.healthiq.model.event;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * A reviewed or draft insight. Insights reference the events they are drawn from and never feed
 * back into analytics.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
@SuperBuilder
@RegisterForReflection
public class InsightEvent extends HealthEvent {

    protected List<String> evidenceEventIds;

    @Builder.Default
    protected InsightReviewStatus reviewStatus = InsightReviewStatus.DRAFT;

    @Override
    public HealthEventType getEventType() {
        return HealthEventType.INSIGHT;
    }

    @Override
    public <R> R accept(HealthEventVisitor<R> visitor) {
        return visitor.visitInsight(this);
    }
}

package com.healthiq.model.event;

/**
 * Exhaustive dispatch over the health event union.
 *
 * @param <R> result type
 */
public interface HealthEventVisitor<R> {
    R visitMedication(MedicationEvent event);
    R visitSymptom(SymptomEvent event);
    R visitLifestyle(LifestyleEvent event);
    R visitClinical(ClinicalEvent event);
    R visitInsight(InsightEvent event);
}

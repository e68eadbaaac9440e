package com.healthiq.analytics.concept;

import com.google.common.base.Joiner;
import com.healthiq.model.analytics.ConceptCategory;
import com.healthiq.model.analytics.ExtractedConcept;
import com.healthiq.model.event.ClinicalEvent;
import com.healthiq.model.event.HealthEvent;
import com.healthiq.model.event.HealthEventVisitor;
import com.healthiq.model.event.InsightEvent;
import com.healthiq.model.event.LifestyleEvent;
import com.healthiq.model.event.MedicationEvent;
import com.healthiq.model.event.SymptomEvent;
import com.healthiq.util.TextNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.healthiq.analytics.concept.ConceptTables.DOCTOR_VISIT;
import static com.healthiq.analytics.concept.ConceptTables.FALLBACK_TOKENS;
import static com.healthiq.analytics.concept.ConceptTables.LIFESTYLE_KEYWORDS;
import static com.healthiq.analytics.concept.ConceptTables.LIFESTYLE_LOGGED;
import static com.healthiq.analytics.concept.ConceptTables.SYMPTOM_PHRASES;
import static com.healthiq.analytics.concept.ConceptTables.UNCLASSIFIED_SYMPTOM;
import static com.healthiq.analytics.concept.ConceptTables.UNKNOWN_MEDICATION;

/**
 * Turns an event into normalized concept labels using fixed vocabularies. Pure and deterministic:
 * the same event always yields the same concepts in the same order.
 */
public final class ConceptExtractor {

    private static final Joiner SPACE = Joiner.on(' ').skipNulls();

    private ConceptExtractor() {}

    public static List<ExtractedConcept> extract(HealthEvent event) {
        if (event == null) {
            return List.of();
        }
        return event.accept(new Extraction(event));
    }

    /**
     * Concepts of every event, in input order.
     */
    public static List<ExtractedConcept> extractAll(Collection<? extends HealthEvent> events) {
        List<ExtractedConcept> out = new ArrayList<>();
        if (events != null) {
            for (HealthEvent event : events) {
                out.addAll(extract(event));
            }
        }
        return out;
    }

    private static final class Extraction implements HealthEventVisitor<List<ExtractedConcept>> {
        private final String eventId;
        private final String timestamp;

        private Extraction(HealthEvent event) {
            this.eventId = event.getId();
            this.timestamp = event.getTimestamp() == null ? null : event.getTimestamp().getAbsolute();
        }

        @Override
        public List<ExtractedConcept> visitSymptom(SymptomEvent event) {
            String normalized = TextNormalizer.normalize(event.getDescription());
            List<ExtractedConcept> concepts = new ArrayList<>();
            for (Map.Entry<String, String> phrase : SYMPTOM_PHRASES.entrySet()) {
                if (normalized.contains(phrase.getKey())) {
                    concepts.add(concept(phrase.getValue(), ConceptCategory.SYMPTOM));
                }
            }
            if (concepts.isEmpty()) {
                String label = TextNormalizer.firstTokensLabel(normalized, FALLBACK_TOKENS);
                concepts.add(concept(label.isEmpty() ? UNCLASSIFIED_SYMPTOM : label, ConceptCategory.SYMPTOM));
            }
            return concepts;
        }

        @Override
        public List<ExtractedConcept> visitMedication(MedicationEvent event) {
            String label = TextNormalizer.toLabel(event.getName());
            return List.of(concept(label.isEmpty() ? UNKNOWN_MEDICATION : label, ConceptCategory.MEDICATION));
        }

        @Override
        public List<ExtractedConcept> visitLifestyle(LifestyleEvent event) {
            String combined = SPACE.join(nonBlank(event.getSleep()), nonBlank(event.getStress()),
                    nonBlank(event.getActivity()), nonBlank(event.getFood()));
            if (combined.isEmpty()) {
                return List.of();
            }
            String normalized = TextNormalizer.normalize(combined);
            List<ExtractedConcept> concepts = new ArrayList<>();
            for (String name : LIFESTYLE_KEYWORDS.keySet()) {
                if (LIFESTYLE_KEYWORDS.get(name).stream().anyMatch(normalized::contains)) {
                    concepts.add(concept(name, ConceptCategory.LIFESTYLE));
                }
            }
            if (concepts.isEmpty()) {
                concepts.add(concept(LIFESTYLE_LOGGED, ConceptCategory.LIFESTYLE));
            }
            return concepts;
        }

        @Override
        public List<ExtractedConcept> visitClinical(ClinicalEvent event) {
            List<ExtractedConcept> concepts = new ArrayList<>(2);
            String diagnosis = TextNormalizer.toLabel(event.getDiagnosisLabel());
            if (!diagnosis.isEmpty()) {
                concepts.add(concept(diagnosis, ConceptCategory.CLINICAL));
            }
            concepts.add(concept(DOCTOR_VISIT, ConceptCategory.CLINICAL));
            return concepts;
        }

        @Override
        public List<ExtractedConcept> visitInsight(InsightEvent event) {
            // insights are conclusions, not observations
            return List.of();
        }

        private ExtractedConcept concept(String label, ConceptCategory category) {
            return new ExtractedConcept(label, category, eventId, timestamp);
        }

        private static String nonBlank(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }
}

package com.healthiq.analytics.concept;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

/**
 * Vocabulary used by {@link ConceptExtractor}. Both tables are ordered; extraction emits concepts
 * in table order.
 */
final class ConceptTables {

    /**
     * Symptom phrase to canonical concept. Every contained phrase fires, so overlapping phrases
     * ("head pain" inside "head pain and headache") each contribute a concept.
     */
    static final ImmutableMap<String, String> SYMPTOM_PHRASES = ImmutableMap.<String, String>builder()
            .put("headache", "headache")
            .put("head pain", "headache")
            .put("migraine", "migraine")
            .put("head ache", "headache")
            .put("cephalgia", "headache")
            .put("nausea", "nausea")
            .put("feeling sick", "nausea")
            .put("queasy", "nausea")
            .put("vomiting", "vomiting")
            .put("throwing up", "vomiting")
            .put("fatigue", "fatigue")
            .put("tired", "fatigue")
            .put("exhaustion", "fatigue")
            .put("exhausted", "fatigue")
            .put("low energy", "fatigue")
            .put("insomnia", "insomnia")
            .put("trouble sleeping", "insomnia")
            .put("can't sleep", "insomnia")
            .put("difficulty sleeping", "insomnia")
            .put("back pain", "back_pain")
            .put("backache", "back_pain")
            .put("stomach pain", "stomach_pain")
            .put("abdominal pain", "stomach_pain")
            .put("belly pain", "stomach_pain")
            .put("chest pain", "chest_pain")
            .put("joint pain", "joint_pain")
            .put("arthralgia", "joint_pain")
            .put("dizziness", "dizziness")
            .put("dizzy", "dizziness")
            .put("lightheaded", "dizziness")
            .put("vertigo", "dizziness")
            .put("anxiety", "anxiety")
            .put("anxious", "anxiety")
            .put("worried", "anxiety")
            .put("depression", "depression")
            .put("depressed", "depression")
            .put("feeling down", "depression")
            .put("low mood", "depression")
            .put("cough", "cough")
            .put("coughing", "cough")
            .put("fever", "fever")
            .put("high temperature", "fever")
            .put("sore throat", "sore_throat")
            .put("throat pain", "sore_throat")
            .put("shortness of breath", "shortness_of_breath")
            .put("breathlessness", "shortness_of_breath")
            .put("difficulty breathing", "shortness_of_breath")
            .put("rash", "rash")
            .put("skin rash", "rash")
            .put("hives", "rash")
            .put("muscle pain", "muscle_pain")
            .put("myalgia", "muscle_pain")
            .put("constipation", "constipation")
            .put("diarrhea", "diarrhea")
            .put("bloating", "bloating")
            .put("swelling", "swelling")
            .put("palpitations", "palpitations")
            .put("heart racing", "palpitations")
            .put("weight gain", "weight_change")
            .put("weight loss", "weight_change")
            .build();

    /**
     * Lifestyle concept to trigger keywords. A concept fires once if any keyword is contained.
     */
    static final ImmutableListMultimap<String, String> LIFESTYLE_KEYWORDS = ImmutableListMultimap.<String, String>builder()
            .putAll("poor_sleep", "poor sleep", "bad sleep", "didn't sleep", "insomnia", "restless", "woke up")
            .putAll("good_sleep", "good sleep", "slept well", "rested", "8 hours")
            .putAll("high_stress", "stressed", "high stress", "stressful", "anxious", "overwhelmed", "pressure")
            .putAll("low_stress", "relaxed", "calm", "no stress", "peaceful")
            .putAll("exercise", "exercise", "workout", "gym", "running", "walking", "yoga", "swimming")
            .putAll("sedentary", "sedentary", "no exercise", "inactive", "sat all day")
            .putAll("healthy_eating", "healthy food", "vegetables", "balanced", "fruits", "salad")
            .putAll("unhealthy_eating", "junk food", "fast food", "skipped meal", "sugar", "alcohol")
            .build();

    static final String UNCLASSIFIED_SYMPTOM = "unclassified_symptom";
    static final String UNKNOWN_MEDICATION = "unknown_medication";
    static final String LIFESTYLE_LOGGED = "lifestyle_logged";
    static final String DOCTOR_VISIT = "doctor_visit";
    static final int FALLBACK_TOKENS = 4;

    private ConceptTables() {}
}

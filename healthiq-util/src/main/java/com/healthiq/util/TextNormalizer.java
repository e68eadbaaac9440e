package com.healthiq.util;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;

import java.util.List;
import java.util.Locale;

/**
 * Text helpers shared by the concept extractor and the alert rules.
 * All methods are null-safe and return an empty string for blank input.
 */
public final class TextNormalizer {

    private static final CharMatcher KEPT = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("'-"))
            .or(CharMatcher.whitespace());

    private static final Splitter TOKENS = Splitter.on(' ').omitEmptyStrings();
    private static final Joiner UNDERSCORE = Joiner.on('_');

    private TextNormalizer() {}

    /**
     * Lowercase, drop everything except letters, digits, hyphen, apostrophe and whitespace,
     * then collapse whitespace runs into single spaces and trim.
     *
     * @param text raw user text, may be null
     * @return normalized text, never null
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String stripped = KEPT.negate().removeFrom(lower);
        return CharMatcher.whitespace().trimAndCollapseFrom(stripped, ' ');
    }

    /**
     * Normalized text with spaces turned into underscores, e.g. "Vitamin D" -> "vitamin_d".
     */
    public static String toLabel(String text) {
        return normalize(text).replace(' ', '_');
    }

    /**
     * First {@code limit} tokens of the normalized text joined by underscores.
     */
    public static String firstTokensLabel(String text, int limit) {
        List<String> tokens = TOKENS.splitToList(normalize(text));
        return UNDERSCORE.join(Iterables.limit(tokens, limit));
    }

    /**
     * Key used to compare free-text descriptions: trimmed and lowercased, nothing else.
     */
    public static String descriptionKey(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}

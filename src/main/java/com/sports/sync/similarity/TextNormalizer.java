package com.sports.sync.similarity;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes provider-supplied names before comparison: replaces no-break spaces,
 * transliterates accented and special Latin letters to ASCII, case-folds and turns
 * every run of punctuation or whitespace into a single space.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[\\W_]+", Pattern.UNICODE_CHARACTER_CLASS);

    // Letters that NFD does not decompose into base + mark
    private static final Map<String, String> SPECIAL_LETTERS = Map.of(
            "ß", "ss",
            "ø", "o",
            "æ", "ae",
            "œ", "oe",
            "đ", "d",
            "ł", "l",
            "ı", "i",
            "þ", "th"
    );

    private TextNormalizer() {
        // Utility class
    }

    /**
     * Returns the normalized form of {@code input}; null or blank input yields an empty string.
     */
    public static String normalize(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        String result = input.replace('\u00A0', ' ').toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : SPECIAL_LETTERS.entrySet()) {
            result = result.replace(entry.getKey(), entry.getValue());
        }
        result = Normalizer.normalize(result, Normalizer.Form.NFD);
        result = COMBINING_MARKS.matcher(result).replaceAll("");
        result = NON_WORD.matcher(result).replaceAll(" ");
        return result.trim();
    }

    /**
     * Splits the normalized form of {@code input} into tokens.
     */
    public static List<String> tokens(String input) {
        String normalized = normalize(input);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }
}

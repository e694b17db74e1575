package dev.ebullient.ensemble;

import java.util.Locale;
import java.util.regex.Pattern;

public class StringUtils {

    private static final Pattern LEADING_DETERMINER = Pattern.compile(
            "^(?:the|a|an|some|his|her|their|its|my|your|our)\\s+", Pattern.CASE_INSENSITIVE);

    private StringUtils() {
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback;
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Trim a captured noun phrase and drop a leading article or possessive:
     * "the old lantern " becomes "old lantern".
     */
    public static String stripDeterminer(String phrase) {
        if (phrase == null) {
            return "";
        }
        String trimmed = phrase.trim();
        String stripped = LEADING_DETERMINER.matcher(trimmed).replaceFirst("");
        return stripped.isBlank() ? trimmed : stripped.trim();
    }

    /**
     * Check whether a display name occurs in text as a whole word, ignoring case.
     */
    public static boolean mentionsName(String text, String name) {
        if (isBlank(text) || isBlank(name)) {
            return false;
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(name.trim()) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                .matcher(text)
                .find();
    }
}

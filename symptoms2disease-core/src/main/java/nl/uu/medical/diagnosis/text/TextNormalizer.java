package nl.uu.medical.diagnosis.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization rules shared by extraction, canonicalization and graph lookups.
 */
public final class TextNormalizer {
    private TextNormalizer() {}

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern LABEL_SEPARATORS = Pattern.compile("[-_]+");

    /**
     * Lowercases, replaces punctuation (hyphens excepted) with spaces and collapses whitespace.
     * A null or punctuation-only input yields the empty string.
     */
    public static String normalize(String text) {
        if (text == null) return "";
        String s = text.toLowerCase(Locale.ROOT).strip();
        s = PUNCTUATION.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.strip();
    }

    /**
     * Normalization used when comparing graph labels: lowercase, trimmed, and every run of
     * hyphens or underscores turned into a single space.
     */
    public static String normalizeLabel(String text) {
        if (text == null) return "";
        String s = text.toLowerCase(Locale.ROOT).strip();
        return LABEL_SEPARATORS.matcher(s).replaceAll(" ");
    }
}

package nl.uu.medical.diagnosis.text;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds known symptom phrases in free patient text.
 * <p>
 * Longer phrases are tried first so that "shortness of breath" wins over "breath", and a
 * phrase occurrence overlapping an already accepted span is skipped. When no known phrase
 * occurs at all, the text is split into short chunks so that canonicalization can still
 * attempt to map them.
 * </p>
 */
public final class SymptomPhraseExtractor {

    public static final int DEFAULT_MAX_MATCHES = 20;
    static final int MIN_CHUNK_LENGTH = 2;
    static final int MAX_CHUNK_LENGTH = 60;

    private static final Pattern CHUNK_SEPARATORS = Pattern.compile("[.;,\\n]| and | but | or ");

    private record KnownPhrase(String text, Pattern pattern) {}

    private record Span(int start, int end) {
        boolean overlaps(Span other) {
            return !(end <= other.start || start >= other.end);
        }
    }

    private final List<KnownPhrase> phrases;
    private final int maxMatches;

    public SymptomPhraseExtractor(Collection<String> vocabulary) {
        this(vocabulary, DEFAULT_MAX_MATCHES);
    }

    public SymptomPhraseExtractor(Collection<String> vocabulary, int maxMatches) {
        if (maxMatches < 1) {
            throw new IllegalArgumentException("maxMatches must be >= 1 but was " + maxMatches);
        }
        this.maxMatches = maxMatches;
        Set<String> distinct = new TreeSet<>();
        for (String v : Objects.requireNonNull(vocabulary, "vocabulary")) {
            String n = TextNormalizer.normalize(v);
            if (!n.isEmpty()) distinct.add(n);
        }
        List<String> ordered = new ArrayList<>(distinct);
        // longest first, alphabetical among equal lengths
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        List<KnownPhrase> compiled = new ArrayList<>(ordered.size());
        for (String p : ordered) {
            compiled.add(new KnownPhrase(p, Pattern.compile("(?<!\\S)" + Pattern.quote(p) + "(?!\\S)")));
        }
        this.phrases = List.copyOf(compiled);
    }

    public int vocabularySize() {
        return phrases.size();
    }

    public List<String> extract(String patientText) {
        String text = TextNormalizer.normalize(patientText);
        if (text.isEmpty()) return List.of();

        Set<String> found = new LinkedHashSet<>();
        List<Span> used = new ArrayList<>();
        for (KnownPhrase phrase : phrases) {
            Matcher m = phrase.pattern().matcher(text);
            while (m.find()) {
                Span span = new Span(m.start(), m.end());
                if (used.stream().anyMatch(span::overlaps)) continue;
                used.add(span);
                found.add(phrase.text());
                if (found.size() >= maxMatches) {
                    return List.copyOf(found);
                }
            }
        }
        if (!found.isEmpty()) {
            return List.copyOf(found);
        }

        // chunk the raw text: normalization would already have removed the punctuation separators
        List<String> chunks = new ArrayList<>();
        for (String c : CHUNK_SEPARATORS.split(patientText.toLowerCase(Locale.ROOT))) {
            String chunk = TextNormalizer.normalize(c);
            if (chunk.length() >= MIN_CHUNK_LENGTH && chunk.length() <= MAX_CHUNK_LENGTH) {
                chunks.add(chunk);
                if (chunks.size() >= maxMatches) break;
            }
        }
        return List.copyOf(chunks);
    }
}

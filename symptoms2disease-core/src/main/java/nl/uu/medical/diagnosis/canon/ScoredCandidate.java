package nl.uu.medical.diagnosis.canon;

/**
 * A vocabulary entry retrieved for a phrase, with its cosine similarity to the phrase.
 */
public record ScoredCandidate(VocabularyEntry entry, double score) {

    public String text() {
        return entry.text();
    }

    public String key() {
        return entry.key();
    }
}

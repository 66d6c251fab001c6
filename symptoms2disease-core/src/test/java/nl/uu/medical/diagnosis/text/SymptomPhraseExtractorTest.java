package nl.uu.medical.diagnosis.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymptomPhraseExtractorTest {

    private static final List<String> VOCABULARY =
            List.of("shortness of breath", "breath", "fever", "cough", "dry cough", "rash");

    @Test
    void prefersLongerPhrasesAndSkipsOverlaps() {
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(VOCABULARY);

        List<String> found = extractor.extract("Shortness of breath, a dry cough and some fever");

        assertEquals(List.of("shortness of breath", "dry cough", "fever"), found);
    }

    @Test
    void findsAdjacentPhrases() {
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(VOCABULARY);

        assertEquals(List.of("cough", "fever"), extractor.extract("fever cough"));
    }

    @Test
    void matchesWholeWordsOnly() {
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(List.of("rash"));

        assertEquals(List.of("thrash metal"), extractor.extract("Thrash metal"));
    }

    @Test
    void reportsEachPhraseOnce() {
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(VOCABULARY);

        assertEquals(List.of("fever"), extractor.extract("fever at night, fever in the morning"));
    }

    @Test
    void stopsAtMaxMatches() {
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(VOCABULARY, 2);

        assertEquals(2, extractor.extract("rash, fever, cough and shortness of breath").size());
    }

    @Test
    void fallsBackToChunksWhenNothingIsKnown() {
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(VOCABULARY);

        List<String> chunks = extractor.extract("My head hurts; I feel dizzy and tired. X");

        assertEquals(List.of("my head hurts", "i feel dizzy", "tired"), chunks);
    }

    @Test
    void emptyTextGivesNothing() {
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(VOCABULARY);

        assertTrue(extractor.extract("  ...  ").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    void vocabularyIsNormalizedAndDeduplicated() {
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(List.of("Fever", "fever!", " ", "Cough"));

        assertEquals(2, extractor.vocabularySize());
    }

    @Test
    void rejectsNonPositiveMaxMatches() {
        assertThrows(IllegalArgumentException.class, () -> new SymptomPhraseExtractor(VOCABULARY, 0));
    }
}

package nl.uu.medical.diagnosis.match;

import java.util.List;

/**
 * Overlap of one disease with one symptom query. {@code matchedSymptoms} holds the sorted labels
 * of the shared symptoms.
 */
public record MatchResult(String diseaseIri,
                          String diseaseName,
                          List<String> matchedSymptoms,
                          int matchCount,
                          double similarityScore,
                          int totalDiseaseSymptoms,
                          int totalInputSymptoms) {

    public MatchResult {
        matchedSymptoms = List.copyOf(matchedSymptoms);
    }
}

package nl.uu.medical.diagnosis.runtime;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import nl.uu.medical.diagnosis.canon.CanonicalizationResult;
import nl.uu.medical.diagnosis.fusion.ClassifierPrediction;
import nl.uu.medical.diagnosis.fusion.FusionVerdict;
import nl.uu.medical.diagnosis.match.MatchResult;
import nl.uu.medical.diagnosis.spi.DiseaseInfo;

import java.util.List;
import java.util.Optional;

/**
 * Everything computed for one patient description, from extracted phrases to the fused verdict.
 */
@Value
@Builder(toBuilder = true)
@RegisterForReflection
public class DiagnosisReport {

    /**
     * The patient's description as received.
     */
    String symptomText;

    /**
     * Phrases found in the text, longest vocabulary phrases first.
     */
    @Singular
    List<String> extractedPhrases;

    @Singular
    List<CanonicalizationResult> canonicalizations;

    /**
     * Canonical phrases of the accepted canonicalizations; the matcher's query.
     */
    @Singular
    List<String> canonicalSymptoms;

    @Singular
    List<MatchResult> candidates;

    ClassifierPrediction prediction;

    FusionVerdict verdict;

    /**
     * Wikidata Q-id of the verdict's disease, when the graph links one.
     */
    String externalId;

    DiseaseInfo enrichment;

    String explanation;

    public Optional<String> externalIdValue() {
        return Optional.ofNullable(externalId);
    }

    public Optional<DiseaseInfo> enrichmentValue() {
        return Optional.ofNullable(enrichment);
    }

    public Optional<String> explanationValue() {
        return Optional.ofNullable(explanation);
    }
}

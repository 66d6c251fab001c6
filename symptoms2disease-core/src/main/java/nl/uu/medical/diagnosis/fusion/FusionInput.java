package nl.uu.medical.diagnosis.fusion;

import nl.uu.medical.diagnosis.match.MatchResult;

import java.util.List;
import java.util.Objects;

/**
 * Everything a {@link FusionStep} may read. Immutable for the duration of one {@code fuse} call.
 */
public record FusionInput(ClassifierPrediction prediction,
                          List<MatchResult> candidates,
                          List<String> querySymptoms,
                          PrimarySymptomLookup primarySymptoms) {

    public FusionInput {
        Objects.requireNonNull(prediction, "prediction");
        Objects.requireNonNull(primarySymptoms, "primarySymptoms");
        candidates = List.copyOf(candidates);
        querySymptoms = List.copyOf(querySymptoms);
    }
}

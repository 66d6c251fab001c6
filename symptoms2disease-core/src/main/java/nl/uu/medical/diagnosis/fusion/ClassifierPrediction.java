package nl.uu.medical.diagnosis.fusion;

import java.util.Objects;

/**
 * Label and probability produced by the statistical classifier.
 */
public record ClassifierPrediction(String diseaseId, double score) {

    public ClassifierPrediction {
        Objects.requireNonNull(diseaseId, "diseaseId");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Classifier score must be within [0, 1] but was " + score);
        }
    }
}

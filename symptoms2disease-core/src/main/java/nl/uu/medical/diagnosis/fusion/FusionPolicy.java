package nl.uu.medical.diagnosis.fusion;

/**
 * Constants of the standard rule chain.
 *
 * @param agreementBonus        added when the classifier's disease is among the graph candidates
 * @param primarySymptomPenalty factor applied when no primary symptom of the predicted disease was reported
 * @param fallbackThreshold     below this score the top graph candidate replaces the classifier's verdict
 */
public record FusionPolicy(double agreementBonus, double primarySymptomPenalty, double fallbackThreshold) {

    public static final FusionPolicy DEFAULT = new FusionPolicy(0.20, 0.5, 0.40);

    public FusionPolicy {
        if (!Double.isFinite(agreementBonus) || agreementBonus < 0.0) {
            throw new IllegalArgumentException("agreementBonus must be a finite value >= 0 but was " + agreementBonus);
        }
        if (!Double.isFinite(primarySymptomPenalty) || primarySymptomPenalty < 0.0 || primarySymptomPenalty > 1.0) {
            throw new IllegalArgumentException("primarySymptomPenalty must be within [0, 1] but was " + primarySymptomPenalty);
        }
        if (!Double.isFinite(fallbackThreshold)) {
            throw new IllegalArgumentException("fallbackThreshold must be finite but was " + fallbackThreshold);
        }
    }
}

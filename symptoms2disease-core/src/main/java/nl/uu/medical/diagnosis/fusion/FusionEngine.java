package nl.uu.medical.diagnosis.fusion;

import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.match.MatchResult;

import java.util.List;
import java.util.Objects;

/**
 * Runs a classifier prediction through an ordered chain of {@link FusionStep}s.
 * The engine holds no per-call state; a single instance serves concurrent requests.
 */
public final class FusionEngine {

    public static final double SCORE_CAP = 1.0;

    private final List<FusionStep> steps;

    public FusionEngine(List<FusionStep> steps) {
        this.steps = List.copyOf(steps);
    }

    /**
     * Agreement bonus, primary symptom sanity check, then low-confidence fallback.
     */
    public static FusionEngine standard(FusionPolicy policy) {
        return new FusionEngine(List.of(
            new AgreementBonusStep(policy.agreementBonus(), SCORE_CAP),
            new PrimarySymptomSanityStep(policy.primarySymptomPenalty()),
            new LowConfidenceFallbackStep(policy.fallbackThreshold())));
    }

    public List<FusionStep> steps() {
        return steps;
    }

    public FusionVerdict fuse(ClassifierPrediction prediction,
                              List<MatchResult> candidates,
                              List<String> querySymptoms,
                              PrimarySymptomLookup primarySymptoms) {
        FusionInput input = new FusionInput(prediction, candidates, querySymptoms, primarySymptoms);
        ReasoningTrace trace = new ReasoningTrace();
        FusionState state = new FusionState(prediction.diseaseId(), prediction.score(), false);

        for (FusionStep step : steps) {
            state = Objects.requireNonNull(step.apply(input, state, trace),
                () -> "Fusion step '" + step.name() + "' returned no state");
        }

        double finalScore = Math.max(0.0, Math.min(SCORE_CAP, state.score()));
        Log.debugf("Fused %s (%.2f) into %s (%.2f), fallback=%s",
            prediction.diseaseId(), prediction.score(), state.disease(), finalScore, state.fallback());
        return new FusionVerdict(state.disease(), prediction.score(), finalScore, trace.steps(), state.fallback());
    }
}

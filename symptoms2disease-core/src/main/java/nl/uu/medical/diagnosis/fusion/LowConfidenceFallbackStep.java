package nl.uu.medical.diagnosis.fusion;

import nl.uu.medical.diagnosis.match.MatchResult;

/**
 * Replaces a weak classifier verdict by the top knowledge graph candidate.
 */
public final class LowConfidenceFallbackStep implements FusionStep {

    private final double threshold;

    public LowConfidenceFallbackStep(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return "low-confidence-fallback";
    }

    @Override
    public FusionState apply(FusionInput input, FusionState state, ReasoningTrace trace) {
        if (state.score() >= threshold) {
            return state;
        }
        if (input.candidates().isEmpty()) {
            trace.record("Low confidence (%.2f < %.2f) but the knowledge graph has no candidate; keeping %s",
                state.score(), threshold, state.disease());
            return state;
        }
        MatchResult top = input.candidates().get(0);
        trace.record("Fallback: confidence %.2f < %.2f, using knowledge graph match %s (similarity %.2f)",
            state.score(), threshold, top.diseaseName(), top.similarityScore());
        return state.fallbackTo(top.diseaseName(), top.similarityScore());
    }
}

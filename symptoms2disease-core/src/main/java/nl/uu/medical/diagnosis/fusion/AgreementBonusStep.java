package nl.uu.medical.diagnosis.fusion;

import nl.uu.medical.diagnosis.match.MatchResult;
import nl.uu.medical.diagnosis.text.TextNormalizer;

/**
 * Rewards a classifier verdict that the knowledge graph also proposes.
 */
public final class AgreementBonusStep implements FusionStep {

    private final double bonus;
    private final double cap;

    public AgreementBonusStep(double bonus, double cap) {
        this.bonus = bonus;
        this.cap = cap;
    }

    @Override
    public String name() {
        return "agreement";
    }

    @Override
    public FusionState apply(FusionInput input, FusionState state, ReasoningTrace trace) {
        String predicted = TextNormalizer.normalizeLabel(state.disease());
        for (MatchResult candidate : input.candidates()) {
            if (TextNormalizer.normalizeLabel(candidate.diseaseName()).equals(predicted)) {
                double boosted = Math.min(cap, state.score() + bonus);
                trace.record("Agreement: the knowledge graph also suggests %s (+%.2f, score %.2f -> %.2f)",
                    candidate.diseaseName(), bonus, state.score(), boosted);
                return state.withScore(boosted);
            }
        }
        trace.record("Disagreement: %s is not among the knowledge graph candidates (no penalty)", state.disease());
        return state;
    }
}

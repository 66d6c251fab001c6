package nl.uu.medical.diagnosis.fusion;

import nl.uu.medical.diagnosis.text.TextNormalizer;

import java.util.Set;
import java.util.TreeSet;

/**
 * Penalizes a verdict when none of the predicted disease's primary symptoms was reported.
 * Diseases without primary symptoms are left alone.
 */
public final class PrimarySymptomSanityStep implements FusionStep {

    private final double penalty;

    public PrimarySymptomSanityStep(double penalty) {
        this.penalty = penalty;
    }

    @Override
    public String name() {
        return "primary-symptom-sanity";
    }

    @Override
    public FusionState apply(FusionInput input, FusionState state, ReasoningTrace trace) {
        Set<String> primary = input.primarySymptoms().primarySymptomsOf(state.disease());
        if (primary == null || primary.isEmpty()) {
            return state;
        }
        Set<String> expected = normalized(primary);
        Set<String> reported = normalized(input.querySymptoms());
        for (String p : expected) {
            if (reported.contains(p)) {
                trace.record("Confirmed: reported symptoms include primary symptom '%s' of %s", p, state.disease());
                return state;
            }
        }
        double penalized = state.score() * penalty;
        trace.record("Missing primary symptoms of %s: expected one of [%s] (x%.2f, score %.2f -> %.2f)",
            state.disease(), String.join(", ", expected), penalty, state.score(), penalized);
        return state.withScore(penalized);
    }

    private static Set<String> normalized(Iterable<String> labels) {
        Set<String> out = new TreeSet<>();
        for (String l : labels) {
            String n = TextNormalizer.normalizeLabel(l);
            if (!n.isEmpty()) out.add(n);
        }
        return out;
    }
}

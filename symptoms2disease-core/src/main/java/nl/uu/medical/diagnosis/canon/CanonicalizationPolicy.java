package nl.uu.medical.diagnosis.canon;

/**
 * Thresholds of the accept / ambiguous decision.
 *
 * @param acceptThreshold minimum cosine similarity of the top candidate
 * @param ambiguityDelta  when top1 - top2 falls below this margin the result is ambiguous
 */
public record CanonicalizationPolicy(double acceptThreshold, double ambiguityDelta) {

    public static final CanonicalizationPolicy DEFAULT = new CanonicalizationPolicy(0.62, 0.08);

    public CanonicalizationPolicy {
        if (!Double.isFinite(acceptThreshold)) {
            throw new IllegalArgumentException("acceptThreshold must be finite but was " + acceptThreshold);
        }
        if (!Double.isFinite(ambiguityDelta) || ambiguityDelta < 0.0) {
            throw new IllegalArgumentException("ambiguityDelta must be a finite value >= 0 but was " + ambiguityDelta);
        }
    }
}

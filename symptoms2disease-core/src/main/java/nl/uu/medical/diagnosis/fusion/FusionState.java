package nl.uu.medical.diagnosis.fusion;

/**
 * Running verdict handed from one step to the next.
 */
public record FusionState(String disease, double score, boolean fallback) {

    public FusionState withScore(double newScore) {
        return new FusionState(disease, newScore, fallback);
    }

    public FusionState fallbackTo(String newDisease, double newScore) {
        return new FusionState(newDisease, newScore, true);
    }
}

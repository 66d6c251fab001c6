package nl.uu.medical.diagnosis.match;

/**
 * How a disease's overlap with the query is turned into a score.
 */
public enum SimilarityMode {
    /** |query ∩ disease| / |query ∪ disease|; penalizes diseases with many unrelated symptoms. */
    JACCARD,
    /** |query ∩ disease| / |query|; rewards diseases explaining every reported symptom. */
    COVERAGE;

    public static SimilarityMode of(boolean useJaccard) {
        return useJaccard ? JACCARD : COVERAGE;
    }

    double score(int intersection, int union, int query) {
        if (this == JACCARD && union > 0) {
            return (double) intersection / union;
        }
        return (double) intersection / query;
    }
}

package nl.uu.medical.diagnosis.fusion;

import java.util.List;

/**
 * Adjudicated result of one fusion. {@code originalScore} is the classifier's raw probability;
 * {@code fallback} is true only when the top graph candidate replaced the classifier's disease.
 */
public record FusionVerdict(String disease,
                            double originalScore,
                            double finalScore,
                            List<String> reasoning,
                            boolean fallback) {

    public FusionVerdict {
        reasoning = List.copyOf(reasoning);
    }
}

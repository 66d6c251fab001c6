package nl.uu.medical.diagnosis.canon;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Outcome of canonicalizing one phrase. An empty candidate list means the phrase could not be
 * embedded at all; it is a valid, non-accepted result rather than a failure.
 */
public record CanonicalizationResult(String input,
                                     String normalized,
                                     List<ScoredCandidate> candidates,
                                     boolean accepted,
                                     boolean ambiguous) {

    public CanonicalizationResult {
        candidates = List.copyOf(candidates);
        if (accepted && candidates.isEmpty()) {
            throw new IllegalArgumentException("An accepted result needs at least one candidate");
        }
    }

    static CanonicalizationResult rejected(String input, String normalized) {
        return new CanonicalizationResult(input, normalized, List.of(), false, false);
    }

    /**
     * The accepted top candidate.
     */
    public Optional<ScoredCandidate> match() {
        return accepted ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    /**
     * Similarity of the accepted top candidate.
     */
    public OptionalDouble score() {
        return accepted ? OptionalDouble.of(candidates.get(0).score()) : OptionalDouble.empty();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}

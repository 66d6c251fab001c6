package nl.uu.medical.diagnosis.canon;

import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.exceptions.IndexConsistencyException;
import nl.uu.medical.diagnosis.text.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps noisy symptom phrases onto the canonical vocabulary of an {@link EmbeddingIndex}.
 * <p>
 * A phrase is accepted when its best candidate reaches {@code acceptThreshold} and beats the
 * runner-up by at least {@code ambiguityDelta}. Calls share no mutable state and never throw for
 * an unusable phrase; such phrases come back as non-accepted results without candidates.
 * </p>
 */
public final class TermCanonicalizer {

    public static final int DEFAULT_CANDIDATES = 2;

    private final PhraseEmbedder embedder;
    private final EmbeddingIndex index;
    private final CanonicalizationPolicy policy;

    public TermCanonicalizer(PhraseEmbedder embedder, EmbeddingIndex index) {
        this(embedder, index, CanonicalizationPolicy.DEFAULT);
    }

    public TermCanonicalizer(PhraseEmbedder embedder, EmbeddingIndex index, CanonicalizationPolicy policy) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.index = Objects.requireNonNull(index, "index");
        this.policy = Objects.requireNonNull(policy, "policy");
        if (embedder.dimension() != index.dimension()) {
            throw new IndexConsistencyException("Embedding model dimension " + embedder.dimension()
                + " != index dimension " + index.dimension());
        }
    }

    public CanonicalizationPolicy policy() {
        return policy;
    }

    public CanonicalizationResult canonicalizeOne(String phrase) {
        return canonicalizeOne(phrase, DEFAULT_CANDIDATES);
    }

    public CanonicalizationResult canonicalizeOne(String phrase, int k) {
        if (k < 2) {
            throw new IllegalArgumentException("k must be >= 2 for ambiguity assessment but was " + k);
        }
        String normalized = TextNormalizer.normalize(phrase);
        if (normalized.isEmpty()) {
            return CanonicalizationResult.rejected(phrase, normalized);
        }

        float[] query;
        try {
            query = embedder.embed(normalized);
        } catch (RuntimeException e) {
            Log.warnf(e, "Unable to embed phrase '%s'", normalized);
            return CanonicalizationResult.rejected(phrase, normalized);
        }
        if (query == null || query.length != index.dimension() || VectorMath.isZero(query)) {
            Log.debugf("Phrase '%s' has no usable embedding", normalized);
            return CanonicalizationResult.rejected(phrase, normalized);
        }

        List<ScoredCandidate> candidates = index.search(VectorMath.unitNormalize(query), k);
        if (candidates.isEmpty()) {
            return CanonicalizationResult.rejected(phrase, normalized);
        }

        double top1 = candidates.get(0).score();
        boolean ambiguous = candidates.size() >= 2
            && (top1 - candidates.get(1).score()) < policy.ambiguityDelta();
        boolean accepted = top1 >= policy.acceptThreshold() && !ambiguous;

        if (!accepted) {
            Log.debugf("Phrase '%s' not accepted (top '%s' %.4f, ambiguous=%s)",
                normalized, candidates.get(0).text(), top1, ambiguous);
        }
        return new CanonicalizationResult(phrase, normalized, candidates, accepted, ambiguous);
    }

    public List<CanonicalizationResult> canonicalizeMany(List<String> phrases) {
        return canonicalizeMany(phrases, DEFAULT_CANDIDATES);
    }

    public List<CanonicalizationResult> canonicalizeMany(List<String> phrases, int k) {
        List<CanonicalizationResult> out = new ArrayList<>(phrases.size());
        for (String p : phrases) {
            out.add(canonicalizeOne(p, k));
        }
        return out;
    }
}

package nl.uu.medical.diagnosis.runtime;

import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.canon.CanonicalizationResult;
import nl.uu.medical.diagnosis.canon.EmbeddingIndex;
import nl.uu.medical.diagnosis.canon.TermCanonicalizer;
import nl.uu.medical.diagnosis.fusion.ClassifierPrediction;
import nl.uu.medical.diagnosis.fusion.FusionEngine;
import nl.uu.medical.diagnosis.fusion.FusionVerdict;
import nl.uu.medical.diagnosis.graph.KnowledgeGraphStore;
import nl.uu.medical.diagnosis.match.DiseaseMatcher;
import nl.uu.medical.diagnosis.match.MatchResult;
import nl.uu.medical.diagnosis.match.SimilarityMode;
import nl.uu.medical.diagnosis.text.SymptomPhraseExtractor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Text to verdict: phrase extraction, canonicalization, graph matching and fusion over
 * structures built once by {@link DiagnosisBootstrap}. Instances are immutable and thread safe.
 */
public final class DiagnosisEngine {

    private final KnowledgeGraphStore store;
    private final EmbeddingIndex index;
    private final SymptomPhraseExtractor extractor;
    private final TermCanonicalizer canonicalizer;
    private final DiseaseMatcher matcher;
    private final FusionEngine fusion;
    private final int candidates;
    private final Integer topK;
    private final SimilarityMode mode;

    DiagnosisEngine(KnowledgeGraphStore store,
                    EmbeddingIndex index,
                    SymptomPhraseExtractor extractor,
                    TermCanonicalizer canonicalizer,
                    DiseaseMatcher matcher,
                    FusionEngine fusion,
                    int candidates,
                    Integer topK,
                    SimilarityMode mode) {
        this.store = Objects.requireNonNull(store, "store");
        this.index = Objects.requireNonNull(index, "index");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.fusion = Objects.requireNonNull(fusion, "fusion");
        if (candidates < 2) {
            throw new IllegalArgumentException("candidates must be >= 2 but was " + candidates);
        }
        if (topK != null && topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1 when given but was " + topK);
        }
        this.candidates = candidates;
        this.topK = topK;
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public KnowledgeGraphStore store() {
        return store;
    }

    public EmbeddingIndex index() {
        return index;
    }

    public SimilarityMode similarityMode() {
        return mode;
    }

    public List<String> extractPhrases(String symptomText) {
        return extractor.extract(symptomText);
    }

    public List<CanonicalizationResult> canonicalize(List<String> phrases) {
        return canonicalizer.canonicalizeMany(phrases, candidates);
    }

    /**
     * Canonical phrases of the accepted results, first occurrence order. Ambiguous and
     * below-threshold phrases are dropped, never replaced by a guess.
     */
    public static List<String> acceptedSymptoms(List<CanonicalizationResult> results) {
        Set<String> accepted = new LinkedHashSet<>();
        for (CanonicalizationResult r : results) {
            r.match().ifPresent(c -> accepted.add(c.text()));
        }
        return new ArrayList<>(accepted);
    }

    public List<MatchResult> match(List<String> symptoms) {
        return matcher.findNearestDiseases(symptoms, topK, mode);
    }

    public FusionVerdict fuse(ClassifierPrediction prediction, List<MatchResult> candidates, List<String> querySymptoms) {
        return fusion.fuse(prediction, candidates, querySymptoms, store::primarySymptomsOf);
    }

    public DiagnosisReport analyze(String symptomText, ClassifierPrediction prediction) {
        List<String> phrases = extractPhrases(symptomText);
        List<CanonicalizationResult> canon = canonicalize(phrases);
        List<String> symptoms = acceptedSymptoms(canon);
        List<MatchResult> ranked = match(symptoms);
        FusionVerdict verdict = fuse(prediction, ranked, symptoms);

        Log.debugf("Analyzed %d phrases, %d accepted, %d candidates; verdict %s",
                phrases.size(), symptoms.size(), ranked.size(), verdict.disease());

        return DiagnosisReport.builder()
                .symptomText(symptomText)
                .extractedPhrases(phrases)
                .canonicalizations(canon)
                .canonicalSymptoms(symptoms)
                .candidates(ranked)
                .prediction(prediction)
                .verdict(verdict)
                .externalId(store.externalIdOf(verdict.disease()).orElse(null))
                .build();
    }
}

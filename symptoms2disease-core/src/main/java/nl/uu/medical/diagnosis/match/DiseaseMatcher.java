package nl.uu.medical.diagnosis.match;

import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.graph.DiseaseEntity;
import nl.uu.medical.diagnosis.graph.KnowledgeGraphStore;
import nl.uu.medical.diagnosis.graph.SymptomEntity;

import java.util.*;

/**
 * Ranks the diseases of a {@link KnowledgeGraphStore} by their overlap with a symptom query.
 * Diseases sharing no symptom with the query are never returned.
 */
public final class DiseaseMatcher {

    /**
     * Score descending, then match count descending, then disease label ascending.
     */
    public static final Comparator<MatchResult> RANKING = Comparator
        .comparingDouble(MatchResult::similarityScore).reversed()
        .thenComparing(Comparator.comparingInt(MatchResult::matchCount).reversed())
        .thenComparing(MatchResult::diseaseName);

    private final KnowledgeGraphStore store;

    public DiseaseMatcher(KnowledgeGraphStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public List<MatchResult> findNearestDiseases(List<String> symptomLabels) {
        return findNearestDiseases(symptomLabels, null, true);
    }

    public List<MatchResult> findNearestDiseases(List<String> symptomLabels, Integer topK, boolean useJaccard) {
        return findNearestDiseases(symptomLabels, topK, SimilarityMode.of(useJaccard));
    }

    /**
     * @param symptomLabels free symptom labels, resolved permissively against the graph
     * @param topK          maximum number of results, or {@code null} for all
     * @param mode          scoring rule
     * @return ranked matches; empty when no label resolves to a known symptom
     */
    public List<MatchResult> findNearestDiseases(List<String> symptomLabels, Integer topK, SimilarityMode mode) {
        if (topK != null && topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1 when given but was " + topK);
        }
        Objects.requireNonNull(mode, "mode");

        Set<SymptomEntity> query = store.findSymptomEntities(symptomLabels);
        if (query.isEmpty()) {
            Log.debugf("No known symptoms among %s", symptomLabels);
            return List.of();
        }

        List<MatchResult> results = new ArrayList<>();
        for (Map.Entry<DiseaseEntity, Set<SymptomEntity>> e : store.allDiseaseSymptomSets().entrySet()) {
            Set<SymptomEntity> diseaseSymptoms = e.getValue();
            Set<SymptomEntity> intersection = new HashSet<>(query);
            intersection.retainAll(diseaseSymptoms);
            if (intersection.isEmpty()) continue;

            Set<SymptomEntity> union = new HashSet<>(query);
            union.addAll(diseaseSymptoms);

            List<String> matched = new ArrayList<>();
            for (SymptomEntity s : intersection) matched.add(store.labelOf(s));
            Collections.sort(matched);

            DiseaseEntity disease = e.getKey();
            results.add(new MatchResult(
                disease.iri(),
                store.labelOf(disease),
                matched,
                intersection.size(),
                mode.score(intersection.size(), union.size(), query.size()),
                diseaseSymptoms.size(),
                query.size()));
        }

        results.sort(RANKING);
        return topK != null && results.size() > topK ? List.copyOf(results.subList(0, topK)) : List.copyOf(results);
    }
}

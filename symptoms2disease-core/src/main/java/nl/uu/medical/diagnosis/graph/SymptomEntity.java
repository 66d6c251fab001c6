package nl.uu.medical.diagnosis.graph;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A symptom node of the graph. Identity is the IRI; labels are keyed by language tag
 * (empty key for untagged labels). Which diseases list the symptom, and in which role,
 * lives on {@link DiseaseEntity}.
 */
public final class SymptomEntity {

    private final String iri;
    private final Map<String, String> labels;
    private final Set<String> equivalents;

    public SymptomEntity(String iri, Map<String, String> labels, Set<String> equivalents) {
        this.iri = Objects.requireNonNull(iri, "iri");
        this.labels = Map.copyOf(labels);
        this.equivalents = Set.copyOf(equivalents);
    }

    public String iri() {
        return iri;
    }

    public Map<String, String> labels() {
        return labels;
    }

    public Set<String> equivalents() {
        return equivalents;
    }

    public String localName() {
        return GraphVocabulary.localName(iri);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof SymptomEntity other && iri.equals(other.iri));
    }

    @Override
    public int hashCode() {
        return iri.hashCode();
    }

    @Override
    public String toString() {
        return "SymptomEntity[" + iri + "]";
    }
}

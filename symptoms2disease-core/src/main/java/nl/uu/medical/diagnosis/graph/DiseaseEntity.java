package nl.uu.medical.diagnosis.graph;

import java.util.*;

/**
 * A disease node with its three disjoint role edge sets.
 */
public final class DiseaseEntity {

    private final String iri;
    private final Map<String, String> labels;
    private final Set<String> equivalents;
    private final Map<SymptomRole, Set<SymptomEntity>> roles;
    private final Set<SymptomEntity> allSymptoms;

    public DiseaseEntity(String iri,
                         Map<String, String> labels,
                         Set<String> equivalents,
                         Map<SymptomRole, ? extends Collection<SymptomEntity>> roles) {
        this.iri = Objects.requireNonNull(iri, "iri");
        this.labels = Map.copyOf(labels);
        this.equivalents = Set.copyOf(equivalents);

        EnumMap<SymptomRole, Set<SymptomEntity>> copy = new EnumMap<>(SymptomRole.class);
        Set<SymptomEntity> union = new LinkedHashSet<>();
        for (SymptomRole role : SymptomRole.values()) {
            Collection<SymptomEntity> given = roles.get(role);
            Set<SymptomEntity> edges = given == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(given));
            copy.put(role, edges);
            union.addAll(edges);
        }
        this.roles = Collections.unmodifiableMap(copy);
        this.allSymptoms = Collections.unmodifiableSet(union);
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

    public Set<SymptomEntity> symptoms(SymptomRole role) {
        return roles.get(role);
    }

    /**
     * Union of the primary, secondary and complication edges.
     */
    public Set<SymptomEntity> allSymptoms() {
        return allSymptoms;
    }

    public Optional<SymptomRole> roleOf(SymptomEntity symptom) {
        for (Map.Entry<SymptomRole, Set<SymptomEntity>> e : roles.entrySet()) {
            if (e.getValue().contains(symptom)) return Optional.of(e.getKey());
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof DiseaseEntity other && iri.equals(other.iri));
    }

    @Override
    public int hashCode() {
        return iri.hashCode();
    }

    @Override
    public String toString() {
        return "DiseaseEntity[" + iri + "]";
    }
}

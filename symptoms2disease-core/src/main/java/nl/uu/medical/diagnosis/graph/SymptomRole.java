package nl.uu.medical.diagnosis.graph;

/**
 * Clinical significance of a disease → symptom edge.
 */
public enum SymptomRole {
    PRIMARY("hasPrimarySymptom"),
    SECONDARY("hasSecondarySymptom"),
    COMPLICATION("hasComplication");

    private final String predicateName;

    SymptomRole(String predicateName) {
        this.predicateName = predicateName;
    }

    public String predicateName() {
        return predicateName;
    }

    public String predicate(String namespace) {
        return namespace + predicateName;
    }
}

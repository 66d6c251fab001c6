package nl.uu.medical.diagnosis.fusion;

import java.util.Set;

/**
 * Primary symptom labels of a disease, empty when the disease is unknown or defines none.
 * {@code KnowledgeGraphStore::primarySymptomsOf} is the usual implementation.
 */
@FunctionalInterface
public interface PrimarySymptomLookup {

    Set<String> primarySymptomsOf(String diseaseLabel);
}

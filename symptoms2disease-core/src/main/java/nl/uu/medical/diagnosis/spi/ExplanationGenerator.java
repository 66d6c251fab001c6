package nl.uu.medical.diagnosis.spi;

/**
 * Produces a patient-facing explanation of a diagnosis, typically via a language model.
 */
public interface ExplanationGenerator {

    String explain(String symptomText, String disease, double confidence);
}

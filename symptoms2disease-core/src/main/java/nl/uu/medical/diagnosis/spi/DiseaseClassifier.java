package nl.uu.medical.diagnosis.spi;

import nl.uu.medical.diagnosis.fusion.ClassifierPrediction;

/**
 * Statistical text classifier, consumed as a black box.
 */
public interface DiseaseClassifier {

    ClassifierPrediction predict(String symptomText);
}

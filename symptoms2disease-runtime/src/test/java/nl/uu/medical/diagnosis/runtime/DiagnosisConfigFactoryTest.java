package nl.uu.medical.diagnosis.runtime;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosisConfigFactoryTest {

    @Test
    void defaults() {
        DiagnosisConfig config = DiagnosisConfigFactory.create();

        assertEquals("ontology/medical-graph.yaml", config.graph().location());
        assertEquals("http://uu.nl/medical/", config.graph().namespace());
        assertEquals("en", config.graph().language());
        assertTrue(config.index().vectorsLocation().isEmpty());
        assertEquals(300, config.index().dimension());
        assertEquals(0.62, config.canonicalizer().acceptThreshold());
        assertEquals(0.08, config.canonicalizer().ambiguityDelta());
        assertEquals(2, config.canonicalizer().candidates());
        assertTrue(config.matcher().useJaccard());
        assertTrue(config.matcher().topK().isEmpty());
        assertEquals(0.20, config.fusion().agreementBonus());
        assertEquals(0.5, config.fusion().primarySymptomPenalty());
        assertEquals(0.40, config.fusion().fallbackThreshold());
        assertEquals(20, config.extractor().maxMatches());
        assertEquals(10000L, config.enrichment().timeoutMillis());
    }

    @Test
    void overridesWin() {
        DiagnosisConfig config = DiagnosisConfigFactory.create(Map.of(
                "diagnosis.matcher.use-jaccard", "false",
                "diagnosis.fusion.fallback-threshold", "0.25",
                "diagnosis.index.vectors-location", "/tmp/vectors.json",
                "diagnosis.matcher.top-k", "3"));

        assertFalse(config.matcher().useJaccard());
        assertEquals(0.25, config.fusion().fallbackThreshold());
        assertEquals("/tmp/vectors.json", config.index().vectorsLocation().orElseThrow());
        assertEquals(3, config.matcher().topK().getAsInt());
    }
}

package nl.uu.medical.diagnosis.runtime;

import nl.uu.medical.diagnosis.fusion.ClassifierPrediction;
import nl.uu.medical.diagnosis.spi.DiseaseClassifier;
import nl.uu.medical.diagnosis.spi.DiseaseEnrichmentClient;
import nl.uu.medical.diagnosis.spi.DiseaseInfo;
import nl.uu.medical.diagnosis.spi.ExplanationGenerator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosisPipelineTest {

    private static final String TEXT = "I have had a fever and a bad headache since yesterday";

    private static DiagnosisEngine engine;

    @BeforeAll
    static void boot() {
        engine = DiagnosisBootstrap.create(DiagnosisConfigFactory.create());
    }

    private static final DiseaseClassifier FLU = text -> new ClassifierPrediction("Influenza", 0.55);

    /**
     * Records the ids it is asked for and answers from a fixed description.
     */
    static final class RecordingEnrichmentClient implements DiseaseEnrichmentClient {
        final List<String> requested = new ArrayList<>();

        @Override
        public Optional<DiseaseInfo> fetch(String externalId) {
            requested.add(externalId);
            return Optional.of(new DiseaseInfo("viral infection", null,
                    "https://en.wikipedia.org/wiki/Influenza"));
        }
    }

    @Test
    void collectsEnrichmentAndExplanation() {
        RecordingEnrichmentClient enrichment = new RecordingEnrichmentClient();
        ExplanationGenerator explainer = (symptoms, disease, confidence) ->
                String.format("%s fits '%s' (%.2f)", disease, symptoms, confidence);

        try (DiagnosisPipeline pipeline = new DiagnosisPipeline(engine, FLU, enrichment, explainer, 5_000)) {
            DiagnosisReport report = pipeline.diagnose(TEXT);

            assertEquals("Influenza", report.getVerdict().disease());
            assertEquals(List.of("Q2840"), enrichment.requested);
            assertEquals("viral infection", report.enrichmentValue().orElseThrow().description());
            assertTrue(report.getEnrichment().imageUrlValue().isEmpty());
            assertTrue(report.getExplanation().startsWith("Influenza fits"));
            assertEquals(0.55, report.getPrediction().score());
        }
    }

    @Test
    void slowEnrichmentTimesOutWithoutLosingTheVerdict() {
        CountDownLatch never = new CountDownLatch(1);
        DiseaseEnrichmentClient stuck = externalId -> {
            try {
                never.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.empty();
        };

        try (DiagnosisPipeline pipeline = new DiagnosisPipeline(engine, FLU, stuck, null, 100)) {
            DiagnosisReport report = pipeline.diagnose(TEXT);

            assertEquals("Influenza", report.getVerdict().disease());
            assertNull(report.getEnrichment());
            assertNull(report.getExplanation());
        }
    }

    @Test
    void timedOutExplanationIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        ExplanationGenerator hanging = (symptoms, disease, confidence) -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return "too late";
        };

        try (DiagnosisPipeline pipeline = new DiagnosisPipeline(engine, FLU, null, hanging, 100)) {
            DiagnosisReport report = pipeline.diagnose(TEXT);

            assertNull(report.getExplanation());
            assertTrue(interrupted.await(5, TimeUnit.SECONDS), "collaborator kept running after the timeout");
        }
    }

    @Test
    void failingExplanationIsLeftOut() {
        ExplanationGenerator broken = (symptoms, disease, confidence) -> {
            throw new IllegalStateException("model offline");
        };

        try (DiagnosisPipeline pipeline = new DiagnosisPipeline(engine, FLU, null, broken, 1_000)) {
            DiagnosisReport report = pipeline.diagnose(TEXT);

            assertTrue(report.explanationValue().isEmpty());
            assertEquals(0.75, report.getVerdict().finalScore(), 1e-9);
        }
    }

    @Test
    void diseaseWithoutExternalIdIsNotEnriched() {
        RecordingEnrichmentClient enrichment = new RecordingEnrichmentClient();
        DiseaseClassifier migraine = text -> new ClassifierPrediction("Migraine", 0.9);

        try (DiagnosisPipeline pipeline = new DiagnosisPipeline(engine, migraine, enrichment, null, 1_000)) {
            DiagnosisReport report = pipeline.diagnose("pounding headache");

            assertEquals("Migraine", report.getVerdict().disease());
            assertTrue(enrichment.requested.isEmpty());
        }
    }

    @Test
    void classifierFailurePropagates() {
        DiseaseClassifier broken = text -> {
            throw new IllegalStateException("classifier not loaded");
        };

        try (DiagnosisPipeline pipeline = new DiagnosisPipeline(engine, broken, null, null, 1_000)) {
            assertThrows(IllegalStateException.class, () -> pipeline.diagnose(TEXT));
        }
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new DiagnosisPipeline(engine, FLU, null, null, 0));
    }
}

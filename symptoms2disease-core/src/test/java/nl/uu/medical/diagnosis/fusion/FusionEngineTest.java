package nl.uu.medical.diagnosis.fusion;

import nl.uu.medical.diagnosis.match.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FusionEngineTest {

    private static final double EPS = 1e-9;

    private final FusionEngine engine = FusionEngine.standard(FusionPolicy.DEFAULT);

    private static MatchResult candidate(String disease, double score) {
        return new MatchResult("http://uu.nl/medical/" + disease.replace(' ', '_'), disease,
                List.of("Fever"), 1, score, 4, 2);
    }

    private static final PrimarySymptomLookup NO_PRIMARY = disease -> Set.of();

    private static PrimarySymptomLookup primary(Map<String, Set<String>> table) {
        return disease -> table.getOrDefault(disease, Set.of());
    }

    @Test
    void agreementAddsTheBonus() {
        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Flu", 0.5),
                List.of(candidate("Measles", 0.4), candidate("flu", 0.3)), List.of("fever"), NO_PRIMARY);

        assertEquals("Flu", verdict.disease());
        assertEquals(0.70, verdict.finalScore(), EPS);
        assertEquals(0.5, verdict.originalScore(), EPS);
        assertFalse(verdict.fallback());
        assertTrue(verdict.reasoning().get(0).startsWith("Agreement"));
        assertEquals(1, verdict.reasoning().size());
    }

    @Test
    void bonusIsCappedAtOne() {
        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Flu", 0.95),
                List.of(candidate("Flu", 0.3)), List.of("fever"), NO_PRIMARY);

        assertEquals(1.0, verdict.finalScore(), EPS);
        assertEquals(0.95, verdict.originalScore(), EPS);
    }

    @Test
    void disagreementCarriesNoPenalty() {
        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Flu", 0.5),
                List.of(candidate("Measles", 0.4)), List.of("fever"), NO_PRIMARY);

        assertEquals(0.5, verdict.finalScore(), EPS);
        assertTrue(verdict.reasoning().get(0).startsWith("Disagreement"));
    }

    @Test
    void missingPrimarySymptomsHalveTheScore() {
        PrimarySymptomLookup lookup = primary(Map.of("Measles", Set.of("fever", "rash")));

        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Measles", 0.9),
                List.of(), List.of("cough", "fatigue"), lookup);

        assertEquals(0.45, verdict.finalScore(), EPS);
        String message = verdict.reasoning().get(1);
        assertTrue(message.startsWith("Missing primary symptoms of Measles"), message);
        assertTrue(message.contains("fever"), message);
        assertTrue(message.contains("rash"), message);
    }

    @Test
    void primarySymptomsAreComparedCaseInsensitively() {
        PrimarySymptomLookup lookup = primary(Map.of("Measles", Set.of("Fever", "Rash")));

        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Measles", 0.9),
                List.of(), List.of("RASH", "cough"), lookup);

        assertEquals(0.9, verdict.finalScore(), EPS);
        assertTrue(verdict.reasoning().get(1).startsWith("Confirmed"));
    }

    @Test
    void diseaseWithoutPrimarySymptomsIsNotChecked() {
        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Chronic fatigue syndrome", 0.6),
                List.of(), List.of("cough"), NO_PRIMARY);

        assertEquals(0.6, verdict.finalScore(), EPS);
        assertEquals(1, verdict.reasoning().size());
    }

    @Test
    void lowConfidenceFallsBackToTheTopGraphCandidate() {
        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Flu", 0.3),
                List.of(candidate("Measles", 0.75), candidate("Common cold", 0.5)), List.of("fever", "rash"), NO_PRIMARY);

        assertEquals("Measles", verdict.disease());
        assertEquals(0.75, verdict.finalScore(), EPS);
        assertEquals(0.3, verdict.originalScore(), EPS);
        assertTrue(verdict.fallback());
        assertTrue(verdict.reasoning().get(verdict.reasoning().size() - 1).startsWith("Fallback"));
    }

    @Test
    void penaltyCanTriggerTheFallback() {
        PrimarySymptomLookup lookup = primary(Map.of("Flu", Set.of("fever", "cough")));

        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Flu", 0.6),
                List.of(candidate("Migraine", 0.25)), List.of("headache"), lookup);

        assertEquals("Migraine", verdict.disease());
        assertEquals(0.25, verdict.finalScore(), EPS);
        assertTrue(verdict.fallback());
        assertEquals(3, verdict.reasoning().size());
    }

    @Test
    void lowConfidenceWithoutCandidatesKeepsTheClassifier() {
        FusionVerdict verdict = engine.fuse(new ClassifierPrediction("Flu", 0.1), List.of(), List.of(), NO_PRIMARY);

        assertEquals("Flu", verdict.disease());
        assertEquals(0.1, verdict.finalScore(), EPS);
        assertFalse(verdict.fallback());
    }

    @Test
    void finalScoreStaysWithinBounds() {
        Random random = new Random(7);
        FusionEngine generous = FusionEngine.standard(new FusionPolicy(0.9, 1.0, 0.0));
        for (int i = 0; i < 200; i++) {
            double score = random.nextDouble();
            List<MatchResult> candidates = new ArrayList<>();
            for (int c = random.nextInt(3); c > 0; c--) {
                candidates.add(candidate(random.nextBoolean() ? "Flu" : "Measles", random.nextDouble()));
            }
            for (FusionEngine e : List.of(engine, generous)) {
                FusionVerdict verdict = e.fuse(new ClassifierPrediction("Flu", score), candidates,
                        List.of("fever"), primary(Map.of("Flu", Set.of("cough"))));
                assertTrue(verdict.finalScore() >= 0.0 && verdict.finalScore() <= 1.0, verdict.toString());
                assertEquals(score, verdict.originalScore(), 0.0);
            }
        }
    }

    @Test
    void fusionIsDeterministic() {
        List<MatchResult> candidates = List.of(candidate("Measles", 0.75), candidate("Flu", 0.5));
        PrimarySymptomLookup lookup = primary(Map.of("Flu", Set.of("fever")));

        assertEquals(engine.fuse(new ClassifierPrediction("Flu", 0.35), candidates, List.of("cough"), lookup),
                engine.fuse(new ClassifierPrediction("Flu", 0.35), candidates, List.of("cough"), lookup));
    }

    @Test
    void customStepsRunInOrder() {
        FusionStep halve = new FusionStep() {
            @Override
            public String name() {
                return "halve";
            }

            @Override
            public FusionState apply(FusionInput input, FusionState state, ReasoningTrace trace) {
                trace.record("halved");
                return state.withScore(state.score() / 2);
            }
        };
        FusionEngine custom = new FusionEngine(List.of(halve, new LowConfidenceFallbackStep(0.4)));

        FusionVerdict verdict = custom.fuse(new ClassifierPrediction("Flu", 0.7),
                List.of(candidate("Measles", 0.6)), List.of(), NO_PRIMARY);

        assertEquals("Measles", verdict.disease());
        assertEquals(List.of("halve", "low-confidence-fallback"),
                custom.steps().stream().map(FusionStep::name).toList());
        assertEquals("halved", verdict.reasoning().get(0));
    }

    @Test
    void standardChainOrder() {
        assertEquals(List.of("agreement", "primary-symptom-sanity", "low-confidence-fallback"),
                engine.steps().stream().map(FusionStep::name).toList());
    }

    @Test
    void rejectsScoresOutsideTheUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> new ClassifierPrediction("Flu", 1.2));
        assertThrows(IllegalArgumentException.class, () -> new ClassifierPrediction("Flu", -0.1));
        assertThrows(IllegalArgumentException.class, () -> new ClassifierPrediction("Flu", Double.NaN));
    }

    @Test
    void rejectsInvalidPolicies() {
        assertThrows(IllegalArgumentException.class, () -> new FusionPolicy(-0.2, 0.5, 0.4));
        assertThrows(IllegalArgumentException.class, () -> new FusionPolicy(0.2, 1.5, 0.4));
    }
}

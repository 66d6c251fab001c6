package nl.uu.medical.diagnosis.runtime;

import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.fusion.ClassifierPrediction;
import nl.uu.medical.diagnosis.fusion.FusionVerdict;
import nl.uu.medical.diagnosis.spi.DiseaseClassifier;
import nl.uu.medical.diagnosis.spi.DiseaseEnrichmentClient;
import nl.uu.medical.diagnosis.spi.DiseaseInfo;
import nl.uu.medical.diagnosis.spi.ExplanationGenerator;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Classifier, reasoning, then the optional collaborators: external enrichment of the verdict's
 * disease and a generated explanation. The collaborators run on a private executor with a
 * timeout; when they fail the report is returned without their contribution. A collaborator that
 * runs past the timeout is interrupted.
 */
public final class DiagnosisPipeline implements AutoCloseable {

    static final int COLLABORATOR_THREADS = 2;

    private final DiagnosisEngine engine;
    private final DiseaseClassifier classifier;
    private final DiseaseEnrichmentClient enrichment;
    private final ExplanationGenerator explanation;
    private final long timeoutMillis;
    private final ExecutorService executor;

    /**
     * @param enrichment  may be {@code null} to skip enrichment
     * @param explanation may be {@code null} to skip explanations
     */
    public DiagnosisPipeline(DiagnosisEngine engine,
                             DiseaseClassifier classifier,
                             DiseaseEnrichmentClient enrichment,
                             ExplanationGenerator explanation,
                             long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be > 0 but was " + timeoutMillis);
        }
        this.engine = Objects.requireNonNull(engine, "engine");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.enrichment = enrichment;
        this.explanation = explanation;
        this.timeoutMillis = timeoutMillis;
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(COLLABORATOR_THREADS, r -> {
            Thread t = new Thread(r, "diagnosis-collaborator-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public DiagnosisReport diagnose(String symptomText) {
        ClassifierPrediction prediction = classifier.predict(symptomText);
        DiagnosisReport report = engine.analyze(symptomText, prediction);
        FusionVerdict verdict = report.getVerdict();

        DiagnosisReport.DiagnosisReportBuilder out = report.toBuilder();
        if (enrichment != null && report.getExternalId() != null) {
            String externalId = report.getExternalId();
            call("enrichment of " + externalId, () -> enrichment.fetch(externalId))
                    .flatMap(info -> info)
                    .ifPresent(out::enrichment);
        }
        if (explanation != null) {
            call("explanation of " + verdict.disease(),
                    () -> explanation.explain(symptomText, verdict.disease(), verdict.finalScore()))
                    .ifPresent(out::explanation);
        }
        return out.build();
    }

    private <T> Optional<T> call(String what, Supplier<T> task) {
        Future<T> future = executor.submit(task::get);
        try {
            return Optional.ofNullable(future.get(timeoutMillis, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            Log.warnf("Timed out after %d ms waiting for %s", timeoutMillis, what);
        } catch (ExecutionException e) {
            Log.warnf(e.getCause(), "Failed %s", what);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            Log.warnf("Interrupted while waiting for %s", what);
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}

package nl.uu.medical.diagnosis.runtime;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import nl.uu.medical.diagnosis.graph.KnowledgeGraphStore;

/**
 * Builds the {@link DiagnosisEngine} once at startup and exposes it, together with its
 * {@link KnowledgeGraphStore}, for injection across the application.
 */
@ApplicationScoped
public class DiagnosisEngineProducer {

    private final DiagnosisConfig config;

    private DiagnosisEngine engine;

    @Inject
    public DiagnosisEngineProducer(DiagnosisConfig config) {
        this.config = config;
    }

    @PostConstruct
    void init() {
        this.engine = DiagnosisBootstrap.create(config);
    }

    @Produces
    public DiagnosisEngine engine() {
        return engine;
    }

    @Produces
    public KnowledgeGraphStore store() {
        return engine.store();
    }
}

package nl.uu.medical.diagnosis.runtime;

import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.canon.CanonicalizationPolicy;
import nl.uu.medical.diagnosis.canon.EmbeddingIndex;
import nl.uu.medical.diagnosis.canon.EmbeddingIndexBuilder;
import nl.uu.medical.diagnosis.canon.EmbeddingIndexStore;
import nl.uu.medical.diagnosis.canon.HashingNgramEmbedder;
import nl.uu.medical.diagnosis.canon.PhraseEmbedder;
import nl.uu.medical.diagnosis.canon.TermCanonicalizer;
import nl.uu.medical.diagnosis.fusion.FusionEngine;
import nl.uu.medical.diagnosis.fusion.FusionPolicy;
import nl.uu.medical.diagnosis.graph.KnowledgeGraphStore;
import nl.uu.medical.diagnosis.graph.TripleGraph;
import nl.uu.medical.diagnosis.graph.TripleGraphLoader;
import nl.uu.medical.diagnosis.match.DiseaseMatcher;
import nl.uu.medical.diagnosis.match.SimilarityMode;
import nl.uu.medical.diagnosis.text.SymptomPhraseExtractor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Startup wiring: loads the graph and the embedding index once and assembles a {@link DiagnosisEngine}.
 * Locations are tried on the filesystem first, then on the classpath.
 */
public final class DiagnosisBootstrap {

    private DiagnosisBootstrap() {
    }

    public static DiagnosisEngine create(DiagnosisConfig config) {
        return create(config, new HashingNgramEmbedder(config.index().dimension()));
    }

    /**
     * @param embedder embedding backend; it must be the one the persisted index was built with
     */
    public static DiagnosisEngine create(DiagnosisConfig config, PhraseEmbedder embedder) {
        DiagnosisConfig.Graph graphConfig = config.graph();
        TripleGraph graph = loadGraph(graphConfig.location());
        KnowledgeGraphStore store = new KnowledgeGraphStore(graph, graphConfig.namespace(), graphConfig.language());

        EmbeddingIndex index = loadIndex(config.index(), store, embedder);

        TermCanonicalizer canonicalizer = new TermCanonicalizer(embedder, index, new CanonicalizationPolicy(
                config.canonicalizer().acceptThreshold(), config.canonicalizer().ambiguityDelta()));
        SymptomPhraseExtractor extractor = new SymptomPhraseExtractor(
                index.entries().stream().map(e -> e.text()).toList(), config.extractor().maxMatches());
        FusionEngine fusion = FusionEngine.standard(new FusionPolicy(
                config.fusion().agreementBonus(),
                config.fusion().primarySymptomPenalty(),
                config.fusion().fallbackThreshold()));

        Log.infof("Diagnosis engine ready: %d diseases, %d vocabulary entries, %s scoring",
                store.diseases().size(), index.size(), SimilarityMode.of(config.matcher().useJaccard()));

        return new DiagnosisEngine(store, index, extractor, canonicalizer, new DiseaseMatcher(store), fusion,
                config.canonicalizer().candidates(), topKOf(config),
                SimilarityMode.of(config.matcher().useJaccard()));
    }

    static Integer topKOf(DiagnosisConfig config) {
        OptionalInt topK = config.matcher().topK();
        return topK.isPresent() ? topK.getAsInt() : null;
    }

    static TripleGraph loadGraph(String location) {
        try (InputStream stream = open(location)) {
            return new TripleGraphLoader().load(stream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load knowledge graph from " + location, e);
        }
    }

    static EmbeddingIndex loadIndex(DiagnosisConfig.Index config, KnowledgeGraphStore store, PhraseEmbedder embedder) {
        Optional<String> vectors = config.vectorsLocation();
        Optional<String> metadata = config.metadataLocation();
        if (vectors.isEmpty() && metadata.isEmpty()) {
            Log.infof("No persisted embedding index configured; building it from the graph vocabulary");
            return new EmbeddingIndexBuilder(embedder).build(store);
        }
        if (vectors.isEmpty() || metadata.isEmpty()) {
            throw new IllegalStateException(
                    "diagnosis.index.vectors-location and diagnosis.index.metadata-location must be set together");
        }
        try (InputStream v = open(vectors.get()); InputStream m = open(metadata.get())) {
            return new EmbeddingIndexStore().read(v, m);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load embedding index from " + vectors.get()
                    + " and " + metadata.get(), e);
        }
    }

    private static InputStream open(String location) throws IOException {
        Path path = Path.of(location);
        if (Files.isRegularFile(path)) {
            return Files.newInputStream(path);
        }
        InputStream stream = Thread.currentThread().getContextClassLoader().getResourceAsStream(location);
        if (stream == null) {
            throw new IllegalStateException("Unable to locate resource at " + location);
        }
        return stream;
    }
}

package nl.uu.medical.diagnosis.canon;

import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.graph.GraphVocabulary;
import nl.uu.medical.diagnosis.graph.KnowledgeGraphStore;
import nl.uu.medical.diagnosis.graph.SymptomEntity;
import nl.uu.medical.diagnosis.text.TextNormalizer;

import java.util.*;

/**
 * Embeds a symptom vocabulary once and pairs the vectors with their metadata rows.
 */
public final class EmbeddingIndexBuilder {

    private final PhraseEmbedder embedder;

    public EmbeddingIndexBuilder(PhraseEmbedder embedder) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
    }

    /**
     * Index over every symptom the graph knows (typed or referenced by a role edge), in IRI order.
     * Entries whose label normalizes to nothing are skipped.
     */
    public EmbeddingIndex build(KnowledgeGraphStore store) {
        List<SymptomEntity> symptoms = new ArrayList<>(store.allSymptomEntities());
        symptoms.sort(Comparator.comparing(SymptomEntity::iri));

        List<VocabularyEntry> entries = new ArrayList<>();
        for (SymptomEntity s : symptoms) {
            String text = TextNormalizer.normalize(store.labelOf(s));
            if (text.isEmpty()) {
                Log.warnf("Skipping symptom %s: label normalizes to an empty phrase", s.iri());
                continue;
            }
            String key = keyOf(s.iri());
            String externalId = GraphVocabulary.isWikidataEntity(s.iri())
                ? key
                : s.equivalents().stream().filter(GraphVocabulary::isWikidataEntity)
                    .map(GraphVocabulary::localName).findFirst().orElse(null);
            entries.add(new VocabularyEntry(entries.size(), key, s.iri(), externalId, text));
        }
        return embed(entries);
    }

    /**
     * Index over a plain list of canonical phrases, keyed {@code sym:<phrase_with_underscores>}.
     * Duplicate phrases after normalization are kept once.
     */
    public EmbeddingIndex buildFromTerms(Collection<String> terms) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String t : terms) {
            String n = TextNormalizer.normalize(t);
            if (!n.isEmpty()) distinct.add(n);
        }
        List<VocabularyEntry> entries = new ArrayList<>();
        for (String text : distinct) {
            entries.add(new VocabularyEntry(entries.size(), "sym:" + text.replace(' ', '_'), null, null, text));
        }
        return embed(entries);
    }

    private EmbeddingIndex embed(List<VocabularyEntry> entries) {
        List<float[]> vectors = new ArrayList<>(entries.size());
        for (VocabularyEntry e : entries) {
            vectors.add(VectorMath.unitNormalize(embedder.embed(e.text())));
        }
        Log.infof("Embedded %d vocabulary entries into %d dimensions", entries.size(), embedder.dimension());
        return new EmbeddingIndex(new FlatInnerProductIndex(embedder.dimension(), vectors), entries);
    }

    static String keyOf(String iri) {
        if (GraphVocabulary.isWikidataEntity(iri)) {
            return GraphVocabulary.localName(iri);
        }
        return "sym:" + GraphVocabulary.localName(iri);
    }
}

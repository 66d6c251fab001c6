package nl.uu.medical.diagnosis.canon;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;

import java.util.Objects;

/**
 * Uses any langchain4j {@link EmbeddingModel} (local ONNX, Vertex AI, OpenAI, ...) as the
 * phrase embedding backend.
 */
public final class LangChain4jPhraseEmbedder implements PhraseEmbedder {

    private final EmbeddingModel model;
    private final int dimension;

    public LangChain4jPhraseEmbedder(EmbeddingModel model) {
        this(model, Objects.requireNonNull(model, "model").dimension());
    }

    public LangChain4jPhraseEmbedder(EmbeddingModel model, int dimension) {
        this.model = Objects.requireNonNull(model, "model");
        if (dimension < 1) throw new IllegalArgumentException("dimension must be >= 1 but was " + dimension);
        this.dimension = dimension;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public float[] embed(String text) {
        Embedding embedding = model.embed(text).content();
        float[] vector = embedding.vector();
        if (vector.length != dimension) {
            throw new IllegalStateException("Embedding model returned " + vector.length
                + " dimensions, expected " + dimension);
        }
        return vector;
    }
}

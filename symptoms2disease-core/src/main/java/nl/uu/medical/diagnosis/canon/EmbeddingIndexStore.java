package nl.uu.medical.diagnosis.canon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.exceptions.IndexConsistencyException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists an {@link EmbeddingIndex} as two JSON documents written and read together: the
 * vectors ({@code {"dimension": D, "vectors": [[...], ...]}}) and the metadata array.
 */
public final class EmbeddingIndexStore {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredVectors(int dimension, List<float[]> vectors) {}

    static final double UNIT_TOLERANCE = 1e-3;

    private final ObjectMapper mapper;

    public EmbeddingIndexStore() {
        this(new ObjectMapper());
    }

    public EmbeddingIndexStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void write(EmbeddingIndex index, Path vectorsPath, Path metadataPath) throws IOException {
        List<float[]> vectors = new ArrayList<>(index.size());
        for (int row = 0; row < index.size(); row++) {
            vectors.add(index.vectors().vector(row));
        }
        try (OutputStream out = Files.newOutputStream(vectorsPath)) {
            mapper.writeValue(out, new StoredVectors(index.dimension(), vectors));
        }
        try (OutputStream out = Files.newOutputStream(metadataPath)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, index.entries());
        }
        Log.infof("Saved embedding index (%d entries) to %s and %s", index.size(), vectorsPath, metadataPath);
    }

    public EmbeddingIndex read(Path vectorsPath, Path metadataPath) throws IOException {
        try (InputStream vectors = Files.newInputStream(vectorsPath);
             InputStream metadata = Files.newInputStream(metadataPath)) {
            return read(vectors, metadata);
        }
    }

    /**
     * @throws IndexConsistencyException when vector count, vector lengths and metadata rows disagree
     */
    public EmbeddingIndex read(InputStream vectorsIn, InputStream metadataIn) throws IOException {
        StoredVectors stored = mapper.readValue(vectorsIn, StoredVectors.class);
        List<VocabularyEntry> entries = mapper.readValue(metadataIn, new TypeReference<List<VocabularyEntry>>() {});
        if (stored == null || stored.vectors() == null || entries == null) {
            throw new IndexConsistencyException("Embedding index documents are incomplete");
        }
        if (stored.vectors().size() != entries.size()) {
            throw new IndexConsistencyException(stored.vectors().size(), entries.size());
        }
        // rows are searched by inner product, so they must have unit length
        List<float[]> vectors = new ArrayList<>(stored.vectors().size());
        int rescaled = 0;
        for (float[] v : stored.vectors()) {
            if (v == null) {
                vectors.add(null);
                continue;
            }
            if (Math.abs(VectorMath.norm(v) - 1.0) > UNIT_TOLERANCE) {
                rescaled++;
            }
            vectors.add(VectorMath.unitNormalize(v));
        }
        if (rescaled > 0) {
            Log.warnf("Rescaled %d stored vectors that were not of unit length", rescaled);
        }
        EmbeddingIndex index = new EmbeddingIndex(new FlatInnerProductIndex(stored.dimension(), vectors), entries);
        Log.infof("Loaded embedding index with %d entries of dimension %d", index.size(), index.dimension());
        return index;
    }
}

package nl.uu.medical.diagnosis.canon;

import nl.uu.medical.diagnosis.exceptions.IndexConsistencyException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Vector index paired with its vocabulary metadata. Row {@code i} of the index is described by
 * metadata entry {@code i}; both sides must have the same cardinality.
 */
public final class EmbeddingIndex {

    private final VectorIndex vectors;
    private final List<VocabularyEntry> entries;

    public EmbeddingIndex(VectorIndex vectors, List<VocabularyEntry> entries) {
        this.vectors = Objects.requireNonNull(vectors, "vectors");
        this.entries = List.copyOf(entries);
        if (vectors.size() != this.entries.size()) {
            throw new IndexConsistencyException(vectors.size(), this.entries.size());
        }
        for (int i = 0; i < this.entries.size(); i++) {
            if (this.entries.get(i).row() != i) {
                throw new IndexConsistencyException("Metadata entry at position " + i
                    + " claims row " + this.entries.get(i).row());
            }
        }
    }

    public int size() {
        return entries.size();
    }

    public int dimension() {
        return vectors.dimension();
    }

    public List<VocabularyEntry> entries() {
        return entries;
    }

    public VocabularyEntry entry(int row) {
        return entries.get(row);
    }

    VectorIndex vectors() {
        return vectors;
    }

    /**
     * The {@code k} nearest entries to an already unit-normalized query.
     */
    public List<ScoredCandidate> search(float[] unitQuery, int k) {
        List<ScoredCandidate> out = new ArrayList<>(k);
        for (VectorIndex.IndexHit hit : vectors.search(unitQuery, k)) {
            out.add(new ScoredCandidate(entries.get(hit.row()), hit.score()));
        }
        return out;
    }
}

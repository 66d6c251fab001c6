package nl.uu.medical.diagnosis.canon;

import nl.uu.medical.diagnosis.exceptions.IndexConsistencyException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Exact inner-product search by scanning every stored vector. With unit-length vectors the
 * score is the cosine similarity.
 */
public final class FlatInnerProductIndex implements VectorIndex {

    private static final Comparator<IndexHit> ORDER = Comparator
        .comparingDouble(IndexHit::score).reversed()
        .thenComparingInt(IndexHit::row);

    private final int dimension;
    private final float[][] vectors;

    public FlatInnerProductIndex(int dimension, List<float[]> vectors) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1 but was " + dimension);
        }
        this.dimension = dimension;
        this.vectors = new float[vectors.size()][];
        for (int row = 0; row < vectors.size(); row++) {
            float[] v = vectors.get(row);
            if (v == null || v.length != dimension) {
                throw new IndexConsistencyException(String.format(
                    "Vector at row %d has dimension %d, index dimension is %d",
                    row, v == null ? 0 : v.length, dimension));
            }
            this.vectors[row] = Arrays.copyOf(v, dimension);
        }
    }

    @Override
    public int size() {
        return vectors.length;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<IndexHit> search(float[] query, int k) {
        if (query.length != dimension) {
            throw new IllegalArgumentException("Query dimension " + query.length + " != index dimension " + dimension);
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1 but was " + k);
        }
        List<IndexHit> hits = new ArrayList<>(vectors.length);
        for (int row = 0; row < vectors.length; row++) {
            hits.add(new IndexHit(row, VectorMath.dot(query, vectors[row])));
        }
        hits.sort(ORDER);
        return List.copyOf(hits.subList(0, Math.min(k, hits.size())));
    }

    @Override
    public float[] vector(int row) {
        return Arrays.copyOf(vectors[row], dimension);
    }
}

package nl.uu.medical.diagnosis.canon;

import java.util.List;

/**
 * Nearest-neighbour search over a fixed set of vectors addressed by row number.
 */
public interface VectorIndex {

    int size();

    int dimension();

    /**
     * The at most {@code k} rows with the highest inner product against {@code query},
     * highest first, equal scores in ascending row order.
     */
    List<IndexHit> search(float[] query, int k);

    /**
     * Copy of the stored vector at {@code row}.
     */
    float[] vector(int row);

    record IndexHit(int row, double score) {}
}

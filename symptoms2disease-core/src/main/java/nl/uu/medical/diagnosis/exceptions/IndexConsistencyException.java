package nl.uu.medical.diagnosis.exceptions;

/**
 * Thrown when the embedding model, the vector index and the vocabulary metadata do not
 * describe the same vocabulary (different cardinalities or dimensionalities).
 */
public class IndexConsistencyException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long indexSize;
    private final long metadataSize;

    public IndexConsistencyException(String message) {
        super(message);
        this.indexSize = -1;
        this.metadataSize = -1;
    }

    public IndexConsistencyException(long indexSize, long metadataSize) {
        super(String.format(
            "Index size (ntotal=%d) != metadata length (%d). Make sure metadata and index were built together.",
            indexSize, metadataSize));
        this.indexSize = indexSize;
        this.metadataSize = metadataSize;
    }

    /**
     * Number of vectors in the index, or -1 when the failure was not a size mismatch.
     */
    public long getIndexSize() {
        return indexSize;
    }

    /**
     * Number of metadata rows, or -1 when the failure was not a size mismatch.
     */
    public long getMetadataSize() {
        return metadataSize;
    }
}

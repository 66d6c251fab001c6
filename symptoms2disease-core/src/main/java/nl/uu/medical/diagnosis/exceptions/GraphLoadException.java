package nl.uu.medical.diagnosis.exceptions;

/**
 * Thrown when a persisted knowledge graph cannot be turned into a usable store.
 * <p>
 * This covers documents that fail to parse, triples with a malformed shape, graphs without
 * any disease instance and diseases linking one symptom under more than one role. All of
 * these are startup failures; no request may be served from a partially loaded graph.
 * </p>
 */
public class GraphLoadException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public GraphLoadException(String message) {
        super(message);
    }

    public GraphLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package nl.uu.medical.diagnosis.spi;

import java.util.Optional;

/**
 * Looks up a disease in an external knowledge base by its identifier there (a Wikidata Q-id).
 * Implementations may block on network I/O; callers bound them with a timeout.
 */
public interface DiseaseEnrichmentClient {

    Optional<DiseaseInfo> fetch(String externalId);
}

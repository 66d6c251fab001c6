package nl.uu.medical.diagnosis.canon;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Metadata row of the embedding index.
 *
 * @param row        position of the entry's vector in the index
 * @param key        stable key: the Wikidata Q-id, or {@code sym:<local name>} for local symptoms
 * @param iri        graph IRI of the symptom, when built from a graph
 * @param externalId Wikidata Q-id, when known
 * @param text       normalized canonical phrase that was embedded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VocabularyEntry(int row,
                              String key,
                              @JsonAlias("uri") String iri,
                              @JsonAlias("wd_qid") String externalId,
                              String text) {}

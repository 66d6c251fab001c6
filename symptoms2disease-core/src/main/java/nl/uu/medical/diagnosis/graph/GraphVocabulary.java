package nl.uu.medical.diagnosis.graph;

import java.util.Map;

/**
 * IRIs of the RDF vocabularies the medical graph is written in.
 */
public final class GraphVocabulary {
    private GraphVocabulary() {}

    public static final String RDF = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String RDFS = "http://www.w3.org/2000/01/rdf-schema#";
    public static final String SKOS = "http://www.w3.org/2004/02/skos/core#";
    public static final String OWL = "http://www.w3.org/2002/07/owl#";
    public static final String WIKIDATA_ENTITY = "http://www.wikidata.org/entity/";

    public static final String DEFAULT_NAMESPACE = "http://uu.nl/medical/";

    public static final String RDF_TYPE = RDF + "type";
    public static final String RDFS_LABEL = RDFS + "label";
    public static final String RDFS_SUB_CLASS_OF = RDFS + "subClassOf";
    public static final String SKOS_PREF_LABEL = SKOS + "prefLabel";
    public static final String OWL_SAME_AS = OWL + "sameAs";
    public static final String OWL_EQUIVALENT_CLASS = OWL + "equivalentClass";

    public static final String DISEASE_CLASS = "Disease";
    public static final String SYMPTOM_CLASS = "Symptom";

    /**
     * Prefixes every graph document may use without declaring them.
     */
    public static Map<String, String> builtInPrefixes() {
        return Map.of(
            "rdf", RDF,
            "rdfs", RDFS,
            "skos", SKOS,
            "owl", OWL,
            "wd", WIKIDATA_ENTITY
        );
    }

    /**
     * The fragment after the last '/' or '#' of an IRI.
     */
    public static String localName(String iri) {
        if (iri == null) return "";
        int cut = Math.max(iri.lastIndexOf('/'), iri.lastIndexOf('#'));
        return cut >= 0 ? iri.substring(cut + 1) : iri;
    }

    public static boolean isWikidataEntity(String iri) {
        return iri != null && iri.contains("wikidata.org/entity/");
    }
}

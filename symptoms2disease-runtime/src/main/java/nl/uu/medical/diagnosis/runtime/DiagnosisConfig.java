package nl.uu.medical.diagnosis.runtime;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Maps {@code diagnosis.*} properties onto the settings of the diagnosis engine.
 */
@StaticInitSafe
@ConfigMapping(prefix = "diagnosis")
public interface DiagnosisConfig {

    /**
     * Knowledge graph source
     * @return the graph settings
     */
    Graph graph();

    /**
     * Embedding index source
     * @return the index settings
     */
    Index index();

    /**
     * Accept / ambiguous thresholds
     * @return the canonicalizer settings
     */
    Canonicalizer canonicalizer();

    /**
     * Disease ranking
     * @return the matcher settings
     */
    Matcher matcher();

    /**
     * Rule chain constants
     * @return the fusion settings
     */
    Fusion fusion();

    Extractor extractor();

    Enrichment enrichment();

    interface Graph {
        /**
         * Filesystem path or classpath resource of the YAML/JSON triple document
         * @return the graph location
         */
        @WithDefault("ontology/medical-graph.yaml")
        String location();

        /**
         * Namespace of the Disease and Symptom classes and of the role predicates
         * @return the namespace IRI
         */
        @WithDefault("http://uu.nl/medical/")
        String namespace();

        /**
         * Preferred label language
         * @return the language tag
         */
        @WithDefault("en")
        String language();
    }

    interface Index {
        /**
         * Persisted vectors; when absent the index is built from the graph at startup
         * @return the vectors location
         */
        Optional<String> vectorsLocation();

        /**
         * Persisted metadata rows, read together with the vectors
         * @return the metadata location
         */
        Optional<String> metadataLocation();

        /**
         * Dimension of the built-in hashing embedder
         * @return the embedding dimension
         */
        @WithDefault("300")
        int dimension();
    }

    interface Canonicalizer {
        @WithDefault("0.62")
        double acceptThreshold();

        @WithDefault("0.08")
        double ambiguityDelta();

        /**
         * Candidates retrieved per phrase, at least 2
         * @return the candidate count
         */
        @WithDefault("2")
        int candidates();
    }

    interface Matcher {
        /**
         * Jaccard scoring when true, coverage of the query when false
         * @return the scoring switch
         */
        @WithDefault("true")
        boolean useJaccard();

        /**
         * Maximum number of ranked diseases; absent keeps every disease that shares a symptom
         * @return the result limit
         */
        OptionalInt topK();
    }

    interface Fusion {
        @WithDefault("0.20")
        double agreementBonus();

        @WithDefault("0.5")
        double primarySymptomPenalty();

        @WithDefault("0.40")
        double fallbackThreshold();
    }

    interface Extractor {
        @WithDefault("20")
        int maxMatches();
    }

    interface Enrichment {
        /**
         * Upper bound for enrichment and explanation calls
         * @return the timeout in milliseconds
         */
        @WithDefault("10000")
        long timeoutMillis();
    }
}

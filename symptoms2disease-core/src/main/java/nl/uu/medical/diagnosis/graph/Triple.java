package nl.uu.medical.diagnosis.graph;

import java.util.Objects;

/**
 * One statement of the persisted graph. Subjects and predicates are full IRIs; the object is
 * either an IRI or, when {@code literal} is set, a lexical value with an optional language tag
 * (empty when untagged).
 */
public record Triple(String subject, String predicate, String object, boolean literal, String language) {

    public Triple {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(object, "object");
        language = language == null ? "" : language;
    }

    public static Triple resource(String subject, String predicate, String object) {
        return new Triple(subject, predicate, object, false, "");
    }

    public static Triple literal(String subject, String predicate, String value, String language) {
        return new Triple(subject, predicate, value, true, language);
    }
}

package nl.uu.medical.diagnosis.graph;

import java.util.*;

/**
 * Immutable, indexed set of triples. Insertion order is preserved by every lookup so that
 * everything derived from the graph is deterministic.
 */
public final class TripleGraph {

    private final List<Triple> triples;
    private final Map<String, Map<String, List<Triple>>> bySubject;          // s -> p -> triples
    private final Map<String, Map<String, Set<String>>> subjectsByObject;    // p -> o -> subjects

    public TripleGraph(Collection<Triple> triples) {
        List<Triple> distinct = new ArrayList<>(new LinkedHashSet<>(Objects.requireNonNull(triples, "triples")));
        Map<String, Map<String, List<Triple>>> s2p = new LinkedHashMap<>();
        Map<String, Map<String, Set<String>>> p2o = new LinkedHashMap<>();
        for (Triple t : distinct) {
            s2p.computeIfAbsent(t.subject(), k -> new LinkedHashMap<>())
               .computeIfAbsent(t.predicate(), k -> new ArrayList<>())
               .add(t);
            if (!t.literal()) {
                p2o.computeIfAbsent(t.predicate(), k -> new LinkedHashMap<>())
                   .computeIfAbsent(t.object(), k -> new LinkedHashSet<>())
                   .add(t.subject());
            }
        }
        this.triples = List.copyOf(distinct);
        this.bySubject = s2p;
        this.subjectsByObject = p2o;
    }

    public int size() {
        return triples.size();
    }

    public List<Triple> triples() {
        return triples;
    }

    /**
     * Subjects {@code s} for which {@code (s, predicate, object)} holds with an IRI object.
     */
    public Set<String> subjects(String predicate, String object) {
        Set<String> found = subjectsByObject.getOrDefault(predicate, Map.of()).get(object);
        return found == null ? Set.of() : Collections.unmodifiableSet(found);
    }

    /**
     * IRI objects of {@code (subject, predicate, ?)}.
     */
    public List<String> objects(String subject, String predicate) {
        List<String> out = new ArrayList<>();
        for (Triple t : statements(subject, predicate)) {
            if (!t.literal()) out.add(t.object());
        }
        return out;
    }

    /**
     * Literal statements of {@code (subject, predicate, ?)}.
     */
    public List<Triple> literals(String subject, String predicate) {
        List<Triple> out = new ArrayList<>();
        for (Triple t : statements(subject, predicate)) {
            if (t.literal()) out.add(t);
        }
        return out;
    }

    private List<Triple> statements(String subject, String predicate) {
        return bySubject.getOrDefault(subject, Map.of()).getOrDefault(predicate, List.of());
    }
}

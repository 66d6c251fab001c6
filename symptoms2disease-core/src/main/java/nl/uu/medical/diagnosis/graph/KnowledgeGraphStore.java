package nl.uu.medical.diagnosis.graph;

import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.exceptions.GraphLoadException;
import nl.uu.medical.diagnosis.text.TextNormalizer;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only index over a loaded medical graph.
 * <p>
 * Diseases are the instances of {@code <namespace>Disease}; symptoms are the instances of
 * {@code <namespace>Symptom} or of any class below it in the {@code rdfs:subClassOf} hierarchy.
 * Role edges ({@code hasPrimarySymptom}, {@code hasSecondarySymptom}, {@code hasComplication})
 * are resolved once at construction, together with the per-disease symptom union.
 * </p>
 * <p>
 * The only state filled after construction is the label memo, held in a concurrent map owned by
 * this instance, so a store can be shared by any number of request threads.
 * </p>
 */
public final class KnowledgeGraphStore {

    private final TripleGraph graph;
    private final String namespace;
    private final String language;

    private final Map<String, String> labelCache = new ConcurrentHashMap<>();
    private final Map<String, SymptomEntity> symptoms;            // typed symptoms, graph order
    private final Map<String, SymptomEntity> referencedSymptoms;  // typed + role targets
    private final Map<String, DiseaseEntity> diseases;
    private final Map<DiseaseEntity, Set<SymptomEntity>> diseaseSymptomSets;

    public KnowledgeGraphStore(TripleGraph graph) {
        this(graph, GraphVocabulary.DEFAULT_NAMESPACE, "en");
    }

    public KnowledgeGraphStore(TripleGraph graph, String namespace, String language) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.language = language == null ? "" : language;

        Set<String> diseaseIris = graph.subjects(GraphVocabulary.RDF_TYPE, namespace + GraphVocabulary.DISEASE_CLASS);
        if (diseaseIris.isEmpty()) {
            throw new GraphLoadException("No " + namespace + GraphVocabulary.DISEASE_CLASS
                + " instances found. Check ontology or namespace.");
        }

        Map<String, SymptomEntity> typed = new LinkedHashMap<>();
        for (String type : symptomTypes()) {
            for (String iri : graph.subjects(GraphVocabulary.RDF_TYPE, type)) {
                typed.computeIfAbsent(iri, this::newSymptom);
            }
        }
        Map<String, SymptomEntity> referenced = new LinkedHashMap<>(typed);

        Map<String, DiseaseEntity> diseaseMap = new LinkedHashMap<>();
        Map<DiseaseEntity, Set<SymptomEntity>> sets = new LinkedHashMap<>();
        for (String iri : diseaseIris) {
            Map<SymptomRole, List<SymptomEntity>> roles = new EnumMap<>(SymptomRole.class);
            Map<String, SymptomRole> seen = new HashMap<>();
            for (SymptomRole role : SymptomRole.values()) {
                List<SymptomEntity> edges = new ArrayList<>();
                for (String target : graph.objects(iri, role.predicate(namespace))) {
                    SymptomRole previous = seen.putIfAbsent(target, role);
                    if (previous != null && previous != role) {
                        throw new GraphLoadException(String.format(
                            "Symptom '%s' is linked to disease '%s' as both %s and %s; a symptom may hold only one role per disease",
                            target, iri, previous, role));
                    }
                    edges.add(referenced.computeIfAbsent(target, this::newSymptom));
                }
                roles.put(role, edges);
            }
            DiseaseEntity disease = new DiseaseEntity(iri, labelsOf(iri), equivalentsOf(iri), roles);
            diseaseMap.put(iri, disease);
            sets.put(disease, disease.allSymptoms());
        }

        this.symptoms = Collections.unmodifiableMap(typed);
        this.referencedSymptoms = Collections.unmodifiableMap(referenced);
        this.diseases = Collections.unmodifiableMap(diseaseMap);
        this.diseaseSymptomSets = Collections.unmodifiableMap(sets);

        Log.infof("Knowledge graph store ready: %d diseases, %d symptoms (%d referenced), namespace %s",
            diseases.size(), symptoms.size(), referencedSymptoms.size(), namespace);
    }

    public String namespace() {
        return namespace;
    }

    public String language() {
        return language;
    }

    // ------------------------------------------------------------------
    // Labels
    // ------------------------------------------------------------------

    /**
     * Display label of any graph entity: {@code skos:prefLabel} then {@code rdfs:label} in the
     * configured language, then an untagged label, then any label, then the IRI fragment.
     * The chain is evaluated once per entity.
     */
    public String labelOf(String iri) {
        return labelCache.computeIfAbsent(iri, this::resolveLabel);
    }

    public String labelOf(SymptomEntity symptom) {
        return labelOf(symptom.iri());
    }

    public String labelOf(DiseaseEntity disease) {
        return labelOf(disease.iri());
    }

    private String resolveLabel(String iri) {
        Map<String, String> labels = labelsOf(iri);
        String preferred = labels.get(language);
        if (preferred != null) return preferred;
        String untagged = labels.get("");
        if (untagged != null) return untagged;
        if (!labels.isEmpty()) return labels.values().iterator().next();
        return GraphVocabulary.localName(iri);
    }

    private Map<String, String> labelsOf(String iri) {
        Map<String, String> labels = new LinkedHashMap<>();
        for (String p : List.of(GraphVocabulary.SKOS_PREF_LABEL, GraphVocabulary.RDFS_LABEL)) {
            for (Triple t : graph.literals(iri, p)) {
                labels.putIfAbsent(t.language(), t.object());
            }
        }
        return labels;
    }

    private Set<String> equivalentsOf(String iri) {
        Set<String> eq = new LinkedHashSet<>(graph.objects(iri, GraphVocabulary.OWL_EQUIVALENT_CLASS));
        eq.addAll(graph.objects(iri, GraphVocabulary.OWL_SAME_AS));
        return eq;
    }

    private SymptomEntity newSymptom(String iri) {
        return new SymptomEntity(iri, labelsOf(iri), equivalentsOf(iri));
    }

    private Set<String> symptomTypes() {
        String root = namespace + GraphVocabulary.SYMPTOM_CLASS;
        Set<String> types = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        types.add(root);
        queue.add(root);
        while (!queue.isEmpty()) {
            String current = queue.removeFirst();
            for (String sub : graph.subjects(GraphVocabulary.RDFS_SUB_CLASS_OF, current)) {
                if (types.add(sub)) queue.addLast(sub);
            }
        }
        return types;
    }

    // ------------------------------------------------------------------
    // Symptom lookup
    // ------------------------------------------------------------------

    /**
     * Resolves free symptom labels to symptom entities. An indexed symptom matches when its
     * normalized label equals an input, contains it, or is contained in it. This favours recall:
     * "cough" also selects "dry cough", and callers have to tolerate such extra matches.
     * Blank inputs are ignored.
     */
    public Set<SymptomEntity> findSymptomEntities(Collection<String> labels) {
        Set<String> inputs = new LinkedHashSet<>();
        for (String l : labels) {
            String n = TextNormalizer.normalizeLabel(l);
            if (!n.isBlank()) inputs.add(n);
        }
        if (inputs.isEmpty()) return Set.of();

        Set<SymptomEntity> matches = new LinkedHashSet<>();
        for (SymptomEntity symptom : symptoms.values()) {
            String label = TextNormalizer.normalizeLabel(labelOf(symptom));
            if (label.isEmpty()) continue;
            for (String s : inputs) {
                if (s.equals(label) || label.contains(s) || s.contains(label)) {
                    matches.add(symptom);
                    break;
                }
            }
        }
        return Collections.unmodifiableSet(matches);
    }

    // ------------------------------------------------------------------
    // Disease → symptoms
    // ------------------------------------------------------------------

    /**
     * Every disease mapped to the union of its role edges. Computed once at construction.
     */
    public Map<DiseaseEntity, Set<SymptomEntity>> allDiseaseSymptomSets() {
        return diseaseSymptomSets;
    }

    public Collection<DiseaseEntity> diseases() {
        return diseases.values();
    }

    /**
     * Instances of the symptom class hierarchy.
     */
    public Collection<SymptomEntity> symptoms() {
        return symptoms.values();
    }

    /**
     * Typed symptoms plus every role-edge target, typed or not.
     */
    public Collection<SymptomEntity> allSymptomEntities() {
        return referencedSymptoms.values();
    }

    public Optional<DiseaseEntity> findDisease(String diseaseLabel) {
        String target = TextNormalizer.normalizeLabel(diseaseLabel);
        for (DiseaseEntity d : diseases.values()) {
            if (TextNormalizer.normalizeLabel(labelOf(d)).equals(target)) return Optional.of(d);
        }
        return Optional.empty();
    }

    /**
     * Primary symptom labels of the disease whose label equals {@code diseaseLabel} after
     * normalization; empty when there is no such disease or it has no primary symptoms.
     */
    public SortedSet<String> primarySymptomsOf(String diseaseLabel) {
        return findDisease(diseaseLabel)
            .map(d -> labelsOf(d.symptoms(SymptomRole.PRIMARY)))
            .orElse(Collections.emptySortedSet());
    }

    /**
     * All symptom labels, any role, of the first disease whose label contains {@code diseaseName}.
     */
    public SortedSet<String> diseaseSymptomsOf(String diseaseName) {
        String target = TextNormalizer.normalizeLabel(diseaseName);
        if (target.isBlank()) return Collections.emptySortedSet();
        for (DiseaseEntity d : diseases.values()) {
            if (TextNormalizer.normalizeLabel(labelOf(d)).contains(target)) {
                return labelsOf(d.allSymptoms());
            }
        }
        return Collections.emptySortedSet();
    }

    /**
     * Wikidata Q-id linked through {@code owl:equivalentClass} or {@code owl:sameAs}.
     */
    public Optional<String> externalIdOf(String diseaseLabel) {
        return findDisease(diseaseLabel).flatMap(d -> d.equivalents().stream()
            .filter(GraphVocabulary::isWikidataEntity)
            .map(GraphVocabulary::localName)
            .findFirst());
    }

    public SortedSet<String> allSymptomLabels() {
        return labelsOf(symptoms.values());
    }

    private SortedSet<String> labelsOf(Collection<SymptomEntity> entities) {
        SortedSet<String> out = new TreeSet<>();
        for (SymptomEntity s : entities) out.add(labelOf(s));
        return Collections.unmodifiableSortedSet(out);
    }
}

package nl.uu.medical.diagnosis.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.quarkus.logging.Log;
import nl.uu.medical.diagnosis.exceptions.GraphLoadException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a {@link TripleGraph} from a YAML (or JSON) triple document on the filesystem or the classpath.
 * <p>
 * Terms are written either as compact IRIs ({@code ex:Influenza}) against the declared or built-in
 * prefixes, or as absolute IRIs. Each triple carries a resource object ({@code o}) or a literal
 * ({@code value} with optional {@code lang}), never both.
 * </p>
 */
public final class TripleGraphLoader {

    // DTOs mirroring the document
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YGraph(Map<String, String> prefixes, List<YTriple> triples) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record YTriple(String s, String p, String o, String value, String lang) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public TripleGraph loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in, resourcePath);
        }
    }

    public TripleGraph loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    public TripleGraph load(InputStream in) throws IOException {
        return load(in, "stream");
    }

    private TripleGraph load(InputStream in, String source) throws IOException {
        YGraph y;
        try {
            y = mapper.readValue(in, YGraph.class);
        } catch (JsonProcessingException e) {
            throw new GraphLoadException("Unable to parse knowledge graph from " + source, e);
        }
        if (y == null) {
            throw new GraphLoadException("Knowledge graph document " + source + " is empty");
        }
        TripleGraph graph = toGraph(y);
        Log.infof("Loaded %d triples from %s", graph.size(), source);
        return graph;
    }

    private TripleGraph toGraph(YGraph y) {
        Map<String, String> prefixes = new HashMap<>(GraphVocabulary.builtInPrefixes());
        Optional.ofNullable(y.prefixes()).ifPresent(prefixes::putAll);

        List<Triple> triples = new ArrayList<>();
        List<YTriple> raw = Optional.ofNullable(y.triples()).orElse(List.of());
        for (int i = 0; i < raw.size(); i++) {
            YTriple t = raw.get(i);
            if (t == null) {
                throw new GraphLoadException("Triple #" + i + " is empty");
            }
            require(t.s() != null && !t.s().isBlank(), "Triple #" + i + " has no subject");
            require(t.p() != null && !t.p().isBlank(), "Triple #" + i + " has no predicate");
            boolean hasObject = t.o() != null && !t.o().isBlank();
            boolean hasValue = t.value() != null;
            require(hasObject ^ hasValue, "Triple #" + i + " must have exactly one of 'o' or 'value'");

            String s = expand(t.s(), prefixes, i);
            String p = expand(t.p(), prefixes, i);
            if (hasObject) {
                triples.add(Triple.resource(s, p, expand(t.o(), prefixes, i)));
            } else {
                triples.add(Triple.literal(s, p, t.value(), t.lang()));
            }
        }
        return new TripleGraph(triples);
    }

    static String expand(String term, Map<String, String> prefixes, int index) {
        String v = term.strip();
        if (v.startsWith("<") && v.endsWith(">")) {
            return v.substring(1, v.length() - 1);
        }
        if (v.contains("://")) {
            return v;
        }
        int colon = v.indexOf(':');
        if (colon < 0) {
            throw new GraphLoadException("Triple #" + index + ": term '" + term + "' is neither an IRI nor a prefixed name");
        }
        String namespace = prefixes.get(v.substring(0, colon));
        if (namespace == null) {
            throw new GraphLoadException("Triple #" + index + ": unknown prefix '" + v.substring(0, colon) + "' in '" + term + "'");
        }
        return namespace + v.substring(colon + 1);
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new GraphLoadException(message);
    }
}

package com.e2eq.conformance.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One subject of a policy graph with its outgoing properties in insertion order.
 * rdf:type values are kept as ordinary property values and also exposed through {@link #types()}.
 */
public final class PolicyEntity {
    private final GraphNode id;
    private final Map<String, List<GraphNode>> properties;

    PolicyEntity(GraphNode id, Map<String, List<GraphNode>> properties) {
        this.id = id;
        Map<String, List<GraphNode>> copy = new LinkedHashMap<>();
        properties.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        this.properties = Collections.unmodifiableMap(copy);
    }

    public GraphNode id() {
        return id;
    }

    public Map<String, List<GraphNode>> properties() {
        return properties;
    }

    /** Values of the given predicate, empty when absent. */
    public List<GraphNode> values(String predicate) {
        return properties.getOrDefault(predicate, List.of());
    }

    public Set<String> types() {
        Set<String> types = new LinkedHashSet<>();
        for (GraphNode n : values(OdrlVocabulary.RDF_TYPE)) {
            if (n.isIri()) types.add(n.value());
        }
        return types;
    }

    public boolean hasType(String typeIri) {
        return types().contains(typeIri);
    }

    @Override
    public String toString() {
        return id.display() + " " + properties.keySet();
    }
}

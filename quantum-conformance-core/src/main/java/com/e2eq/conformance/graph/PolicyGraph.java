package com.e2eq.conformance.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Parsed entity graph of a rights-expression document. Immutable once built; entity and
 * value order follow statement insertion order so evaluation over the same graph is repeatable.
 */
public final class PolicyGraph {
    private final Map<String, PolicyEntity> entities;

    private PolicyGraph(Map<String, PolicyEntity> entities) {
        this.entities = Collections.unmodifiableMap(entities);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PolicyGraph empty() {
        return new PolicyGraph(new LinkedHashMap<>());
    }

    public Collection<PolicyEntity> entities() {
        return entities.values();
    }

    public Optional<PolicyEntity> entity(String id) {
        return Optional.ofNullable(entities.get(id));
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /** Entities whose rdf:type includes the given class IRI. */
    public List<PolicyEntity> entitiesOfType(String typeIri) {
        List<PolicyEntity> out = new ArrayList<>();
        for (PolicyEntity e : entities.values()) {
            if (e.hasType(typeIri)) out.add(e);
        }
        return out;
    }

    /**
     * Resource values of the given predicate across the graph, in encounter order. A value that
     * never appears as a subject is returned as an entity with no properties.
     */
    public List<PolicyEntity> objectsOf(String predicate) {
        Set<String> seen = new LinkedHashSet<>();
        List<PolicyEntity> out = new ArrayList<>();
        for (PolicyEntity e : entities.values()) {
            for (GraphNode v : e.values(predicate)) {
                if (!v.isResource() || !seen.add(v.value())) continue;
                PolicyEntity target = entities.get(v.value());
                out.add(target != null ? target : new PolicyEntity(v, Map.of()));
            }
        }
        return out;
    }

    public static final class Builder {
        private final Map<String, GraphNode> subjects = new LinkedHashMap<>();
        private final Map<String, Map<String, List<GraphNode>>> props = new LinkedHashMap<>();
        private final Map<String, String> prefixes = new LinkedHashMap<>(OdrlVocabulary.defaultPrefixes());
        private int blankCounter;

        private Builder() {}

        public Builder prefix(String prefix, String namespace) {
            prefixes.put(prefix, namespace);
            return this;
        }

        /** Adds a statement; the subject is a blank node when it starts with {@code _:}. */
        public Builder add(String subject, String predicate, GraphNode object) {
            return add(subjectNode(subject), expand(predicate), object);
        }

        public Builder add(GraphNode subject, String predicate, GraphNode object) {
            if (!subject.isResource()) {
                throw new IllegalArgumentException("Literal cannot be a subject: " + subject);
            }
            subjects.putIfAbsent(subject.value(), subject);
            props.computeIfAbsent(subject.value(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(predicate, k -> new ArrayList<>())
                    .add(object);
            return this;
        }

        public Builder type(String subject, String typeCurie) {
            return add(subject, OdrlVocabulary.RDF_TYPE, GraphNode.iri(expand(typeCurie)));
        }

        public Builder iri(String subject, String predicate, String objectCurie) {
            return add(subject, predicate, GraphNode.iri(expand(objectCurie)));
        }

        public Builder literal(String subject, String predicate, String lexical) {
            return add(subject, predicate, GraphNode.literal(lexical));
        }

        public Builder typedLiteral(String subject, String predicate, String lexical, String datatypeCurie) {
            return add(subject, predicate, GraphNode.typedLiteral(lexical, expand(datatypeCurie)));
        }

        /**
         * Links a fresh blank node from {@code subject} through {@code predicate} and lets the
         * caller describe it. Returns the blank node label.
         */
        public String blank(String subject, String predicate, Consumer<Node> body) {
            String label = "_:n" + (++blankCounter);
            add(subject, predicate, GraphNode.blank(label));
            subjects.putIfAbsent(label, GraphNode.blank(label));
            props.computeIfAbsent(label, k -> new LinkedHashMap<>());
            body.accept(new Node(label));
            return label;
        }

        /** Registers a subject with no statements yet. */
        public Builder subject(String subject) {
            GraphNode node = subjectNode(subject);
            subjects.putIfAbsent(node.value(), node);
            props.computeIfAbsent(node.value(), k -> new LinkedHashMap<>());
            return this;
        }

        public PolicyGraph build() {
            Map<String, PolicyEntity> out = new LinkedHashMap<>();
            subjects.forEach((id, node) -> out.put(id, new PolicyEntity(node, props.getOrDefault(id, Map.of()))));
            return new PolicyGraph(out);
        }

        String expand(String curie) {
            return OdrlVocabulary.expand(curie, prefixes);
        }

        private GraphNode subjectNode(String subject) {
            return subject.startsWith("_:") ? GraphNode.blank(subject) : GraphNode.iri(expand(subject));
        }

        /** Scoped view used inside {@link #blank(String, String, Consumer)}. */
        public final class Node {
            private final String label;

            private Node(String label) {
                this.label = label;
            }

            public Node type(String typeCurie) {
                Builder.this.type(label, typeCurie);
                return this;
            }

            public Node iri(String predicate, String objectCurie) {
                Builder.this.iri(label, predicate, objectCurie);
                return this;
            }

            public Node literal(String predicate, String lexical) {
                Builder.this.literal(label, predicate, lexical);
                return this;
            }

            public Node typedLiteral(String predicate, String lexical, String datatypeCurie) {
                Builder.this.typedLiteral(label, predicate, lexical, datatypeCurie);
                return this;
            }

            public Node blank(String predicate, Consumer<Node> body) {
                Builder.this.blank(label, predicate, body);
                return this;
            }
        }
    }
}

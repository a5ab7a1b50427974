package com.e2eq.conformance.turtle;

import com.e2eq.conformance.exceptions.DocumentParseException;
import com.e2eq.conformance.graph.GraphNode;
import com.e2eq.conformance.graph.OdrlVocabulary;
import com.e2eq.conformance.graph.PolicyGraph;
import io.quarkus.logging.Log;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.shared.JenaException;

import java.io.StringReader;
import java.util.*;

/**
 * Parses Turtle into a {@link PolicyGraph} with Apache Jena.
 * <p>
 * Jena's blank node ids and statement iteration order differ between parses, so the graph is
 * rebuilt in a canonical order: IRI subjects sorted by IRI, each subject's statements sorted by
 * predicate then object, blank nodes visited depth-first and labelled {@code _:b1, _:b2, ...}
 * in encounter order.
 */
public final class JenaTurtleParser {

    private static final String BASE = OdrlVocabulary.EX;

    public PolicyGraph parse(String turtle) {
        Model model = ModelFactory.createDefaultModel();
        try {
            model.read(new StringReader(turtle), BASE, "TURTLE");
        } catch (JenaException e) {
            throw new DocumentParseException("Invalid Turtle: " + e.getMessage(), turtle, e);
        }
        Log.debugf("Parsed %d triples", model.size());
        return new Canonicalizer(model).build();
    }

    private static final class Canonicalizer {
        private final Model model;
        private final Map<Resource, String> blankLabels = new HashMap<>();
        private final Set<Resource> visited = new HashSet<>();
        private final PolicyGraph.Builder builder = PolicyGraph.builder();

        Canonicalizer(Model model) {
            this.model = model;
        }

        PolicyGraph build() {
            List<Resource> iris = new ArrayList<>();
            List<Resource> blanks = new ArrayList<>();
            for (Resource s : model.listSubjects().toList()) {
                if (s.isAnon()) blanks.add(s);
                else iris.add(s);
            }
            iris.sort(Comparator.comparing(Resource::getURI));
            for (Resource s : iris) {
                visit(s);
            }
            // blank subjects nothing points at
            blanks.sort(Comparator.comparing(this::signature));
            for (Resource s : blanks) {
                if (!visited.contains(s)) visit(s);
            }
            return builder.build();
        }

        private void visit(Resource subject) {
            if (!visited.add(subject)) return;
            GraphNode subjectNode = node(subject);
            List<Statement> statements = sorted(subject);
            List<Resource> children = new ArrayList<>();
            for (Statement st : statements) {
                RDFNode o = st.getObject();
                builder.add(subjectNode, st.getPredicate().getURI(), node(o));
                if (o.isAnon()) children.add(o.asResource());
            }
            for (Resource child : children) {
                visit(child);
            }
        }

        private List<Statement> sorted(Resource subject) {
            List<Statement> statements = model.listStatements(subject, null, (RDFNode) null).toList();
            statements.sort(Comparator
                    .comparing((Statement st) -> st.getPredicate().getURI())
                    .thenComparing(st -> objectKey(st.getObject())));
            return statements;
        }

        private GraphNode node(RDFNode n) {
            if (n.isURIResource()) {
                return GraphNode.iri(n.asResource().getURI());
            }
            if (n.isAnon()) {
                Resource r = n.asResource();
                return GraphNode.blank(blankLabels.computeIfAbsent(r, k -> "_:b" + (blankLabels.size() + 1)));
            }
            Literal lit = n.asLiteral();
            String lang = lit.getLanguage();
            if (lang != null && !lang.isEmpty()) {
                return GraphNode.langLiteral(lit.getLexicalForm(), lang);
            }
            String dt = lit.getDatatypeURI();
            if (dt == null || dt.equals(OdrlVocabulary.XSD + "string")) {
                return GraphNode.literal(lit.getLexicalForm());
            }
            return GraphNode.typedLiteral(lit.getLexicalForm(), dt);
        }

        private String objectKey(RDFNode o) {
            if (o.isURIResource()) return "1" + o.asResource().getURI();
            if (o.isLiteral()) {
                Literal l = o.asLiteral();
                return "2" + l.getLexicalForm() + "^^" + l.getDatatypeURI() + "@" + l.getLanguage();
            }
            return "3" + signature(o.asResource());
        }

        /** Shallow description of a blank node built from its non-blank statements. */
        private String signature(Resource blank) {
            List<String> parts = new ArrayList<>();
            for (Statement st : model.listStatements(blank, null, (RDFNode) null).toList()) {
                RDFNode o = st.getObject();
                String value = o.isAnon() ? "[]" : o.isLiteral() ? o.asLiteral().getLexicalForm() : o.asResource().getURI();
                parts.add(st.getPredicate().getURI() + "=" + value);
            }
            Collections.sort(parts);
            return String.join(";", parts);
        }
    }
}

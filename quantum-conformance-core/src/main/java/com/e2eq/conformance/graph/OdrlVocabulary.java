package com.e2eq.conformance.graph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * IRIs of the rights-expression vocabulary and the prefixes used to compact them in messages.
 */
public final class OdrlVocabulary {
    private OdrlVocabulary() {}

    public static final String ODRL = "http://www.w3.org/ns/odrl/2/";
    public static final String RDF = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String RDFS = "http://www.w3.org/2000/01/rdf-schema#";
    public static final String XSD = "http://www.w3.org/2001/XMLSchema#";
    public static final String DCT = "http://purl.org/dc/terms/";
    public static final String EX = "http://example.com/";

    public static final String RDF_TYPE = RDF + "type";

    public static final String POLICY = ODRL + "Policy";
    public static final String SET = ODRL + "Set";
    public static final String PERMISSION = ODRL + "Permission";
    public static final String PROHIBITION = ODRL + "Prohibition";
    public static final String DUTY = ODRL + "Duty";
    public static final String CONSTRAINT = ODRL + "Constraint";

    public static final String UID = ODRL + "uid";
    public static final String HAS_PERMISSION = ODRL + "permission";
    public static final String HAS_PROHIBITION = ODRL + "prohibition";
    public static final String HAS_OBLIGATION = ODRL + "obligation";
    public static final String HAS_CONSTRAINT = ODRL + "constraint";
    public static final String ACTION = ODRL + "action";
    public static final String TARGET = ODRL + "target";
    public static final String ASSIGNEE = ODRL + "assignee";
    public static final String ASSIGNER = ODRL + "assigner";
    public static final String LEFT_OPERAND = ODRL + "leftOperand";
    public static final String OPERATOR = ODRL + "operator";
    public static final String RIGHT_OPERAND = ODRL + "rightOperand";
    public static final String RIGHT_OPERAND_REFERENCE = ODRL + "rightOperandReference";

    private static final Map<String, String> PREFIXES = new LinkedHashMap<>();
    static {
        PREFIXES.put("odrl", ODRL);
        PREFIXES.put("rdf", RDF);
        PREFIXES.put("rdfs", RDFS);
        PREFIXES.put("xsd", XSD);
        PREFIXES.put("dct", DCT);
        PREFIXES.put("ex", EX);
    }

    public static Map<String, String> defaultPrefixes() {
        return Map.copyOf(PREFIXES);
    }

    /** Compacts a full IRI to {@code prefix:local} when a known namespace matches. */
    public static String compact(String iri) {
        if (iri == null) return null;
        for (Map.Entry<String, String> e : PREFIXES.entrySet()) {
            if (iri.startsWith(e.getValue()) && iri.length() > e.getValue().length()) {
                return e.getKey() + ":" + iri.substring(e.getValue().length());
            }
        }
        return iri;
    }

    /**
     * Expands {@code prefix:local} using the given prefix table, falling back to the default prefixes.
     * Absolute IRIs and unknown prefixes are returned unchanged.
     */
    public static String expand(String curie, Map<String, String> prefixes) {
        if (curie == null) return null;
        if (curie.startsWith("http://") || curie.startsWith("https://") || curie.startsWith("urn:")) {
            return curie;
        }
        int idx = curie.indexOf(':');
        if (idx <= 0) return curie;
        String prefix = curie.substring(0, idx);
        String ns = prefixes != null ? prefixes.get(prefix) : null;
        if (ns == null) ns = PREFIXES.get(prefix);
        return ns != null ? ns + curie.substring(idx + 1) : curie;
    }

    /** Local name after the last {@code /} or {@code #}. */
    public static String localName(String iri) {
        if (iri == null) return null;
        int idx = Math.max(iri.lastIndexOf('/'), iri.lastIndexOf('#'));
        return idx >= 0 && idx < iri.length() - 1 ? iri.substring(idx + 1) : iri;
    }
}

package com.e2eq.conformance;

import com.e2eq.conformance.graph.PolicyGraph;

/**
 * Small policy graphs shared by the engine and repair tests.
 */
public final class TestPolicies {

    private TestPolicies() {}

    /** ex:policy1 with a uid, one typed permission and a count / lteq / 10 constraint. */
    public static PolicyGraph valid() {
        return withConstraint("odrl:count", "odrl:lteq", true);
    }

    public static PolicyGraph withConstraint(String leftOperand, String operator, boolean withRightOperand) {
        PolicyGraph.Builder b = PolicyGraph.builder();
        b.type("ex:policy1", "odrl:Policy")
                .iri("ex:policy1", "odrl:uid", "ex:policy1");
        b.blank("ex:policy1", "odrl:permission", p -> p
                .type("odrl:Permission")
                .iri("odrl:action", "odrl:use")
                .iri("odrl:target", "ex:dataset1")
                .blank("odrl:constraint", c -> {
                    c.type("odrl:Constraint")
                            .iri("odrl:leftOperand", leftOperand)
                            .iri("odrl:operator", operator);
                    if (withRightOperand) {
                        c.typedLiteral("odrl:rightOperand", "10", "xsd:integer");
                    }
                }));
        return b.build();
    }

    public static PolicyGraph missingUid() {
        PolicyGraph.Builder b = PolicyGraph.builder();
        b.type("ex:policy1", "odrl:Policy");
        b.blank("ex:policy1", "odrl:permission", p -> p
                .type("odrl:Permission")
                .iri("odrl:action", "odrl:use"));
        return b.build();
    }

    public static PolicyGraph withoutRules() {
        return PolicyGraph.builder()
                .type("ex:policy1", "odrl:Policy")
                .iri("ex:policy1", "odrl:uid", "ex:policy1")
                .build();
    }
}

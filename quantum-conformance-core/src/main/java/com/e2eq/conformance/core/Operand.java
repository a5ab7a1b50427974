package com.e2eq.conformance.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A recognized left operand of a constraint with the operators it may be compared through.
 */
public record Operand(String name,
                      String iri,
                      String label,
                      String definition,
                      Set<Operator> compatibleOperators,
                      Optional<String> expectedDatatype) {

    public Operand {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(iri, "iri");
        compatibleOperators = compatibleOperators == null || compatibleOperators.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(compatibleOperators));
        expectedDatatype = expectedDatatype == null ? Optional.empty() : expectedDatatype;
    }

    public boolean accepts(Operator operator) {
        return compatibleOperators.contains(operator);
    }
}

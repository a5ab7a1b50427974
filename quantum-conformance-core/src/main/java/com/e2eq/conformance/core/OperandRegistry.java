package com.e2eq.conformance.core;

import java.util.List;
import java.util.Optional;

/**
 * Read-only table of recognized constraint operands. Implementations are fully built before
 * first use and safe for concurrent reads.
 */
public interface OperandRegistry {

    Optional<Operand> lookup(String name);

    Optional<Operand> lookupByIri(String iri);

    /** Operand names in declaration order. */
    List<String> listNames();

    default List<Operand> operands() {
        return listNames().stream().map(n -> lookup(n).orElseThrow()).toList();
    }

    static OperandRegistry of(List<Operand> operands) {
        return new InMemoryOperandRegistry(operands);
    }
}

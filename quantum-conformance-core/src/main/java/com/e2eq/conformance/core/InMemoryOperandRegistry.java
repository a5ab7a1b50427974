package com.e2eq.conformance.core;

import com.e2eq.conformance.exceptions.ConformanceConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryOperandRegistry implements OperandRegistry {
    private final Map<String, Operand> byName;
    private final Map<String, Operand> byIri;
    private final List<String> names;

    public InMemoryOperandRegistry(List<Operand> operands) {
        Map<String, Operand> names = new LinkedHashMap<>();
        Map<String, Operand> iris = new LinkedHashMap<>();
        for (Operand op : operands) {
            require(!op.name().isBlank(), "Operand name must be non-empty");
            require(!op.compatibleOperators().isEmpty(),
                    "Operand '" + op.name() + "' must declare at least one compatible operator");
            require(names.put(op.name(), op) == null, "Duplicate operand '" + op.name() + "'");
            require(iris.put(op.iri(), op) == null, "Duplicate operand IRI '" + op.iri() + "'");
        }
        this.byName = Collections.unmodifiableMap(names);
        this.byIri = Collections.unmodifiableMap(iris);
        this.names = List.copyOf(new ArrayList<>(names.keySet()));
    }

    @Override
    public Optional<Operand> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(byName.get(name));
    }

    @Override
    public Optional<Operand> lookupByIri(String iri) {
        return iri == null ? Optional.empty() : Optional.ofNullable(byIri.get(iri));
    }

    @Override
    public List<String> listNames() {
        return names;
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new ConformanceConfigurationException(msg);
    }
}

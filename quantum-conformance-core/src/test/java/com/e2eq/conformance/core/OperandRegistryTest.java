package com.e2eq.conformance.core;

import com.e2eq.conformance.exceptions.ConformanceConfigurationException;
import com.e2eq.conformance.graph.OdrlVocabulary;
import com.e2eq.conformance.io.ConformanceDefaults;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OperandRegistryTest {

    @Test
    void testDefaultTableInDeclarationOrder() {
        OperandRegistry registry = ConformanceDefaults.operands();
        assertEquals(List.of("dateTime", "count", "elapsedTime", "payAmount", "percentage", "spatial", "purpose", "recipient"),
                registry.listNames());
    }

    @Test
    void testLookupAndCompatibility() {
        OperandRegistry registry = ConformanceDefaults.operands();
        Operand count = registry.lookup("count").orElseThrow();
        assertEquals(OdrlVocabulary.ODRL + "count", count.iri());
        assertEquals(Optional.of(OdrlVocabulary.XSD + "integer"), count.expectedDatatype());
        assertTrue(count.accepts(Operator.LTEQ));
        assertFalse(count.accepts(Operator.IS_ANY_OF));

        Operand spatial = registry.lookupByIri(OdrlVocabulary.ODRL + "spatial").orElseThrow();
        assertTrue(spatial.expectedDatatype().isEmpty());
        assertEquals(EnumSet.of(Operator.EQ, Operator.IS_A, Operator.IS_ANY_OF, Operator.IS_NONE_OF),
                spatial.compatibleOperators());
    }

    @Test
    void testUnknownNameIsNotFound() {
        OperandRegistry registry = ConformanceDefaults.operands();
        assertTrue(registry.lookup("fileFormat").isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
        assertTrue(registry.lookupByIri("http://example.com/none").isEmpty());
    }

    @Test
    void testDuplicateNameFailsFast() {
        Operand a = new Operand("count", OdrlVocabulary.ODRL + "count", "Count", "", Set.of(Operator.EQ), Optional.empty());
        Operand b = new Operand("count", OdrlVocabulary.ODRL + "count2", "Count", "", Set.of(Operator.EQ), Optional.empty());
        ConformanceConfigurationException ex = assertThrows(ConformanceConfigurationException.class,
                () -> OperandRegistry.of(List.of(a, b)));
        assertTrue(ex.getMessage().contains("Duplicate operand 'count'"));
    }

    @Test
    void testEmptyOperatorSetFailsFast() {
        Operand a = new Operand("count", OdrlVocabulary.ODRL + "count", "Count", "", Set.of(), Optional.empty());
        assertThrows(ConformanceConfigurationException.class, () -> OperandRegistry.of(List.of(a)));
    }

    @Test
    void testOperatorLookup() {
        assertEquals(Optional.of(Operator.IS_ANY_OF), Operator.fromName("isAnyOf"));
        assertEquals(Optional.of(Operator.IS_ANY_OF), Operator.fromName("IS_ANY_OF"));
        assertEquals(Optional.of(Operator.LT), Operator.fromIri(OdrlVocabulary.ODRL + "lt"));
        assertTrue(Operator.fromName("between").isEmpty());
    }
}

package com.e2eq.conformance.io;

import com.e2eq.conformance.core.Operand;
import com.e2eq.conformance.core.OperandRegistry;
import com.e2eq.conformance.core.Operator;
import com.e2eq.conformance.exceptions.ConformanceConfigurationException;
import com.e2eq.conformance.graph.OdrlVocabulary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads the operand table from YAML.
 * <pre>
 * version: 1
 * operands:
 *   - name: count
 *     iri: odrl:count
 *     label: Count
 *     operators: [lt, lteq, gt, gteq, eq]
 *     datatype: xsd:integer
 * </pre>
 */
public final class YamlOperandLoader {

    public record YOperands(Integer version, Map<String, String> prefixes, List<YOperand> operands) {}
    public record YOperand(String name, String iri, String label, String definition,
                           List<String> operators, String datatype) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public OperandRegistry loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toRegistry(mapper.readValue(in, YOperands.class), resourcePath);
        }
    }

    public OperandRegistry loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toRegistry(mapper.readValue(in, YOperands.class), path.toString());
        }
    }

    public OperandRegistry load(InputStream in) throws IOException {
        return toRegistry(mapper.readValue(in, YOperands.class), "<stream>");
    }

    private OperandRegistry toRegistry(YOperands y, String source) {
        require(y != null && y.operands() != null && !y.operands().isEmpty(),
                source, "Operand table declares no operands");
        Map<String, String> prefixes = Optional.ofNullable(y.prefixes()).orElse(Map.of());
        List<Operand> operands = new ArrayList<>();
        for (YOperand o : y.operands()) {
            require(o.name() != null && !o.name().isBlank(), source, "Operand without a name");
            List<String> names = Optional.ofNullable(o.operators()).orElse(List.of());
            require(!names.isEmpty(), source, "Operand '" + o.name() + "' must declare at least one compatible operator");
            Set<Operator> ops = EnumSet.noneOf(Operator.class);
            for (String n : names) {
                Operator op = Operator.fromName(n).orElseThrow(() -> new ConformanceConfigurationException(
                        "Operand '" + o.name() + "' references unknown operator '" + n + "'", source, null));
                ops.add(op);
            }
            String iri = o.iri() != null && !o.iri().isBlank()
                    ? OdrlVocabulary.expand(o.iri(), prefixes)
                    : OdrlVocabulary.ODRL + o.name();
            operands.add(new Operand(
                    o.name(),
                    iri,
                    Optional.ofNullable(o.label()).orElse(o.name()),
                    Optional.ofNullable(o.definition()).orElse(""),
                    ops,
                    Optional.ofNullable(o.datatype()).filter(s -> !s.isBlank()).map(d -> OdrlVocabulary.expand(d, prefixes))));
        }
        try {
            return OperandRegistry.of(operands);
        } catch (ConformanceConfigurationException e) {
            throw new ConformanceConfigurationException(e.getMessage(), source, e);
        }
    }

    private static void require(boolean cond, String source, String msg) {
        if (!cond) throw new ConformanceConfigurationException(msg, source, null);
    }
}

package com.e2eq.conformance.io;

import com.e2eq.conformance.exceptions.ConformanceConfigurationException;
import com.e2eq.conformance.taxonomy.ConflictTaxonomy;
import com.e2eq.conformance.taxonomy.ConflictType;
import com.e2eq.conformance.taxonomy.DetectionStrategy;
import com.e2eq.conformance.taxonomy.RemediationAction;
import com.e2eq.conformance.taxonomy.ResolutionPrinciple;
import com.e2eq.conformance.taxonomy.RiskLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads the conflict detection strategy table from YAML and validates it into a
 * {@link ConflictTaxonomy}. Structural pattern values may be strings or booleans.
 */
public final class YamlStrategyLoader {

    public record YStrategies(Integer version, List<YStrategy> strategies) {}
    public record YStrategy(
            String type,
            Integer priority,
            Boolean requiresOntology,
            Boolean requiresGraphAnalysis,
            List<String> keywords,
            List<Map<String, Object>> patterns,
            String principle,
            String action,
            String risk
    ) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public ConflictTaxonomy loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toTaxonomy(mapper.readValue(in, YStrategies.class), resourcePath);
        }
    }

    public ConflictTaxonomy loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toTaxonomy(mapper.readValue(in, YStrategies.class), path.toString());
        }
    }

    public ConflictTaxonomy load(InputStream in) throws IOException {
        return toTaxonomy(mapper.readValue(in, YStrategies.class), "<stream>");
    }

    private ConflictTaxonomy toTaxonomy(YStrategies y, String source) {
        require(y != null && y.strategies() != null && !y.strategies().isEmpty(), source,
                "Strategy table declares no strategies");
        List<DetectionStrategy> strategies = new ArrayList<>();
        for (YStrategy s : y.strategies()) {
            ConflictType type = ConflictType.fromKey(s.type()).orElseThrow(() -> new ConformanceConfigurationException(
                    "Unknown conflict type '" + s.type() + "'", source, null));
            require(s.priority() != null, source, "Strategy '" + type.key() + "' has no priority");
            ResolutionPrinciple principle = ResolutionPrinciple.fromKey(s.principle()).orElseThrow(() ->
                    new ConformanceConfigurationException("Unknown resolution principle '" + s.principle()
                            + "' for '" + type.key() + "'", source, null));
            require(s.action() != null, source, "Strategy '" + type.key() + "' has no action");
            RemediationAction action;
            RiskLevel risk;
            try {
                action = RemediationAction.parse(s.action());
                risk = s.risk() != null ? RiskLevel.parse(s.risk()) : null;
            } catch (IllegalArgumentException e) {
                throw new ConformanceConfigurationException("Invalid action or risk for '" + type.key() + "'", source, e);
            }
            strategies.add(new DetectionStrategy(
                    type,
                    s.priority(),
                    Boolean.TRUE.equals(s.requiresOntology()),
                    Boolean.TRUE.equals(s.requiresGraphAnalysis()),
                    new LinkedHashSet<>(Optional.ofNullable(s.keywords()).orElse(List.of())),
                    patterns(s.patterns()),
                    principle,
                    action,
                    risk));
        }
        int version = Optional.ofNullable(y.version()).orElse(1);
        try {
            return new ConflictTaxonomy(version, strategies);
        } catch (ConformanceConfigurationException e) {
            throw new ConformanceConfigurationException(e.getMessage(), source, e);
        }
    }

    private static List<Map<String, String>> patterns(List<Map<String, Object>> raw) {
        if (raw == null) return List.of();
        List<Map<String, String>> out = new ArrayList<>();
        for (Map<String, Object> p : raw) {
            Map<String, String> m = new LinkedHashMap<>();
            p.forEach((k, v) -> m.put(k, String.valueOf(v)));
            out.add(m);
        }
        return out;
    }

    private static void require(boolean cond, String source, String msg) {
        if (!cond) throw new ConformanceConfigurationException(msg, source, null);
    }
}

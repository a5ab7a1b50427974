package com.e2eq.conformance.io;

import com.e2eq.conformance.core.ConformanceEngine;
import com.e2eq.conformance.core.OperandRegistry;
import com.e2eq.conformance.core.ShapeRuleSet;
import com.e2eq.conformance.exceptions.ConformanceConfigurationException;
import com.e2eq.conformance.taxonomy.ConflictTaxonomy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Locations of the bundled tables and helpers that load them. A location is read from the file
 * system when such a file exists, otherwise from the classpath.
 */
public final class ConformanceDefaults {

    public static final String OPERANDS_RESOURCE = "/conformance/operands.yaml";
    public static final String SHAPES_RESOURCE = "/conformance/shapes.yaml";
    public static final String STRATEGIES_RESOURCE = "/conformance/conflict-strategies.yaml";

    private ConformanceDefaults() {}

    public static OperandRegistry operands() {
        return operands(OPERANDS_RESOURCE);
    }

    public static ShapeRuleSet shapes(OperandRegistry operands) {
        return shapes(SHAPES_RESOURCE, operands);
    }

    public static ConflictTaxonomy taxonomy() {
        return taxonomy(STRATEGIES_RESOURCE);
    }

    public static ConformanceEngine engine() {
        OperandRegistry operands = operands();
        return new ConformanceEngine(shapes(operands), operands);
    }

    public static OperandRegistry operands(String location) {
        YamlOperandLoader loader = new YamlOperandLoader();
        try {
            Path p = fileOrNull(location);
            return p != null ? loader.loadFromPath(p) : loader.loadFromClasspath(classpath(location));
        } catch (IOException e) {
            throw new ConformanceConfigurationException("Cannot read operand table", location, e);
        }
    }

    public static ShapeRuleSet shapes(String location, OperandRegistry operands) {
        YamlShapeLoader loader = new YamlShapeLoader(operands);
        try {
            Path p = fileOrNull(location);
            return p != null ? loader.loadFromPath(p) : loader.loadFromClasspath(classpath(location));
        } catch (IOException e) {
            throw new ConformanceConfigurationException("Cannot read shape table", location, e);
        }
    }

    public static ConflictTaxonomy taxonomy(String location) {
        YamlStrategyLoader loader = new YamlStrategyLoader();
        try {
            Path p = fileOrNull(location);
            return p != null ? loader.loadFromPath(p) : loader.loadFromClasspath(classpath(location));
        } catch (IOException e) {
            throw new ConformanceConfigurationException("Cannot read strategy table", location, e);
        }
    }

    private static Path fileOrNull(String location) {
        if (location == null || location.isBlank()) {
            throw new ConformanceConfigurationException("Empty table location");
        }
        if (location.startsWith("classpath:")) return null;
        String f = location.startsWith("file:") ? location.substring("file:".length()) : location;
        try {
            Path p = Path.of(f);
            return Files.isRegularFile(p) ? p : null;
        } catch (InvalidPathException e) {
            // classpath locations such as /conformance/x.yaml are valid paths; others fall through here
            return null;
        }
    }

    private static String classpath(String location) {
        String l = location.startsWith("classpath:") ? location.substring("classpath:".length()) : location;
        return l.startsWith("/") ? l : "/" + l;
    }
}

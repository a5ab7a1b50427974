package com.e2eq.conformance.transducer;

import com.e2eq.conformance.core.OperandRegistry;
import com.e2eq.conformance.exceptions.ConformanceConfigurationException;
import com.e2eq.conformance.graph.OdrlVocabulary;
import com.e2eq.conformance.spi.PromptPayload;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders prompt payloads through classpath templates with {@code ${name}} placeholders.
 * Available names: {@code currentDate}, {@code policyId}, {@code requestText},
 * {@code documentText}, {@code feedback}, {@code attempt} and {@code leftOperands}, the latter
 * listing the registered operands so prompts follow the operand table in use.
 */
public class PromptTemplates {

    public static final String GENERATION_RESOURCE = "/prompts/generation.md";
    public static final String REGENERATION_RESOURCE = "/prompts/regeneration.md";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final String generation;
    private final String regeneration;
    private final Clock clock;
    private final String leftOperands;

    public PromptTemplates(String generation, String regeneration, Clock clock, OperandRegistry operands) {
        this.generation = generation;
        this.regeneration = regeneration;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.leftOperands = operands.operands().stream()
                .map(o -> "`" + OdrlVocabulary.compact(o.iri()) + "`")
                .collect(Collectors.joining(", "));
    }

    public static PromptTemplates fromClasspath(OperandRegistry operands) {
        return new PromptTemplates(read(GENERATION_RESOURCE), read(REGENERATION_RESOURCE), Clock.systemUTC(), operands);
    }

    public String render(PromptPayload payload) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("currentDate", LocalDate.now(clock).toString());
        vars.put("policyId", payload.policyId());
        vars.put("requestText", payload.requestText());
        vars.put("documentText", payload.documentText());
        vars.put("feedback", payload.feedback());
        vars.put("attempt", payload.attemptIndex());
        vars.put("leftOperands", leftOperands);
        String template = payload.kind() == PromptPayload.Kind.GENERATE ? generation : regeneration;
        return substitute(template, vars);
    }

    static String substitute(String template, Map<String, Object> parameters) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuffer sb = new StringBuffer();
        while (m.find()) {
            Object val = parameters.get(m.group(1));
            m.appendReplacement(sb, val != null ? Matcher.quoteReplacement(val.toString()) : "");
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String read(String resource) {
        try (InputStream in = PromptTemplates.class.getResourceAsStream(resource)) {
            if (in == null) throw new IOException("Resource not found: " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConformanceConfigurationException("Cannot read prompt template", resource, e);
        }
    }
}

package com.e2eq.conformance.runtime;

import com.e2eq.conformance.core.ConformanceEngine;
import com.e2eq.conformance.core.OperandRegistry;
import com.e2eq.conformance.core.ShapeRuleSet;
import com.e2eq.conformance.io.ConformanceDefaults;
import com.e2eq.conformance.repair.RepairOrchestrator;
import com.e2eq.conformance.repair.RepairSettings;
import com.e2eq.conformance.spi.DocumentDecoder;
import com.e2eq.conformance.spi.TextTransducer;
import com.e2eq.conformance.taxonomy.ConflictAssessor;
import com.e2eq.conformance.taxonomy.ConflictClassifier;
import com.e2eq.conformance.taxonomy.ConflictExplainer;
import com.e2eq.conformance.taxonomy.ConflictTaxonomy;
import com.e2eq.conformance.transducer.ChatCompletionTransducer;
import com.e2eq.conformance.transducer.PromptTemplates;
import com.e2eq.conformance.turtle.TurtleDocumentDecoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Loads the operand, shape and strategy tables once at startup and exposes the engine, the
 * classifier and the repair orchestrator for injection. A malformed table fails startup.
 */
@ApplicationScoped
public class ConformanceProducer {

    private final ConformanceConfig config;
    private final ObjectMapper objectMapper;

    private OperandRegistry operands;
    private ShapeRuleSet shapes;
    private ConflictTaxonomy taxonomy;

    @Inject
    public ConformanceProducer(ConformanceConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        this.operands = ConformanceDefaults.operands(config.operandsResource());
        this.shapes = ConformanceDefaults.shapes(config.shapesResource(), operands);
        this.taxonomy = ConformanceDefaults.taxonomy(config.strategiesResource());
        Log.infof("Conformance tables loaded: %d operands, %d shapes, %d strategies",
                operands.listNames().size(), shapes.rules().size(), taxonomy.strategies().size());
    }

    @Produces
    public OperandRegistry operandRegistry() {
        return operands;
    }

    @Produces
    public ShapeRuleSet shapeRuleSet() {
        return shapes;
    }

    @Produces
    public ConflictTaxonomy conflictTaxonomy() {
        return taxonomy;
    }

    @Produces
    @Singleton
    public ConformanceEngine conformanceEngine() {
        return new ConformanceEngine(shapes, operands);
    }

    @Produces
    @Singleton
    public ConflictClassifier conflictClassifier() {
        return new ConflictClassifier(taxonomy);
    }

    @Produces
    @Singleton
    public ConflictAssessor conflictAssessor(ConflictClassifier classifier) {
        return new ConflictAssessor(classifier);
    }

    @Produces
    @Singleton
    public ConflictExplainer conflictExplainer() {
        return new ConflictExplainer(taxonomy);
    }

    @Produces
    @Singleton
    public DocumentDecoder documentDecoder() {
        return new TurtleDocumentDecoder();
    }

    @Produces
    @Singleton
    public TextTransducer textTransducer() {
        ConformanceConfig.Transducer t = config.transducer();
        ChatCompletionTransducer.Endpoint endpoint = new ChatCompletionTransducer.Endpoint(
                t.endpointKind(), t.baseUrl(), t.apiKey().orElse(null), t.model(), t.temperature(),
                t.apiVersion(), config.attemptTimeout());
        return new ChatCompletionTransducer(endpoint, PromptTemplates.fromClasspath(operands), objectMapper);
    }

    @Produces
    @Singleton
    public RepairOrchestrator repairOrchestrator(ConformanceEngine engine, TextTransducer transducer,
                                                 DocumentDecoder decoder) {
        return new RepairOrchestrator(engine, transducer, decoder,
                new RepairSettings(config.maxAttempts(), config.attemptTimeout()));
    }

    void closeOrchestrator(@Disposes RepairOrchestrator orchestrator) {
        orchestrator.close();
    }
}

package com.e2eq.conformance.runtime;

import com.e2eq.conformance.core.ConformanceEngine;
import com.e2eq.conformance.core.DocumentContext;
import com.e2eq.conformance.core.ViolationReport;
import com.e2eq.conformance.repair.CancellationToken;
import com.e2eq.conformance.repair.RepairOrchestrator;
import com.e2eq.conformance.repair.RepairOutcome;
import com.e2eq.conformance.spi.CandidateDocument;
import com.e2eq.conformance.spi.DocumentDecoder;
import com.e2eq.conformance.spi.PromptPayload;
import com.e2eq.conformance.spi.TextTransducer;
import com.e2eq.conformance.taxonomy.ConflictAssessor;
import com.e2eq.conformance.taxonomy.ConflictClassification;
import com.e2eq.conformance.taxonomy.ConflictClassifier;
import com.e2eq.conformance.taxonomy.ConflictSignal;
import com.e2eq.conformance.taxonomy.PolicyAssessment;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.UUID;

/**
 * Entry points for generating, validating and classifying policies.
 */
@ApplicationScoped
public class PolicyConformanceService {

    /** Result of a generation run. */
    public record GenerationResult(String policyId, RepairOutcome outcome) {
        public boolean isConformant() {
            return outcome.isSuccess();
        }

        public String documentText() {
            return outcome.finalDocument().text();
        }
    }

    private final ConformanceEngine engine;
    private final TextTransducer transducer;
    private final DocumentDecoder decoder;
    private final RepairOrchestrator orchestrator;
    private final ConflictClassifier classifier;
    private final ConflictAssessor assessor;

    @Inject
    public PolicyConformanceService(ConformanceEngine engine, TextTransducer transducer, DocumentDecoder decoder,
                                    RepairOrchestrator orchestrator, ConflictClassifier classifier,
                                    ConflictAssessor assessor) {
        this.engine = engine;
        this.transducer = transducer;
        this.decoder = decoder;
        this.orchestrator = orchestrator;
        this.classifier = classifier;
        this.assessor = assessor;
    }

    public GenerationResult generate(String requestText) {
        return generate(requestText, null, CancellationToken.none());
    }

    /**
     * Generates a policy for the request and drives it through the repair loop.
     *
     * @param policyId identifier embedded in the policy IRI; a random 8 hex character id when blank
     * @throws com.e2eq.conformance.exceptions.TransducerException when the first generation call fails
     * @throws com.e2eq.conformance.exceptions.DocumentParseException when the first output has no parseable document
     */
    public GenerationResult generate(String requestText, String policyId, CancellationToken token) {
        String id = policyId == null || policyId.isBlank()
                ? UUID.randomUUID().toString().replace("-", "").substring(0, 8)
                : policyId;
        Log.infof("Generating policy %s from %d characters of request text", id,
                requestText == null ? 0 : requestText.length());

        String raw = transducer.transduce(PromptPayload.generation(requestText, id));
        CandidateDocument initial = decoder.decode(raw);
        RepairOutcome outcome = orchestrator.repair(new DocumentContext(requestText, initial.text()), initial, token);
        Log.infof("Policy %s finished as %s after %d attempt(s)", id, outcome.state(), outcome.attemptsUsed());
        return new GenerationResult(id, outcome);
    }

    /**
     * Validates an existing Turtle document without regeneration.
     */
    public ViolationReport validate(String requestText, String turtle) {
        CandidateDocument doc = decoder.decode(turtle);
        return engine.validate(new DocumentContext(requestText, doc.text()), doc.graph());
    }

    public ConflictClassification classify(ConflictSignal signal) {
        return classifier.classify(signal);
    }

    public PolicyAssessment assess(List<ConflictSignal> signals) {
        return assessor.assess(signals);
    }
}

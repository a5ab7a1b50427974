package com.e2eq.conformance.taxonomy;

import com.e2eq.conformance.exceptions.NoMatchingStrategyException;
import io.quarkus.logging.Log;

import java.util.Objects;
import java.util.Optional;

/**
 * First-match-wins classification: strategies are scanned in ascending priority and the first
 * one whose triggers the signal satisfies decides the category, so an ambiguous signal always
 * resolves toward the higher-precedence category.
 */
public final class ConflictClassifier {
    private final ConflictTaxonomy taxonomy;

    public ConflictClassifier(ConflictTaxonomy taxonomy) {
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy");
    }

    /**
     * @throws NoMatchingStrategyException when no strategy matches
     */
    public ConflictClassification classify(ConflictSignal signal) {
        return tryClassify(signal).orElseThrow(() -> new NoMatchingStrategyException(signal));
    }

    public Optional<ConflictClassification> tryClassify(ConflictSignal signal) {
        Objects.requireNonNull(signal, "signal");
        for (DetectionStrategy s : taxonomy.strategies()) {
            String trigger = s.matchedTrigger(signal);
            if (trigger != null) {
                Log.debugf("Signal %s classified as %s via %s (priority %d)", signal, s.type(), trigger, s.priority());
                return Optional.of(new ConflictClassification(s.type(), s, trigger));
            }
        }
        Log.debugf("Signal %s matched no detection strategy", signal);
        return Optional.empty();
    }
}

package com.e2eq.conformance.spi;

import java.util.Objects;

/**
 * Input handed to a {@link TextTransducer}. Generation payloads carry the policy request;
 * regeneration payloads also carry the current document and the rendered violation feedback.
 */
public record PromptPayload(Kind kind,
                            String requestText,
                            String policyId,
                            String documentText,
                            String feedback,
                            int attemptIndex) {

    public enum Kind { GENERATE, REGENERATE }

    public PromptPayload {
        Objects.requireNonNull(kind, "kind");
        requestText = requestText == null ? "" : requestText;
    }

    public static PromptPayload generation(String requestText, String policyId) {
        return new PromptPayload(Kind.GENERATE, requestText, policyId, null, null, 0);
    }

    public static PromptPayload regeneration(String requestText, String documentText, String feedback, int attemptIndex) {
        return new PromptPayload(Kind.REGENERATE, requestText, null, documentText, feedback, attemptIndex);
    }
}
